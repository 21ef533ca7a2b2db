package io.consul.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.type.TypeReference;
import io.consul.common.ConsulErrorMessages;
import io.consul.spec.DecodeException;
import io.consul.spec.EmptyKeyException;
import io.consul.spec.KVPair;
import io.consul.spec.MissingParameterException;
import io.consul.spec.QueryOptions;
import io.consul.spec.QueryResult;
import io.consul.spec.WriteOptions;
import io.consul.spec.WriteResult;
import io.consul.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The {@code /v1/kv} endpoints.
 * <p>
 * Values are written as raw bytes and read back base64 encoded inside {@link KVPair}. A read of a key that does
 * not exist fails with a {@link io.consul.spec.RequestFailedException} carrying status {@code 404}.
 * <p>
 * Operations on a single key reject an empty key with {@link EmptyKeyException}; prefix operations accept it
 * and then act on the whole store.
 */
public final class KVClient {

    private static final String KV = "/v1/kv/";

    private static final TypeReference<List<KVPair>> PAIR_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> KEY_LIST = new TypeReference<>() {};

    private final RequestDispatcher dispatcher;

    KVClient(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public CompletableFuture<QueryResult<List<KVPair>>> get(String key, @Nullable QueryOptions options) {
        Assert.checkNotNullParam("key", key);
        if (key.isEmpty()) {
            return CompletableFuture.failedFuture(new EmptyKeyException());
        }
        return dispatcher.read(path(key), PAIR_LIST, Map.of(), options);
    }

    /**
     * List every pair below a prefix.
     */
    public CompletableFuture<QueryResult<List<KVPair>>> list(String prefix, @Nullable QueryOptions options) {
        Assert.checkNotNullParam("prefix", prefix);
        return dispatcher.read(path(prefix), PAIR_LIST, flag("recurse"), options);
    }

    /**
     * List the keys below a prefix without their values.
     *
     * @param prefix the prefix, empty for the whole store
     * @param separator only list keys up to this separator, or {@code null} to list every key
     * @param options the query options, or {@code null}
     * @return the keys
     */
    public CompletableFuture<QueryResult<List<String>>> keys(String prefix, @Nullable String separator,
                                                            @Nullable QueryOptions options) {
        Assert.checkNotNullParam("prefix", prefix);
        Map<String, @Nullable String> params = new LinkedHashMap<>();
        params.put("keys", null);
        if (!Assert.isNullOrEmpty(separator)) {
            params.put("separator", separator);
        }
        return dispatcher.read(path(prefix), KEY_LIST, params, options);
    }

    /**
     * Write a pair. Non-zero {@link KVPair#flags() flags} are stored along with the value.
     *
     * @return {@code true} if the value was written
     */
    public CompletableFuture<WriteResult<Boolean>> put(KVPair pair, @Nullable WriteOptions options) {
        return put(pair, Map.of(), options);
    }

    /**
     * Write a pair only if its modify index still equals {@code cas}. A {@code cas} of {@code 0} only
     * writes a key that does not exist yet.
     *
     * @return {@code true} if the value was written, {@code false} if the index had moved
     */
    public CompletableFuture<WriteResult<Boolean>> putCas(KVPair pair, long cas, @Nullable WriteOptions options) {
        return put(pair, Map.of("cas", Long.toUnsignedString(cas)), options);
    }

    /**
     * Write a pair only if its modify index is still the {@link KVPair#modifyIndex() one it was read with}.
     *
     * @return {@code true} if the value was written, {@code false} if the index had moved
     */
    public CompletableFuture<WriteResult<Boolean>> putCas(KVPair pair, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("pair", pair);
        return putCas(pair, pair.modifyIndex(), options);
    }

    /**
     * Write a pair and take the lock on its key for a session.
     *
     * @return {@code true} if the lock was acquired
     */
    public CompletableFuture<WriteResult<Boolean>> acquire(KVPair pair, String session,
                                                           @Nullable WriteOptions options) {
        Assert.checkNotNullParam("session", session);
        if (session.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("session"));
        }
        return put(pair, Map.of("acquire", session), options);
    }

    /**
     * Write a pair and give up the lock a session holds on its key.
     *
     * @return {@code true} if the lock was released
     */
    public CompletableFuture<WriteResult<Boolean>> release(KVPair pair, String session,
                                                           @Nullable WriteOptions options) {
        Assert.checkNotNullParam("session", session);
        if (session.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("session"));
        }
        return put(pair, Map.of("release", session), options);
    }

    public CompletableFuture<WriteResult<Boolean>> delete(String key, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("key", key);
        if (key.isEmpty()) {
            return CompletableFuture.failedFuture(new EmptyKeyException());
        }
        return dispatcher.write(HttpMethod.DELETE, path(key), null, Boolean.class, Map.of(), options);
    }

    /**
     * Delete every key below a prefix. An empty prefix deletes the whole store.
     */
    public CompletableFuture<WriteResult<Boolean>> deleteTree(String prefix, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("prefix", prefix);
        return dispatcher.write(HttpMethod.DELETE, path(prefix), null, Boolean.class, flag("recurse"), options);
    }

    /**
     * Delete a key only if its modify index still equals {@code cas}.
     */
    public CompletableFuture<WriteResult<Boolean>> deleteCas(String key, long cas, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("key", key);
        if (key.isEmpty()) {
            return CompletableFuture.failedFuture(new EmptyKeyException());
        }
        return dispatcher.write(HttpMethod.DELETE, path(key), null, Boolean.class,
                Map.of("cas", Long.toUnsignedString(cas)), options);
    }

    private CompletableFuture<WriteResult<Boolean>> put(KVPair pair, Map<String, @Nullable String> extra,
                                                        @Nullable WriteOptions options) {
        Assert.checkNotNullParam("pair", pair);
        if (pair.key().isEmpty()) {
            return CompletableFuture.failedFuture(new EmptyKeyException());
        }
        Map<String, @Nullable String> params = new LinkedHashMap<>();
        if (pair.flags() != 0) {
            params.put("flags", Long.toUnsignedString(pair.flags()));
        }
        params.putAll(extra);
        byte[] value;
        try {
            value = pair.decodedValue();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new DecodeException(ConsulErrorMessages.ENCODE_BODY_FAILED, e));
        }
        return dispatcher.write(path(pair.key()), value, Boolean.class, params, options);
    }

    private static String path(String key) {
        return KV + PathSegments.key(key);
    }

    private static Map<String, @Nullable String> flag(String name) {
        return Collections.singletonMap(name, null);
    }
}
