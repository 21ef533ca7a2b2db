package io.consul.client;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.consul.client.http.HttpClient;
import io.consul.client.http.HttpResponse;
import io.consul.common.ConsulErrorMessages;
import io.consul.spec.ConsulHttpException;
import io.consul.spec.DecodeException;
import io.consul.spec.QueryMeta;
import io.consul.spec.QueryOptions;
import io.consul.spec.QueryResult;
import io.consul.spec.RequestFailedException;
import io.consul.spec.WriteMeta;
import io.consul.spec.WriteOptions;
import io.consul.spec.WriteResult;
import io.consul.util.Assert;
import io.consul.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a typed request into one HTTP exchange with Consul and the exchange back into a typed result.
 * <p>
 * Reads apply the blocking query protocol: a non-zero {@link QueryOptions#waitIndex() wait index} makes the
 * server hold the request until the data changes past that index or the wait elapses. The returned
 * {@link QueryMeta#lastIndex()} is the index to block on next.
 * <p>
 * Every failure completes the returned future exceptionally with a
 * {@link io.consul.spec.ConsulClientException} subtype. Nothing is retried.
 */
public class RequestDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestDispatcher.class);

    public static final String TOKEN_HEADER = "X-Consul-Token";
    public static final String INDEX_HEADER = "X-Consul-Index";
    public static final String KNOWN_LEADER_HEADER = "X-Consul-KnownLeader";
    public static final String LAST_CONTACT_HEADER = "X-Consul-LastContact";
    public static final String CONTENT_HASH_HEADER = "X-Consul-ContentHash";

    private final ConsulConfig config;
    private final HttpClient httpClient;

    public RequestDispatcher(ConsulConfig config) {
        this.config = Assert.checkNotNullParam("config", config);
        this.httpClient = config.getHttpClient();
    }

    public ConsulConfig getConfig() {
        return config;
    }

    public <T> CompletableFuture<QueryResult<T>> read(String path, Class<T> type, Map<String, @Nullable String> params,
                                                      @Nullable QueryOptions options) {
        return read(path, javaType(type), params, options, true);
    }

    public <T> CompletableFuture<QueryResult<T>> read(String path, TypeReference<T> type,
                                                      Map<String, @Nullable String> params,
                                                      @Nullable QueryOptions options) {
        return read(path, javaType(type), params, options, true);
    }

    /**
     * Read an agent-local endpoint. Such endpoints answer from the local agent's state and do not send an
     * {@code X-Consul-Index} header; the returned index is {@code 0} when the header is absent.
     */
    public <T> CompletableFuture<QueryResult<T>> readUnindexed(String path, Class<T> type,
                                                               Map<String, @Nullable String> params,
                                                               @Nullable QueryOptions options) {
        return read(path, javaType(type), params, options, false);
    }

    public <T> CompletableFuture<QueryResult<T>> readUnindexed(String path, TypeReference<T> type,
                                                               Map<String, @Nullable String> params,
                                                               @Nullable QueryOptions options) {
        return read(path, javaType(type), params, options, false);
    }

    /**
     * Send a {@code PUT}. A {@code byte[]} body is sent as is, any other body as JSON.
     */
    public <T> CompletableFuture<WriteResult<T>> write(String path, @Nullable Object body, Class<T> type,
                                                       Map<String, @Nullable String> params,
                                                       @Nullable WriteOptions options) {
        return write(HttpMethod.PUT, path, body, javaType(type), params, options);
    }

    public <T> CompletableFuture<WriteResult<T>> write(String path, @Nullable Object body, TypeReference<T> type,
                                                       Map<String, @Nullable String> params,
                                                       @Nullable WriteOptions options) {
        return write(HttpMethod.PUT, path, body, javaType(type), params, options);
    }

    public <T> CompletableFuture<WriteResult<T>> write(HttpMethod method, String path, @Nullable Object body,
                                                       Class<T> type, Map<String, @Nullable String> params,
                                                       @Nullable WriteOptions options) {
        return write(method, path, body, javaType(type), params, options);
    }

    private <T> CompletableFuture<QueryResult<T>> read(String path, JavaType type,
                                                       Map<String, @Nullable String> params,
                                                       @Nullable QueryOptions options, boolean indexRequired) {
        QueryOptions queryOptions = Utils.defaultIfNull(options, QueryOptions.DEFAULT);
        HttpClient.GetRequestBuilder request = httpClient.get(path)
                .addQueryParams(queryParams(params, queryOptions))
                .timeout(timeout(queryOptions));
        String token = resolve(queryOptions.token(), config.getToken());
        if (token != null) {
            request.addHeader(TOKEN_HEADER, token);
        }

        return exchange(HttpMethod.GET, path, request).thenCompose(exchange -> {
            try {
                QueryMeta meta = decodeQueryMeta(exchange.response(), exchange.requestTime(), indexRequired);
                T value = decodeBody(exchange.body(), type);
                return CompletableFuture.completedFuture(new QueryResult<>(value, meta));
            } catch (DecodeException e) {
                return CompletableFuture.failedFuture(e);
            }
        });
    }

    private <T> CompletableFuture<WriteResult<T>> write(HttpMethod method, String path, @Nullable Object body,
                                                        JavaType type, Map<String, @Nullable String> params,
                                                        @Nullable WriteOptions options) {
        WriteOptions writeOptions = Utils.defaultIfNull(options, WriteOptions.DEFAULT);
        HttpClient.RequestBuilder<?> request;
        try {
            request = newRequest(method, path, body);
        } catch (DecodeException e) {
            return CompletableFuture.failedFuture(e);
        }
        request.addQueryParams(writeParams(params, writeOptions))
                .timeout(config.getTimeout());
        String token = resolve(writeOptions.token(), config.getToken());
        if (token != null) {
            request.addHeader(TOKEN_HEADER, token);
        }

        return exchange(method, path, request).thenCompose(exchange -> {
            try {
                T value = decodeBody(exchange.body(), type);
                return CompletableFuture.completedFuture(new WriteResult<>(value, new WriteMeta(exchange.requestTime())));
            } catch (DecodeException e) {
                return CompletableFuture.failedFuture(e);
            }
        });
    }

    private HttpClient.RequestBuilder<?> newRequest(HttpMethod method, String path, @Nullable Object body)
            throws DecodeException {
        return switch (method) {
            case GET -> httpClient.get(path);
            case DELETE -> httpClient.delete(path);
            case PUT -> withBody(httpClient.put(path), body);
            case POST -> withBody(httpClient.post(path), body);
        };
    }

    private static <B extends HttpClient.BodyRequestBuilder<B>> B withBody(B request, @Nullable Object body)
            throws DecodeException {
        if (body == null) {
            return request;
        }
        if (body instanceof byte[] bytes) {
            return request.addHeader(HttpClient.CONTENT_TYPE, HttpClient.APPLICATION_OCTET_STREAM).body(bytes);
        }
        try {
            return request.addHeader(HttpClient.CONTENT_TYPE, HttpClient.APPLICATION_JSON)
                    .body(Utils.toJsonString(body));
        } catch (JsonProcessingException e) {
            throw new DecodeException(ConsulErrorMessages.ENCODE_BODY_FAILED, e);
        }
    }

    private CompletableFuture<Exchange> exchange(HttpMethod method, String path, HttpClient.RequestBuilder<?> request) {
        LOGGER.debug("{} {}{}", method, config.getAddress(), path);
        long start = System.nanoTime();

        CompletableFuture<HttpResponse> sent;
        try {
            sent = request.send();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new ConsulHttpException(e));
        }

        CompletableFuture<Exchange> result = new CompletableFuture<>();
        sent.whenComplete((response, error) -> {
            if (error != null) {
                result.completeExceptionally(new ConsulHttpException(unwrap(error)));
                return;
            }
            if (!response.success()) {
                LOGGER.trace("{} {} failed with status {}", method, path, response.statusCode());
                result.completeExceptionally(new RequestFailedException(response.statusCode()));
                return;
            }
            response.body().whenComplete((body, bodyError) -> {
                if (bodyError != null) {
                    result.completeExceptionally(new ConsulHttpException(unwrap(bodyError)));
                    return;
                }
                Duration requestTime = Duration.ofNanos(System.nanoTime() - start);
                LOGGER.trace("{} {} completed with status {} in {} ms", method, path, response.statusCode(),
                        requestTime.toMillis());
                result.complete(new Exchange(response, body, requestTime));
            });
        });
        return result;
    }

    /**
     * Assemble the query parameters of a read: the endpoint's own parameters first, then datacenter,
     * consistency mode, blocking parameters, {@code near} and {@code filter}.
     */
    Map<String, @Nullable String> queryParams(Map<String, @Nullable String> params, QueryOptions options) {
        Map<String, @Nullable String> query = new LinkedHashMap<>(params);
        String datacenter = resolve(options.datacenter(), config.getDatacenter());
        if (datacenter != null) {
            query.put("dc", datacenter);
        }
        String consistency = options.consistencyMode().queryParameter();
        if (consistency != null) {
            query.put(consistency, null);
        }
        if (options.isIndexBlocking()) {
            query.put("index", Long.toUnsignedString(options.waitIndex()));
            query.put("wait", formatWait(waitTime(options)));
        } else if (options.isHashBlocking()) {
            query.put("hash", options.waitHash());
            query.put("wait", formatWait(waitTime(options)));
        }
        if (!Assert.isNullOrEmpty(options.near())) {
            query.put("near", options.near());
        }
        if (!Assert.isNullOrEmpty(options.filter())) {
            query.put("filter", options.filter());
        }
        return query;
    }

    Map<String, @Nullable String> writeParams(Map<String, @Nullable String> params, WriteOptions options) {
        Map<String, @Nullable String> query = new LinkedHashMap<>(params);
        String datacenter = resolve(options.datacenter(), config.getDatacenter());
        if (datacenter != null) {
            query.put("dc", datacenter);
        }
        if (options.relayFactor() > 0) {
            query.put("relay-factor", Integer.toString(options.relayFactor()));
        }
        return query;
    }

    /**
     * A blocking read may legitimately take the whole wait plus the server's jitter of up to wait/16,
     * so its timeout is extended by that much over the configured one.
     */
    Duration timeout(QueryOptions options) {
        if (!options.isIndexBlocking() && !options.isHashBlocking()) {
            return config.getTimeout();
        }
        Duration wait = waitTime(options);
        return wait.plus(wait.dividedBy(16)).plus(config.getTimeout());
    }

    private Duration waitTime(QueryOptions options) {
        return Utils.defaultIfNull(options.waitTime(), config.getWaitTime());
    }

    static String formatWait(Duration wait) {
        return wait.toMillis() + "ms";
    }

    private static @Nullable String resolve(@Nullable String value, @Nullable String fallback) {
        return Assert.isNullOrEmpty(value) ? fallback : value;
    }

    static QueryMeta decodeQueryMeta(HttpResponse response, Duration requestTime, boolean indexRequired)
            throws DecodeException {
        long lastIndex = 0;
        Optional<String> index = response.header(INDEX_HEADER);
        if (index.isPresent()) {
            try {
                lastIndex = Long.parseUnsignedLong(index.get().trim());
            } catch (NumberFormatException e) {
                throw new DecodeException(String.format(ConsulErrorMessages.INVALID_INDEX_HEADER, index.get()), e);
            }
        } else if (indexRequired) {
            throw new DecodeException(ConsulErrorMessages.MISSING_INDEX_HEADER);
        }

        boolean knownLeader = response.header(KNOWN_LEADER_HEADER)
                .map(value -> Boolean.parseBoolean(value.trim()))
                .orElse(false);

        Duration lastContact = Duration.ZERO;
        Optional<String> contact = response.header(LAST_CONTACT_HEADER);
        if (contact.isPresent()) {
            try {
                lastContact = Duration.ofMillis(Long.parseLong(contact.get().trim()));
            } catch (NumberFormatException e) {
                throw new DecodeException(String.format(ConsulErrorMessages.INVALID_LAST_CONTACT_HEADER,
                        contact.get()), e);
            }
        }

        String contentHash = response.header(CONTENT_HASH_HEADER).orElse(null);
        return new QueryMeta(lastIndex, contentHash, knownLeader, lastContact, requestTime);
    }

    /**
     * Decode a body into the requested type. An empty body or a JSON {@code null} becomes the empty value
     * of the type; {@link Void} is never decoded.
     */
    static <T> @Nullable T decodeBody(String body, JavaType type) throws DecodeException {
        if (type.getRawClass() == Void.class) {
            return null;
        }
        try {
            if (!body.isBlank()) {
                T value = Utils.unmarshalFrom(body, type);
                if (value != null) {
                    return value;
                }
            }
            return emptyValue(type);
        } catch (JsonProcessingException e) {
            throw new DecodeException(ConsulErrorMessages.DECODE_BODY_FAILED, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T emptyValue(JavaType type) throws JsonProcessingException {
        Class<?> raw = type.getRawClass();
        if (type.isCollectionLikeType() || type.isArrayType()) {
            return Utils.unmarshalFrom("[]", type);
        }
        if (type.isMapLikeType()) {
            return Utils.unmarshalFrom("{}", type);
        }
        if (raw == String.class) {
            return (T) "";
        }
        if (raw == Boolean.class) {
            return (T) Boolean.FALSE;
        }
        if (Number.class.isAssignableFrom(raw)) {
            return Utils.unmarshalFrom("0", type);
        }
        return Utils.unmarshalFrom("{}", type);
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static JavaType javaType(Class<?> type) {
        return Utils.OBJECT_MAPPER.getTypeFactory().constructType(type);
    }

    private static JavaType javaType(TypeReference<?> type) {
        return Utils.OBJECT_MAPPER.getTypeFactory().constructType(type);
    }

    private record Exchange(HttpResponse response, String body, Duration requestTime) {
    }
}
