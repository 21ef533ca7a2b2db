package io.consul.client;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.type.TypeReference;
import io.consul.spec.MissingParameterException;
import io.consul.spec.QueryOptions;
import io.consul.spec.QueryResult;
import io.consul.spec.SessionCreated;
import io.consul.spec.SessionEntry;
import io.consul.spec.WriteOptions;
import io.consul.spec.WriteResult;
import io.consul.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The {@code /v1/session} endpoints. Sessions back the locks of the KV store.
 */
public final class SessionClient {

    private static final String SESSION = "/v1/session";

    private static final TypeReference<List<SessionEntry>> SESSION_LIST = new TypeReference<>() {};

    private final RequestDispatcher dispatcher;

    SessionClient(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Create a session.
     *
     * @param session the session to create, see {@link SessionEntry#create}
     * @param options the write options, or {@code null}
     * @return the ID of the new session
     */
    public CompletableFuture<WriteResult<SessionCreated>> create(SessionEntry session, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("session", session);
        return dispatcher.write(SESSION + "/create", session, SessionCreated.class, Map.of(), options);
    }

    public CompletableFuture<WriteResult<Boolean>> destroy(String id, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("id", id);
        if (id.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("session"));
        }
        return dispatcher.write(SESSION + "/destroy/" + PathSegments.segment(id), null, Boolean.class, Map.of(),
                options);
    }

    /**
     * Look up a session. The list is empty when the session does not exist.
     */
    public CompletableFuture<QueryResult<List<SessionEntry>>> info(String id, @Nullable QueryOptions options) {
        Assert.checkNotNullParam("id", id);
        if (id.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("session"));
        }
        return dispatcher.read(SESSION + "/info/" + PathSegments.segment(id), SESSION_LIST, Map.of(), options);
    }

    public CompletableFuture<QueryResult<List<SessionEntry>>> nodeSessions(String node,
                                                                          @Nullable QueryOptions options) {
        Assert.checkNotNullParam("node", node);
        if (node.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("node"));
        }
        return dispatcher.read(SESSION + "/node/" + PathSegments.segment(node), SESSION_LIST, Map.of(), options);
    }

    public CompletableFuture<QueryResult<List<SessionEntry>>> list(@Nullable QueryOptions options) {
        return dispatcher.read(SESSION + "/list", SESSION_LIST, Map.of(), options);
    }

    /**
     * Reset the TTL of a session.
     *
     * @return the renewed session, in a list of one element
     */
    public CompletableFuture<WriteResult<List<SessionEntry>>> renew(String id, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("id", id);
        if (id.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("session"));
        }
        return dispatcher.write(SESSION + "/renew/" + PathSegments.segment(id), null, SESSION_LIST, Map.of(),
                options);
    }
}
