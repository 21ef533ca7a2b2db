package io.consul.client;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.type.TypeReference;
import io.consul.spec.CAConfig;
import io.consul.spec.CARootList;
import io.consul.spec.Intention;
import io.consul.spec.IntentionCheck;
import io.consul.spec.LeafCert;
import io.consul.spec.MissingParameterException;
import io.consul.spec.QueryOptions;
import io.consul.spec.QueryResult;
import io.consul.spec.WriteOptions;
import io.consul.spec.WriteResult;
import io.consul.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The service mesh endpoints: certificate authority and intentions.
 */
public final class ConnectClient {

    private static final String CONNECT = "/v1/connect";

    private static final TypeReference<List<Intention>> INTENTION_LIST = new TypeReference<>() {};

    private final RequestDispatcher dispatcher;

    ConnectClient(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * List the trusted CA roots. Watch this with a wait index to learn about root rotation.
     */
    public CompletableFuture<QueryResult<CARootList>> caRoots(@Nullable QueryOptions options) {
        return dispatcher.read(CONNECT + "/ca/roots", CARootList.class, Map.of(), options);
    }

    public CompletableFuture<QueryResult<CAConfig>> caConfiguration(@Nullable QueryOptions options) {
        return dispatcher.readUnindexed(CONNECT + "/ca/configuration", CAConfig.class, Map.of(), options);
    }

    public CompletableFuture<QueryResult<List<Intention>>> listIntentions(@Nullable QueryOptions options) {
        return dispatcher.read(CONNECT + "/intentions", INTENTION_LIST, Map.of(), options);
    }

    /**
     * Evaluate the intentions for a connection from one service to another.
     */
    public CompletableFuture<QueryResult<IntentionCheck>> checkIntention(String source, String destination,
                                                                         @Nullable QueryOptions options) {
        Assert.checkNotNullParam("source", source);
        Assert.checkNotNullParam("destination", destination);
        if (source.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("source"));
        }
        if (destination.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("destination"));
        }
        return dispatcher.readUnindexed(CONNECT + "/intentions/check", IntentionCheck.class,
                sourceAndDestination(source, destination), options);
    }

    /**
     * Create or replace the intention between the source and destination of {@code intention}.
     *
     * @return {@code true} if the intention was stored
     */
    public CompletableFuture<WriteResult<Boolean>> upsertIntention(Intention intention,
                                                                   @Nullable WriteOptions options) {
        Assert.checkNotNullParam("intention", intention);
        if (intention.sourceName().isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("SourceName"));
        }
        if (intention.destinationName().isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("DestinationName"));
        }
        return dispatcher.write(CONNECT + "/intentions/exact", intention, Boolean.class,
                sourceAndDestination(intention.sourceName(), intention.destinationName()), options);
    }

    public CompletableFuture<WriteResult<Boolean>> deleteIntention(String source, String destination,
                                                                   @Nullable WriteOptions options) {
        Assert.checkNotNullParam("source", source);
        Assert.checkNotNullParam("destination", destination);
        if (source.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("source"));
        }
        if (destination.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("destination"));
        }
        return dispatcher.write(HttpMethod.DELETE, CONNECT + "/intentions/exact", null, Boolean.class,
                sourceAndDestination(source, destination), options);
    }

    /**
     * Fetch the leaf certificate the local agent holds for a service, generating it if needed.
     */
    public CompletableFuture<QueryResult<LeafCert>> leafCertificate(String service, @Nullable QueryOptions options) {
        Assert.checkNotNullParam("service", service);
        if (service.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("service"));
        }
        return dispatcher.read("/v1/agent/connect/ca/leaf/" + PathSegments.segment(service), LeafCert.class,
                Map.of(), options);
    }

    private static Map<String, @Nullable String> sourceAndDestination(String source, String destination) {
        Map<String, @Nullable String> params = new LinkedHashMap<>();
        params.put("source", source);
        params.put("destination", destination);
        return params;
    }
}
