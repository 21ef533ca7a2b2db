package io.consul.client;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.type.TypeReference;
import io.consul.spec.HealthCheck;
import io.consul.spec.HealthState;
import io.consul.spec.MissingParameterException;
import io.consul.spec.QueryOptions;
import io.consul.spec.QueryResult;
import io.consul.spec.ServiceEntry;
import io.consul.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The {@code /v1/health} endpoints.
 */
public final class HealthClient {

    private static final String HEALTH = "/v1/health";

    private static final TypeReference<List<HealthCheck>> CHECK_LIST = new TypeReference<>() {};
    private static final TypeReference<List<ServiceEntry>> SERVICE_ENTRY_LIST = new TypeReference<>() {};

    private final RequestDispatcher dispatcher;

    HealthClient(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public CompletableFuture<QueryResult<List<HealthCheck>>> listNodeChecks(String node,
                                                                           @Nullable QueryOptions options) {
        Assert.checkNotNullParam("node", node);
        if (node.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("node"));
        }
        return dispatcher.read(HEALTH + "/node/" + PathSegments.segment(node), CHECK_LIST, Map.of(), options);
    }

    public CompletableFuture<QueryResult<List<HealthCheck>>> listServiceChecks(String service,
                                                                              @Nullable QueryOptions options) {
        Assert.checkNotNullParam("service", service);
        if (service.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("service"));
        }
        return dispatcher.read(HEALTH + "/checks/" + PathSegments.segment(service), CHECK_LIST, Map.of(), options);
    }

    /**
     * List the instances of a service together with their node and checks.
     *
     * @param service the service name
     * @param tag only return instances carrying this tag, or {@code null} for all
     * @param passingOnly only return instances whose checks are all passing
     * @param options the query options, or {@code null}; a watch loop over healthy instances blocks here
     * @return the instances
     */
    public CompletableFuture<QueryResult<List<ServiceEntry>>> listServiceInstances(String service, @Nullable String tag,
                                                                                  boolean passingOnly,
                                                                                  @Nullable QueryOptions options) {
        Assert.checkNotNullParam("service", service);
        if (service.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("service"));
        }
        Map<String, @Nullable String> params = new LinkedHashMap<>();
        if (!Assert.isNullOrEmpty(tag)) {
            params.put("tag", tag);
        }
        if (passingOnly) {
            params.put("passing", null);
        }
        return dispatcher.read(HEALTH + "/service/" + PathSegments.segment(service), SERVICE_ENTRY_LIST, params,
                options);
    }

    public CompletableFuture<QueryResult<List<HealthCheck>>> listChecksInState(HealthState state,
                                                                              @Nullable QueryOptions options) {
        Assert.checkNotNullParam("state", state);
        return dispatcher.read(HEALTH + "/state/" + state.value(), CHECK_LIST, Map.of(), options);
    }
}
