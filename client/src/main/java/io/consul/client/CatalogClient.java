package io.consul.client;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.type.TypeReference;
import io.consul.spec.CatalogDeregistration;
import io.consul.spec.CatalogNode;
import io.consul.spec.CatalogRegistration;
import io.consul.spec.CatalogService;
import io.consul.spec.MissingParameterException;
import io.consul.spec.Node;
import io.consul.spec.QueryOptions;
import io.consul.spec.QueryResult;
import io.consul.spec.WriteOptions;
import io.consul.spec.WriteResult;
import io.consul.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The {@code /v1/catalog} endpoints: the cluster-wide registry of nodes and services.
 */
public final class CatalogClient {

    private static final String CATALOG = "/v1/catalog";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Node>> NODE_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, List<String>>> SERVICE_TAGS = new TypeReference<>() {};
    private static final TypeReference<List<CatalogService>> CATALOG_SERVICE_LIST = new TypeReference<>() {};

    private final RequestDispatcher dispatcher;

    CatalogClient(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Register or update a node, optionally with a service and a check, directly in the catalog.
     */
    public CompletableFuture<WriteResult<Void>> register(CatalogRegistration registration,
                                                         @Nullable WriteOptions options) {
        Assert.checkNotNullParam("registration", registration);
        if (registration.node().isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("Node"));
        }
        return dispatcher.write(CATALOG + "/register", registration, Void.class, Map.of(), options);
    }

    public CompletableFuture<WriteResult<Void>> deregister(CatalogDeregistration deregistration,
                                                           @Nullable WriteOptions options) {
        Assert.checkNotNullParam("deregistration", deregistration);
        if (deregistration.node().isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("Node"));
        }
        return dispatcher.write(CATALOG + "/deregister", deregistration, Void.class, Map.of(), options);
    }

    /**
     * List the known datacenters, in the order returned by the server (sorted by round-trip time).
     * The endpoint is not indexed; the returned index is {@code 0} unless the server sends one.
     */
    public CompletableFuture<QueryResult<List<String>>> listDatacenters() {
        return dispatcher.readUnindexed(CATALOG + "/datacenters", STRING_LIST, Map.of(), null);
    }

    public CompletableFuture<QueryResult<List<Node>>> listDatacenterNodes(@Nullable QueryOptions options) {
        return dispatcher.read(CATALOG + "/nodes", NODE_LIST, Map.of(), options);
    }

    /**
     * List the registered services with their tags.
     *
     * @param options the query options, or {@code null}
     * @return the service names mapped to the union of their tags
     */
    public CompletableFuture<QueryResult<Map<String, List<String>>>> listDatacenterServices(
            @Nullable QueryOptions options) {
        return dispatcher.read(CATALOG + "/services", SERVICE_TAGS, Map.of(), options);
    }

    /**
     * List the nodes providing a service.
     *
     * @param service the service name
     * @param tag only return instances carrying this tag, or {@code null} for all
     * @param options the query options, or {@code null}
     * @return the instances of the service
     */
    public CompletableFuture<QueryResult<List<CatalogService>>> listServiceNodes(String service, @Nullable String tag,
                                                                                @Nullable QueryOptions options) {
        Assert.checkNotNullParam("service", service);
        if (service.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("service"));
        }
        Map<String, @Nullable String> params = Assert.isNullOrEmpty(tag) ? Map.of() : Collections.singletonMap("tag", tag);
        return dispatcher.read(CATALOG + "/service/" + PathSegments.segment(service), CATALOG_SERVICE_LIST, params,
                options);
    }

    public CompletableFuture<QueryResult<CatalogNode>> getNodeServices(String node, @Nullable QueryOptions options) {
        Assert.checkNotNullParam("node", node);
        if (node.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("node"));
        }
        return dispatcher.read(CATALOG + "/node/" + PathSegments.segment(node), CatalogNode.class, Map.of(), options);
    }
}
