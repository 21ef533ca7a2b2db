package io.consul.client;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.type.TypeReference;
import io.consul.spec.AgentMember;
import io.consul.spec.AgentService;
import io.consul.spec.AgentServiceRegistration;
import io.consul.spec.CheckStatus;
import io.consul.spec.HealthCheck;
import io.consul.spec.MissingParameterException;
import io.consul.spec.QueryOptions;
import io.consul.spec.QueryResult;
import io.consul.spec.WriteOptions;
import io.consul.spec.WriteResult;
import io.consul.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The {@code /v1/agent} endpoints, answered by the agent the client talks to from its local state.
 * <p>
 * These reads are not indexed: {@link io.consul.spec.QueryMeta#lastIndex()} is {@code 0} unless the agent
 * sends one.
 */
public final class AgentClient {

    private static final String AGENT = "/v1/agent";

    private static final TypeReference<List<AgentMember>> MEMBER_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, AgentService>> SERVICE_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, HealthCheck>> CHECK_MAP = new TypeReference<>() {};

    private final RequestDispatcher dispatcher;

    AgentClient(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * List the members the agent sees in the gossip pool.
     *
     * @param wan list the WAN pool of the servers instead of the LAN pool
     * @return the members
     */
    public CompletableFuture<QueryResult<List<AgentMember>>> listMembers(boolean wan) {
        Map<String, @Nullable String> params = wan ? Map.of("wan", "1") : Map.of();
        return dispatcher.readUnindexed(AGENT + "/members", MEMBER_LIST, params, null);
    }

    public CompletableFuture<QueryResult<Map<String, AgentService>>> listServices() {
        return listServices(null);
    }

    /**
     * List the services registered with the agent, keyed by service ID.
     */
    public CompletableFuture<QueryResult<Map<String, AgentService>>> listServices(@Nullable QueryOptions options) {
        return dispatcher.readUnindexed(AGENT + "/services", SERVICE_MAP, Map.of(), options);
    }

    public CompletableFuture<QueryResult<Map<String, HealthCheck>>> listChecks() {
        return listChecks(null);
    }

    public CompletableFuture<QueryResult<Map<String, HealthCheck>>> listChecks(@Nullable QueryOptions options) {
        return dispatcher.readUnindexed(AGENT + "/checks", CHECK_MAP, Map.of(), options);
    }

    public CompletableFuture<WriteResult<Void>> registerService(AgentServiceRegistration registration,
                                                                @Nullable WriteOptions options) {
        Assert.checkNotNullParam("registration", registration);
        if (registration.name().isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("Name"));
        }
        return dispatcher.write(AGENT + "/service/register", registration, Void.class, Map.of(), options);
    }

    public CompletableFuture<WriteResult<Void>> deregisterService(String serviceId, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("serviceId", serviceId);
        if (serviceId.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("serviceId"));
        }
        return dispatcher.write(AGENT + "/service/deregister/" + PathSegments.segment(serviceId), null, Void.class,
                Map.of(), options);
    }

    /**
     * Put a service in or out of maintenance mode. A service in maintenance is reported critical.
     *
     * @param serviceId the service ID
     * @param enable {@code true} to enter maintenance, {@code false} to leave it
     * @param reason a reason shown on the maintenance check, or {@code null}
     * @param options the write options, or {@code null}
     * @return the write result
     */
    public CompletableFuture<WriteResult<Void>> enableServiceMaintenance(String serviceId, boolean enable,
                                                                         @Nullable String reason,
                                                                         @Nullable WriteOptions options) {
        Assert.checkNotNullParam("serviceId", serviceId);
        if (serviceId.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("serviceId"));
        }
        Map<String, @Nullable String> params = new LinkedHashMap<>();
        params.put("enable", Boolean.toString(enable));
        if (!Assert.isNullOrEmpty(reason)) {
            params.put("reason", reason);
        }
        return dispatcher.write(AGENT + "/service/maintenance/" + PathSegments.segment(serviceId), null, Void.class,
                params, options);
    }

    /**
     * Ask the agent to join the cluster through another agent.
     */
    public CompletableFuture<WriteResult<Void>> join(String address, boolean wan, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("address", address);
        if (address.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("address"));
        }
        Map<String, @Nullable String> params = wan ? Map.of("wan", "1") : Map.of();
        return dispatcher.write(AGENT + "/join/" + PathSegments.segment(address), null, Void.class, params, options);
    }

    /**
     * Force a failed node into the left state.
     */
    public CompletableFuture<WriteResult<Void>> forceLeave(String node, @Nullable WriteOptions options) {
        Assert.checkNotNullParam("node", node);
        if (node.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("node"));
        }
        return dispatcher.write(AGENT + "/force-leave/" + PathSegments.segment(node), null, Void.class, Map.of(),
                options);
    }

    /**
     * Report the status of a TTL check, resetting its TTL.
     *
     * @param checkId the check ID, {@code service:<service id>} for the check of a service registration
     * @param status the status to report
     * @param note a note attached to the check output, or {@code null}
     * @param options the write options, or {@code null}
     * @return the write result
     */
    public CompletableFuture<WriteResult<Void>> updateTtlCheck(String checkId, CheckStatus status,
                                                               @Nullable String note,
                                                               @Nullable WriteOptions options) {
        Assert.checkNotNullParam("checkId", checkId);
        Assert.checkNotNullParam("status", status);
        if (checkId.isEmpty()) {
            return CompletableFuture.failedFuture(new MissingParameterException("checkId"));
        }
        Map<String, @Nullable String> params = Assert.isNullOrEmpty(note) ? Map.of() : Map.of("note", note);
        return dispatcher.write(AGENT + "/check/" + status.endpoint() + "/" + PathSegments.segment(checkId), null,
                Void.class, params, options);
    }
}
