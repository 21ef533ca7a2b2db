package io.consul.client;

import io.consul.util.Assert;

/**
 * Entry point of the Consul API.
 * <pre>{@code
 * ConsulClient consul = new ConsulClient(ConsulConfig.fromEnvironment());
 * QueryOptions options = QueryOptions.DEFAULT;
 * while (running) {
 *     QueryResult<List<ServiceEntry>> result = consul.health()
 *             .listServiceInstances("web", null, true, options)
 *             .get();
 *     update(result.value());
 *     options = options.nextAfter(result.meta());
 * }
 * }</pre>
 * The client and its resources are thread-safe and share one HTTP transport.
 */
public class ConsulClient {

    private final RequestDispatcher dispatcher;
    private final CatalogClient catalog;
    private final HealthClient health;
    private final KVClient kv;
    private final SessionClient session;
    private final AgentClient agent;
    private final ConnectClient connect;

    public ConsulClient(ConsulConfig config) {
        this.dispatcher = new RequestDispatcher(Assert.checkNotNullParam("config", config));
        this.catalog = new CatalogClient(dispatcher);
        this.health = new HealthClient(dispatcher);
        this.kv = new KVClient(dispatcher);
        this.session = new SessionClient(dispatcher);
        this.agent = new AgentClient(dispatcher);
        this.connect = new ConnectClient(dispatcher);
    }

    public ConsulConfig getConfig() {
        return dispatcher.getConfig();
    }

    /**
     * @return the dispatcher behind the resources, for endpoints they do not cover
     */
    public RequestDispatcher dispatcher() {
        return dispatcher;
    }

    public CatalogClient catalog() {
        return catalog;
    }

    public HealthClient health() {
        return health;
    }

    public KVClient kv() {
        return kv;
    }

    public SessionClient session() {
        return session;
    }

    public AgentClient agent() {
        return agent;
    }

    public ConnectClient connect() {
        return connect;
    }
}
