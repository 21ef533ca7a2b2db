package io.consul.client;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import io.consul.client.http.HttpClient;
import io.consul.client.http.HttpClientBuilder;
import io.consul.util.Assert;
import io.consul.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Immutable configuration shared by every request of a {@link ConsulClient}: the agent address, the
 * default datacenter and ACL token, the default blocking wait and the HTTP transport.
 * <p>
 * The process environment is only consulted by {@link #fromEnvironment()}; everything else is explicit.
 */
public final class ConsulConfig {

    public static final String HTTP_ADDR_ENV = "CONSUL_HTTP_ADDR";
    public static final String HTTP_TOKEN_ENV = "CONSUL_HTTP_TOKEN";
    public static final String HTTP_SSL_ENV = "CONSUL_HTTP_SSL";

    public static final int DEFAULT_PORT = 8500;
    public static final String DEFAULT_ADDRESS = "http://127.0.0.1:" + DEFAULT_PORT;
    public static final Duration DEFAULT_WAIT_TIME = Duration.ofMinutes(5);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String address;
    private final @Nullable String datacenter;
    private final @Nullable String token;
    private final Duration waitTime;
    private final Duration timeout;
    private final HttpClient httpClient;

    private ConsulConfig(Builder builder) {
        this.address = builder.address;
        this.datacenter = builder.datacenter;
        this.token = builder.token;
        this.waitTime = builder.waitTime;
        this.timeout = builder.timeout;
        this.httpClient = builder.httpClientBuilder.create(builder.address);
    }

    /**
     * Create a configuration from the process environment.
     *
     * @return the configuration
     * @see #fromEnvironment(Map)
     */
    public static ConsulConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Create a configuration from a snapshot of environment variables.
     * <ul>
     *   <li>{@code CONSUL_HTTP_ADDR} - agent address, {@code http://} is assumed when no scheme is given,
     *   defaults to {@value #DEFAULT_ADDRESS}</li>
     *   <li>{@code CONSUL_HTTP_TOKEN} - ACL token, requests are unauthenticated when absent</li>
     *   <li>{@code CONSUL_HTTP_SSL} - {@code true} forces {@code https}</li>
     * </ul>
     *
     * @param env the environment variables
     * @return the configuration
     */
    public static ConsulConfig fromEnvironment(Map<String, String> env) {
        Assert.checkNotNullParam("env", env);
        boolean ssl = Boolean.parseBoolean(env.getOrDefault(HTTP_SSL_ENV, "false").trim().toLowerCase(Locale.ROOT));

        String address = env.get(HTTP_ADDR_ENV);
        if (Assert.isNullOrEmpty(address)) {
            address = DEFAULT_ADDRESS;
        } else if (!address.startsWith("http://") && !address.startsWith("https://")) {
            address = "http://" + address;
        }
        if (ssl && address.startsWith("http://")) {
            address = "https://" + address.substring("http://".length());
        }

        Builder builder = builder().address(address);
        String token = env.get(HTTP_TOKEN_ENV);
        if (!Assert.isNullOrEmpty(token)) {
            builder.token(token);
        }
        return builder.build();
    }

    /**
     * Create a configuration for an agent reachable on the given host.
     *
     * @param host the host name or address, with or without scheme
     * @param port the HTTP port, {@value #DEFAULT_PORT} when {@code null}
     * @param token the ACL token, or {@code null}
     * @return the configuration
     */
    public static ConsulConfig forHost(String host, @Nullable Integer port, @Nullable String token) {
        Assert.checkNotEmptyParam("host", host);
        String scheme = host.startsWith("http://") || host.startsWith("https://") ? "" : "http://";
        Builder builder = builder().address(scheme + host + ":" + Utils.defaultIfNull(port, DEFAULT_PORT));
        if (token != null) {
            builder.token(token);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getAddress() {
        return address;
    }

    public @Nullable String getDatacenter() {
        return datacenter;
    }

    public @Nullable String getToken() {
        return token;
    }

    /**
     * @return the wait applied to blocking reads that do not set their own
     */
    public Duration getWaitTime() {
        return waitTime;
    }

    /**
     * @return the timeout of non-blocking requests, also the margin added on top of the wait of blocking ones
     */
    public Duration getTimeout() {
        return timeout;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    @Override
    public String toString() {
        return "ConsulConfig{address=" + address + ", datacenter=" + datacenter
                + ", token=" + (token == null ? "<none>" : "<redacted>")
                + ", waitTime=" + waitTime + ", timeout=" + timeout + "}";
    }

    public static class Builder {
        private String address = DEFAULT_ADDRESS;
        private @Nullable String datacenter;
        private @Nullable String token;
        private Duration waitTime = DEFAULT_WAIT_TIME;
        private Duration timeout = DEFAULT_TIMEOUT;
        private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;

        private Builder() {
        }

        public Builder address(String address) {
            this.address = Assert.checkNotEmptyParam("address", address);
            return this;
        }

        public Builder datacenter(@Nullable String datacenter) {
            this.datacenter = datacenter;
            return this;
        }

        public Builder token(@Nullable String token) {
            this.token = token;
            return this;
        }

        public Builder waitTime(Duration waitTime) {
            this.waitTime = Assert.checkNotNullParam("waitTime", waitTime);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Assert.checkNotNullParam("timeout", timeout);
            return this;
        }

        public Builder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
            this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
            return this;
        }

        public ConsulConfig build() {
            return new ConsulConfig(this);
        }
    }
}
