package io.consul.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Check definition attached to an {@link AgentServiceRegistration}. Durations use Consul's
 * Go duration syntax ({@code 10s}, {@code 1m}).
 *
 * @param checkId the ID of the check
 * @param name the name of the check
 * @param interval how often script, HTTP and TCP checks run
 * @param timeout timeout of HTTP and TCP checks
 * @param ttl time-to-live of a TTL check
 * @param http URL polled by an HTTP check
 * @param tcp {@code host:port} probed by a TCP check
 * @param notes human-readable notes
 * @param status initial status of the check
 * @param deregisterCriticalServiceAfter how long a critical check lasts before the service is removed
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentServiceCheck(@JsonProperty("CheckID") @Nullable String checkId,
                                @JsonProperty("Name") @Nullable String name,
                                @JsonProperty("Interval") @Nullable String interval,
                                @JsonProperty("Timeout") @Nullable String timeout,
                                @JsonProperty("TTL") @Nullable String ttl,
                                @JsonProperty("HTTP") @Nullable String http,
                                @JsonProperty("TCP") @Nullable String tcp,
                                @JsonProperty("Notes") @Nullable String notes,
                                @JsonProperty("Status") @Nullable String status,
                                @JsonProperty("DeregisterCriticalServiceAfter") @Nullable String deregisterCriticalServiceAfter) {

    public static AgentServiceCheck ttl(String ttl) {
        return new AgentServiceCheck(null, null, null, null, ttl, null, null, null, null, null);
    }

    public static AgentServiceCheck http(String url, String interval) {
        return new AgentServiceCheck(null, null, interval, null, null, url, null, null, null, null);
    }

    public static AgentServiceCheck tcp(String hostAndPort, String interval) {
        return new AgentServiceCheck(null, null, interval, null, null, null, hostAndPort, null, null, null);
    }
}
