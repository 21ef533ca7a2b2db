package io.consul.spec;

/**
 * Status reported for a TTL check through {@code /v1/agent/check/(pass|warn|fail)/:check_id}.
 */
public enum CheckStatus {
    PASSING("pass"),
    WARNING("warn"),
    CRITICAL("fail");

    private final String endpoint;

    CheckStatus(String endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * @return the path segment of the TTL update endpoint for this status
     */
    public String endpoint() {
        return endpoint;
    }
}
