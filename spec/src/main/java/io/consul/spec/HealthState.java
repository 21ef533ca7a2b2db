package io.consul.spec;

/**
 * Check states accepted by {@code /v1/health/state/:state}.
 */
public enum HealthState {
    ANY("any"),
    PASSING("passing"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    HealthState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
