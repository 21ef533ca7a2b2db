package io.consul.spec;

import org.jspecify.annotations.Nullable;

/**
 * Per-call parameters of a write.
 * <p>
 * Passing {@code null} where a {@code WriteOptions} is accepted behaves exactly like passing {@link #DEFAULT}.
 *
 * @param datacenter datacenter overriding the client default, or {@code null} to inherit it
 * @param token ACL token overriding the client token, or {@code null} to inherit it
 * @param relayFactor number of agents relaying the write's gossip message, {@code 0} to leave unset
 */
public record WriteOptions(@Nullable String datacenter, @Nullable String token, int relayFactor) {

    public static final WriteOptions DEFAULT = builder().build();

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private @Nullable String datacenter;
        private @Nullable String token;
        private int relayFactor;

        private Builder() {
        }

        public Builder datacenter(String datacenter) {
            this.datacenter = datacenter;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder relayFactor(int relayFactor) {
            this.relayFactor = relayFactor;
            return this;
        }

        public WriteOptions build() {
            return new WriteOptions(datacenter, token, relayFactor);
        }
    }
}
