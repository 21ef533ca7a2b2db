package io.consul.spec;

import static io.consul.util.Utils.defaultIfNull;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A service-to-service authorization rule of the mesh.
 *
 * @param id the legacy ID of the intention, empty for intentions managed by config entries
 * @param sourceName the source service, {@code *} for any
 * @param destinationName the destination service, {@code *} for any
 * @param action whether connections are allowed or denied, {@code null} for L7 intentions
 * @param description a human-readable description
 * @param meta user metadata
 * @param precedence evaluation precedence, computed by the server
 * @param createIndex the index at which the intention was created
 * @param modifyIndex the index at which the intention was last modified
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Intention(@JsonProperty("ID") String id,
                        @JsonProperty("SourceName") String sourceName,
                        @JsonProperty("DestinationName") String destinationName,
                        @JsonProperty("Action") @Nullable IntentionAction action,
                        @JsonProperty("Description") String description,
                        @JsonProperty("Meta") Map<String, String> meta,
                        @JsonProperty("Precedence") @JsonInclude(JsonInclude.Include.NON_DEFAULT) int precedence,
                        @JsonProperty("CreateIndex") @UnsignedLong @JsonInclude(JsonInclude.Include.NON_DEFAULT) long createIndex,
                        @JsonProperty("ModifyIndex") @UnsignedLong @JsonInclude(JsonInclude.Include.NON_DEFAULT) long modifyIndex) {

    public Intention {
        id = defaultIfNull(id, "");
        sourceName = defaultIfNull(sourceName, "");
        destinationName = defaultIfNull(destinationName, "");
        description = defaultIfNull(description, "");
        meta = defaultIfNull(meta, Map.of());
    }

    public static Intention of(String sourceName, String destinationName, IntentionAction action) {
        return new Intention("", sourceName, destinationName, action, "", Map.of(), 0, 0, 0);
    }
}
