package io.consul.spec;

import static io.consul.util.Utils.defaultIfNull;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of {@code PUT /v1/session/create}.
 *
 * @param id the ID of the new session
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionCreated(@JsonProperty("ID") String id) {

    public SessionCreated {
        id = defaultIfNull(id, "");
    }
}
