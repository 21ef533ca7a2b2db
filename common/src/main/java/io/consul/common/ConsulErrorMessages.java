package io.consul.common;

/**
 * Error messages shared by the Consul client modules.
 */
public interface ConsulErrorMessages {

    String REQUEST_FAILED = "Consul request failed with status %d";
    String TRANSPORT_FAILED = "HTTP request to Consul failed";
    String MISSING_PARAMETER = "Missing parameter: %s";
    String EMPTY_KEY = "Expected a non-empty key, got empty";
    String MISSING_INDEX_HEADER = "Response is missing the X-Consul-Index header";
    String INVALID_INDEX_HEADER = "Response carries an invalid X-Consul-Index header [%s]";
    String INVALID_LAST_CONTACT_HEADER = "Response carries an invalid X-Consul-LastContact header [%s]";
    String DECODE_BODY_FAILED = "Failed to decode response body";
    String ENCODE_BODY_FAILED = "Failed to encode request body";
}
