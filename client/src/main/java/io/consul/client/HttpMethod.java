package io.consul.client;

/**
 * HTTP methods used by the Consul API.
 */
public enum HttpMethod {
    GET,
    PUT,
    POST,
    DELETE
}
