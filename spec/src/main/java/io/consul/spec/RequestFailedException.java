package io.consul.spec;

import io.consul.common.ConsulErrorMessages;

/**
 * Consul answered with a non-2xx status. The response body is not decoded.
 */
public class RequestFailedException extends ConsulClientException {

    private final int statusCode;

    public RequestFailedException(int statusCode) {
        super(String.format(ConsulErrorMessages.REQUEST_FAILED, statusCode));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
