package io.consul.spec;

import io.consul.common.ConsulErrorMessages;

/**
 * The HTTP exchange itself failed: connection refused, TLS failure, timeout.
 */
public class ConsulHttpException extends ConsulClientException {

    public ConsulHttpException(Throwable cause) {
        super(ConsulErrorMessages.TRANSPORT_FAILED + ": " + cause.getMessage(), cause);
    }

    public ConsulHttpException(String message, Throwable cause) {
        super(message, cause);
    }
}
