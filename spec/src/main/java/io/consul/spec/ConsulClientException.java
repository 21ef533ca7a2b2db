package io.consul.spec;

/**
 * Base class of every failure reported by the Consul client.
 * <p>
 * Client operations are asynchronous, so these exceptions usually reach the caller as the cause of an
 * {@link java.util.concurrent.ExecutionException} or {@link java.util.concurrent.CompletionException}.
 */
public class ConsulClientException extends Exception {

    public ConsulClientException() {
    }

    public ConsulClientException(String message) {
        super(message);
    }

    public ConsulClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConsulClientException(Throwable cause) {
        super(cause);
    }
}
