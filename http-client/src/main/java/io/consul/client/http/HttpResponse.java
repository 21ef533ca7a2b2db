package io.consul.client.http;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    CompletableFuture<String> body();

    /**
     * Look up the first value of a response header. Header names are matched case-insensitively.
     *
     * @param name the header name
     * @return the header value, if the header is present
     */
    Optional<String> header(String name);
}
