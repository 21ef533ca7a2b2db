package io.consul.client.http.vertx;

import io.consul.client.http.HttpClient;
import io.consul.client.http.HttpClientBuilder;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import org.jspecify.annotations.Nullable;

/**
 * Creates {@link VertxHttpClient}s. A {@link Vertx} instance is created per client when none is supplied.
 */
public class VertxHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Vertx vertx;

    private @Nullable HttpClientOptions options;

    public VertxHttpClientBuilder vertx(Vertx vertx) {
        this.vertx = vertx;
        return this;
    }

    public VertxHttpClientBuilder options(HttpClientOptions options) {
        this.options = options;
        return this;
    }

    @Override
    public HttpClient create(String url) {
        return new VertxHttpClient(url,
                vertx != null ? vertx : Vertx.vertx(),
                options != null ? new HttpClientOptions(options) : new HttpClientOptions());
    }
}
