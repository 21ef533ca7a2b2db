package io.consul.client.http.vertx;

import io.consul.client.http.HttpClientBuilder;
import io.consul.client.http.common.AbstractHttpClientTest;
import io.vertx.core.http.HttpClientOptions;

public class VertxHttpClientTest extends AbstractHttpClientTest {

    protected HttpClientBuilder getHttpClientBuilder() {
        return new VertxHttpClientBuilder()
                .options(new HttpClientOptions().setMaxChunkSize(24));
    }
}
