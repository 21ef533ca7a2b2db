package io.consul.client.http.jdk;

import java.time.Duration;

import io.consul.client.http.HttpClient;
import io.consul.client.http.HttpClientBuilder;
import org.jspecify.annotations.Nullable;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Duration connectTimeout;

    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url, connectTimeout);
    }
}
