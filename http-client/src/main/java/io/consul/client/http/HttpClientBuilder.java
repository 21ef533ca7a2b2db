package io.consul.client.http;

import io.consul.client.http.jdk.JdkHttpClientBuilder;

public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    HttpClient create(String url);
}
