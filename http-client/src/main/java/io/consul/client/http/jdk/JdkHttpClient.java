package io.consul.client.http.jdk;

import io.consul.client.http.HttpClient;
import io.consul.client.http.HttpResponse;
import io.consul.client.http.UrlUtils;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

class JdkHttpClient implements HttpClient {

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, null);
    }

    JdkHttpClient(String baseUrl, @Nullable Duration connectTimeout) {
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        this.httpClient = builder.build();
        this.baseUrl = UrlUtils.normalizeBaseUrl(baseUrl);
    }

    String getBaseUrl() {
        return baseUrl;
    }

    Optional<Duration> getConnectTimeout() {
        return httpClient.connectTimeout();
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new JdkPutRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new JdkDeleteBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new HashMap<>();
        protected final Map<String, @Nullable String> queryParams = new LinkedHashMap<>();
        private @Nullable Duration timeout;

        public JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @Override
        public T addQueryParam(String name, @Nullable String value) {
            queryParams.put(name, value);
            return self();
        }

        @Override
        public T addQueryParams(Map<String, @Nullable String> params) {
            if (params != null) {
                queryParams.putAll(params);
            }
            return self();
        }

        @Override
        public T timeout(Duration timeout) {
            this.timeout = timeout;
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            String query = UrlUtils.encodeQuery(queryParams);
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path + (query.isEmpty() ? "" : "?" + query)));
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            if (timeout != null) {
                builder.timeout(timeout);
            }
            return builder;
        }

        protected CompletableFuture<HttpResponse> send(HttpRequest request) {
            return httpClient
                    .sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenApply(JdkHttpResponse::new);
        }
    }

    private abstract class JdkBodyRequestBuilder<T extends BodyRequestBuilder<T>> extends JdkRequestBuilder<T>
            implements BodyRequestBuilder<T> {
        private byte[] body = new byte[0];

        public JdkBodyRequestBuilder(String path) {
            super(path);
        }

        @Override
        public T body(byte @Nullable [] body) {
            this.body = body == null ? new byte[0] : body;
            return self();
        }

        protected HttpRequest.BodyPublisher bodyPublisher() {
            return body.length == 0
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofByteArray(body);
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        public JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return send(createRequestBuilder().GET().build());
        }
    }

    private class JdkDeleteBuilder extends JdkRequestBuilder<DeleteRequestBuilder> implements DeleteRequestBuilder {

        public JdkDeleteBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return send(createRequestBuilder().DELETE().build());
        }
    }

    private class JdkPutRequestBuilder extends JdkBodyRequestBuilder<PutRequestBuilder> implements PutRequestBuilder {

        public JdkPutRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return send(createRequestBuilder().PUT(bodyPublisher()).build());
        }
    }

    private class JdkPostRequestBuilder extends JdkBodyRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {

        public JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return send(createRequestBuilder().POST(bodyPublisher()).build());
        }
    }

    private record JdkHttpResponse(java.net.http.HttpResponse<String> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public CompletableFuture<String> body() {
            String body = response.body();
            return CompletableFuture.completedFuture(body == null ? "" : body);
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }
    }
}
