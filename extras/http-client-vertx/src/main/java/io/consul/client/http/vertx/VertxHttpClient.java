package io.consul.client.http.vertx;

import java.net.URL;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import io.consul.client.http.HttpClient;
import io.consul.client.http.HttpResponse;
import io.consul.client.http.UrlUtils;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.jspecify.annotations.Nullable;

public class VertxHttpClient implements HttpClient {

    private final io.vertx.core.http.HttpClient client;

    private final String basePath;

    VertxHttpClient(String baseUrl, Vertx vertx, HttpClientOptions options) {
        URL targetUrl = UrlUtils.buildUrl(UrlUtils.normalizeBaseUrl(baseUrl));
        this.basePath = targetUrl.getPath();
        this.client = vertx.createHttpClient(options
                .setDefaultHost(targetUrl.getHost())
                .setDefaultPort(targetUrl.getPort() != -1 ? targetUrl.getPort() : targetUrl.getDefaultPort())
                .setSsl(UrlUtils.isSecureProtocol(targetUrl.getProtocol())));
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new VertxGetRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new VertxPutRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new VertxPostRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new VertxDeleteRequestBuilder(path);
    }

    private abstract class VertxRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        private final HttpMethod method;
        protected final Map<String, String> headers = new LinkedHashMap<>();
        protected final Map<String, @Nullable String> queryParams = new LinkedHashMap<>();
        private @Nullable Duration timeout;

        VertxRequestBuilder(String path, HttpMethod method) {
            this.path = path;
            this.method = method;
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

        protected byte @Nullable [] body() {
            return null;
        }

        private RequestOptions requestOptions() {
            String query = UrlUtils.encodeQuery(queryParams);
            RequestOptions options = new RequestOptions()
                    .setMethod(method)
                    .setURI(basePath + path + (query.isEmpty() ? "" : "?" + query));
            if (timeout != null) {
                options.setIdleTimeout(timeout.toMillis());
            }
            return options;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            byte[] body = body();
            return client.request(requestOptions())
                    .compose(request -> {
                        request.headers().addAll(headers);
                        return body == null ? request.send() : request.send(Buffer.buffer(body));
                    })
                    .compose(RESPONSE_MAPPER)
                    .toCompletionStage()
                    .toCompletableFuture();
        }
    }

    private abstract class VertxBodyRequestBuilder<T extends BodyRequestBuilder<T>> extends VertxRequestBuilder<T>
            implements BodyRequestBuilder<T> {
        private byte @Nullable [] body;

        VertxBodyRequestBuilder(String path, HttpMethod method) {
            super(path, method);
        }

        @Override
        public T body(byte @Nullable [] body) {
            this.body = body;
            return self();
        }

        @Override
        protected byte @Nullable [] body() {
            return body;
        }
    }

    private class VertxGetRequestBuilder extends VertxRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        VertxGetRequestBuilder(String path) {
            super(path, HttpMethod.GET);
        }
    }

    private class VertxDeleteRequestBuilder extends VertxRequestBuilder<DeleteRequestBuilder>
            implements DeleteRequestBuilder {

        VertxDeleteRequestBuilder(String path) {
            super(path, HttpMethod.DELETE);
        }
    }

    private class VertxPutRequestBuilder extends VertxBodyRequestBuilder<PutRequestBuilder>
            implements PutRequestBuilder {

        VertxPutRequestBuilder(String path) {
            super(path, HttpMethod.PUT);
        }
    }

    private class VertxPostRequestBuilder extends VertxBodyRequestBuilder<PostRequestBuilder>
            implements PostRequestBuilder {

        VertxPostRequestBuilder(String path) {
            super(path, HttpMethod.POST);
        }
    }

    // The body is read on the event loop before the response is handed out.
    private static final Function<HttpClientResponse, Future<HttpResponse>> RESPONSE_MAPPER = response ->
            response.body().map(buffer -> new VertxHttpResponse(response.statusCode(), response.headers(),
                    buffer.toString()));

    private record VertxHttpResponse(int statusCode, MultiMap headers, String content) implements HttpResponse {

        @Override
        public CompletableFuture<String> body() {
            return CompletableFuture.completedFuture(content);
        }

        @Override
        public Optional<String> header(String name) {
            return Optional.ofNullable(headers.get(name));
        }
    }
}
