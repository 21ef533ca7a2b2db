package io.consul.client.http;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * HTTP client bound to one base address. Paths passed to the request builders are appended to that address.
 * <p>
 * Implementations are safe for concurrent use; request builders are not and belong to a single request.
 */
public interface HttpClient {

    String CONTENT_TYPE = "Content-Type";
    String APPLICATION_JSON = "application/json";
    String APPLICATION_OCTET_STREAM = "application/octet-stream";

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PutRequestBuilder put(String path);

    PostRequestBuilder post(String path);

    DeleteRequestBuilder delete(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);

        /**
         * Append a query parameter. Parameters are sent in the order they were added.
         *
         * @param name the parameter name
         * @param value the parameter value, {@code null} for a valueless flag such as {@code ?stale}
         * @return this builder
         */
        T addQueryParam(String name, @Nullable String value);

        T addQueryParams(Map<String, @Nullable String> params);

        /**
         * Bound the time between sending the request and receiving the response headers.
         *
         * @param timeout the timeout
         * @return this builder
         */
        T timeout(Duration timeout);
    }

    interface BodyRequestBuilder<T extends BodyRequestBuilder<T>> extends RequestBuilder<T> {
        T body(byte @Nullable [] body);

        default T body(@Nullable String body) {
            return body(body == null ? null : body.getBytes(StandardCharsets.UTF_8));
        }
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PutRequestBuilder extends BodyRequestBuilder<PutRequestBuilder> {

    }

    interface PostRequestBuilder extends BodyRequestBuilder<PostRequestBuilder> {

    }

    interface DeleteRequestBuilder extends RequestBuilder<DeleteRequestBuilder> {

    }
}
