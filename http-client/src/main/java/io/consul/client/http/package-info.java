/**
 * Pluggable HTTP transport of the Consul client.
 *
 * <p>The Consul client never talks to a concrete HTTP library. It goes through
 * {@link io.consul.client.http.HttpClient}, created for a base address by an
 * {@link io.consul.client.http.HttpClientBuilder}:
 * <ul>
 *   <li>{@link io.consul.client.http.jdk.JdkHttpClientBuilder} - default implementation on top of {@code java.net.http}</li>
 *   <li>{@code VertxHttpClientBuilder} - Vert.x implementation from the {@code consul-java-http-client-vertx} extra</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("http://127.0.0.1:8500");
 * HttpResponse response = client.get("/v1/catalog/nodes")
 *     .addQueryParam("dc", "dc1")
 *     .addHeader("X-Consul-Token", token)
 *     .timeout(Duration.ofSeconds(10))
 *     .send()
 *     .get();
 *
 * long index = Long.parseUnsignedLong(response.header("X-Consul-Index").orElseThrow());
 * }</pre>
 *
 * <p>Transports report every HTTP status as a normal response. Turning statuses into errors
 * is left to the caller.
 */
@NullMarked
package io.consul.client.http;

import org.jspecify.annotations.NullMarked;
