/**
 * Asynchronous client of the Consul HTTP API.
 * <p>
 * {@link io.consul.client.ConsulClient} gives access to one facade per API resource. Every operation returns a
 * {@link java.util.concurrent.CompletableFuture} completed with a {@link io.consul.spec.QueryResult} or
 * {@link io.consul.spec.WriteResult}, or completed exceptionally with a {@link io.consul.spec.ConsulClientException}.
 */
@NullMarked
package io.consul.client;

import org.jspecify.annotations.NullMarked;
