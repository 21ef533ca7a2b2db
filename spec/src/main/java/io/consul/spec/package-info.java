/**
 * Types of the Consul HTTP API as seen by the client.
 *
 * <p>This package holds three groups of types:
 * <ul>
 *   <li>the options and metadata model of the blocking-query protocol ({@link io.consul.spec.QueryOptions},
 *   {@link io.consul.spec.WriteOptions}, {@link io.consul.spec.QueryMeta}, {@link io.consul.spec.WriteMeta}),</li>
 *   <li>entity and payload records mapped onto Consul's PascalCase JSON ({@link io.consul.spec.Node},
 *   {@link io.consul.spec.CatalogService}, {@link io.consul.spec.KVPair}, ...),</li>
 *   <li>the {@link io.consul.spec.ConsulClientException} hierarchy.</li>
 * </ul>
 *
 * <p>Entity records tolerate absent and unknown JSON fields: absent strings and collections decode to
 * empty values, absent numbers to zero.
 */
@NullMarked
package io.consul.spec;

import org.jspecify.annotations.NullMarked;
