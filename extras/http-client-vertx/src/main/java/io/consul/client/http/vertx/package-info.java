@NullMarked
package io.consul.client.http.vertx;

import org.jspecify.annotations.NullMarked;
