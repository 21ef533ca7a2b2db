package io.consul.spec;

import java.time.Duration;

import io.consul.util.Assert;

/**
 * Metadata returned with every write. Writes cannot block, so there is no index.
 *
 * @param requestTime wall-clock duration of the HTTP round trip
 */
public record WriteMeta(Duration requestTime) {

    public WriteMeta {
        Assert.checkNotNullParam("requestTime", requestTime);
    }
}
