package io.consul.spec;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class QueryOptionsTest {

    @Test
    void testDefaultIsNonBlocking() {
        QueryOptions options = QueryOptions.DEFAULT;

        assertFalse(options.isIndexBlocking());
        assertFalse(options.isHashBlocking());
        assertEquals(ConsistencyMode.DEFAULT, options.consistencyMode());
        assertNull(options.datacenter());
        assertNull(options.token());
        assertNull(options.waitTime());
    }

    @Test
    void testZeroWaitIndexIsNotBlocking() {
        assertEquals(QueryOptions.DEFAULT, QueryOptions.builder().waitIndex(0).build());
    }

    @Test
    void testHashBlockingYieldsToIndex() {
        assertTrue(QueryOptions.builder().waitHash("9f1c2a").build().isHashBlocking());
        assertFalse(QueryOptions.builder().waitHash("").build().isHashBlocking());

        QueryOptions both = QueryOptions.builder().waitIndex(3).waitHash("9f1c2a").build();
        assertTrue(both.isIndexBlocking());
        assertFalse(both.isHashBlocking());
    }

    @Test
    void testNextAfterKeepsOtherSettings() {
        QueryOptions options = QueryOptions.builder()
                .datacenter("dc2")
                .consistencyMode(ConsistencyMode.STALE)
                .waitTime(Duration.ofSeconds(30))
                .filter("Service == web")
                .build();
        QueryMeta meta = new QueryMeta(-1L, null, true, Duration.ZERO, Duration.ofMillis(3));

        QueryOptions next = options.nextAfter(meta);

        assertEquals(-1L, next.waitIndex());
        assertTrue(next.isIndexBlocking());
        assertEquals("dc2", next.datacenter());
        assertEquals(ConsistencyMode.STALE, next.consistencyMode());
        assertEquals(Duration.ofSeconds(30), next.waitTime());
        assertEquals("Service == web", next.filter());
    }

    @Test
    void testWriteOptionsDefault() {
        WriteOptions options = WriteOptions.DEFAULT;

        assertNull(options.datacenter());
        assertNull(options.token());
        assertEquals(0, options.relayFactor());
    }

    @Test
    void testExceptions() {
        RequestFailedException failed = new RequestFailedException(503);
        assertEquals(503, failed.getStatusCode());
        assertTrue(failed.getMessage().contains("503"));

        assertEquals("session", new MissingParameterException("session").getParameter());
        assertInstanceOf(ConsulClientException.class, new EmptyKeyException());
        assertInstanceOf(ConsulClientException.class, new DecodeException("bad"));
    }
}
