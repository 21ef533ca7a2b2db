package io.consul.client.http.vertx;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.consul.client.ConsulClient;
import io.consul.client.ConsulConfig;
import io.consul.spec.QueryOptions;
import io.consul.spec.QueryResult;
import io.consul.spec.ServiceEntry;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Makes sure the Vert.x transport can be plugged into {@link ConsulConfig} and carries a blocking read end to end.
 */
public class ConsulClientBuilderTest {

    private WireMockServer server;
    private Vertx vertx;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        vertx = Vertx.vertx();

        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() throws Exception {
        if (server != null) {
            server.stop();
        }
        if (vertx != null) {
            vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    public void shouldRunBlockingReadOverVertx() throws Exception {
        givenThat(get(urlEqualTo("/v1/health/service/web?passing&index=4&wait=1000ms"))
                .willReturn(okForContentType("application/json", "[{\"Service\": {\"ID\": \"web-1\", \"Service\": \"web\"}}]")
                        .withHeader("X-Consul-Index", "5")
                        .withHeader("X-Consul-KnownLeader", "true")));

        ConsulClient consul = new ConsulClient(ConsulConfig.builder()
                .address("http://localhost:" + server.port())
                .httpClientBuilder(new VertxHttpClientBuilder().vertx(vertx))
                .build());

        QueryOptions options = QueryOptions.builder().waitIndex(4).waitTime(Duration.ofSeconds(1)).build();
        QueryResult<List<ServiceEntry>> result = consul.health()
                .listServiceInstances("web", null, true, options)
                .get(5, TimeUnit.SECONDS);

        assertNotNull(result.value());
        assertEquals(1, result.value().size());
        assertEquals(5, result.meta().lastIndex());
        assertTrue(result.meta().knownLeader());
    }
}
