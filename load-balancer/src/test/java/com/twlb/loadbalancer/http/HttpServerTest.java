package com.twlb.loadbalancer.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.twlb.core.util.JsonUtils;
import com.twlb.loadbalancer.config.LBConfig;
import com.twlb.loadbalancer.dispatch.DispatchOutcome;
import com.twlb.loadbalancer.dispatch.DispatchStatus;
import com.twlb.loadbalancer.dispatch.IDispatcher;
import com.twlb.loadbalancer.dispatch.NodeSelection;
import com.twlb.loadbalancer.metrics.PrometheusMetricsExporter;
import com.twlb.loadbalancer.trust.RoutingMode;
import com.twlb.loadbalancer.trust.RoutingTable;
import com.twlb.loadbalancer.trust.TrustState;
import com.twlb.loadbalancer.trust.TrustTier;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpServerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private HttpServer httpServer;

    /**
     * Dispatcher that always returns the same outcome.
     */
    private record FixedDispatcher(DispatchOutcome outcome) implements IDispatcher {
        @Override
        public NodeSelection select() {
            return new NodeSelection(outcome.getNodeId(), outcome.getMode());
        }

        @Override
        public Mono<DispatchOutcome> dispatch() {
            return Mono.just(outcome);
        }
    }

    private HttpClient start(DispatchOutcome outcome) {
        RoutingTable table = RoutingTable.of(List.of(
            TrustState.builder().nodeId("node-1").weight(1.0).tier(TrustTier.TRUSTED)
                .pFaulty(0.05).probabilities(Map.of("benign", 0.95, "error-500", 0.05)).updatedAt(NOW).build(),
            TrustState.builder().nodeId("node-2").weight(0.1).tier(TrustTier.FAULTY)
                .pFaulty(0.9).updatedAt(NOW).build()
        ), RoutingMode.TRUST_WEIGHTED, NOW);
        LBConfig config = LBConfig.fromEnv(Map.of()).toBuilder().httpPort(0).build();
        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter(new CompositeMeterRegistry(), "tw-lb-test");

        httpServer = new HttpServer(config, () -> table, new FixedDispatcher(outcome), exporter);
        DisposableServer server = httpServer.start();
        return HttpClient.create().host("localhost").port(server.port());
    }

    @AfterEach
    void tearDown() {
        if (httpServer != null) {
            httpServer.stop();
        }
    }

    private static DispatchOutcome success() {
        return DispatchOutcome.builder()
            .nodeId("node-1")
            .mode(RoutingMode.TRUST_WEIGHTED)
            .status(DispatchStatus.SUCCESS)
            .httpStatus(200)
            .latency(Duration.ofMillis(52))
            .body("{\"node\":\"node-1\",\"status\":\"ok\"}")
            .build();
    }

    @Test
    void routingSnapshot() {
        HttpClient client = start(success());

        String body = client.get().uri("/api/v1/routing")
            .responseContent().aggregate().asString()
            .block(Duration.ofSeconds(10));

        Map<String, Object> snapshot = JsonUtils.readValue(body, new TypeReference<>() { });
        assertEquals("TRUST_WEIGHTED", snapshot.get("mode"));
        assertEquals(1.1, ((Number) snapshot.get("totalWeight")).doubleValue(), 1e-9);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> nodes = (List<Map<String, Object>>) snapshot.get("nodes");
        assertEquals(2, nodes.size());
        assertEquals("node-2", nodes.get(1).get("nodeId"));
        assertEquals("faulty", nodes.get(1).get("tier"));
        assertEquals(0.1, ((Number) nodes.get(1).get("weight")).doubleValue());
    }

    @Test
    void dispatchPassesNodeResponseThrough() {
        HttpClient client = start(success());

        String body = client.get().uri("/api/v1/dispatch")
            .responseSingle((res, content) -> {
                assertEquals(200, res.status().code());
                return content.asString();
            })
            .block(Duration.ofSeconds(10));

        assertEquals("{\"node\":\"node-1\",\"status\":\"ok\"}", body);
    }

    @Test
    void dispatchWithoutResponseIsBadGateway() {
        HttpClient client = start(DispatchOutcome.builder()
            .nodeId("node-3")
            .mode(RoutingMode.ROUND_ROBIN)
            .status(DispatchStatus.TIMEOUT)
            .latency(Duration.ofSeconds(5))
            .reason("timeout")
            .build());

        String body = client.get().uri("/api/v1/dispatch")
            .responseSingle((res, content) -> {
                assertEquals(502, res.status().code());
                return content.asString();
            })
            .block(Duration.ofSeconds(10));

        Map<String, Object> payload = JsonUtils.readValue(body, new TypeReference<>() { });
        assertEquals(Map.of("node", "node-3", "status", "failure", "reason", "timeout"), payload);
    }

    @Test
    void healthz() {
        HttpClient client = start(success());

        String body = client.get().uri("/healthz")
            .responseContent().aggregate().asString()
            .block(Duration.ofSeconds(10));

        assertEquals("OK", body);
    }
}
