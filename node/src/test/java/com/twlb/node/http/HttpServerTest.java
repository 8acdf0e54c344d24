package com.twlb.node.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.twlb.core.model.FaultClass;
import com.twlb.core.util.JsonUtils;
import com.twlb.node.config.NodeConfig;
import com.twlb.node.fault.FaultEngine;
import com.twlb.node.fault.NodeCrashedException;
import com.twlb.node.fault.ProcessOutcome;
import com.twlb.node.metrics.MetricsService;
import com.twlb.node.metrics.PrometheusMetricsExporter;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.PrematureCloseException;
import reactor.test.StepVerifier;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HttpServerTest {

    private HttpServer httpServer;
    private HttpClient client;
    private PrometheusMetricsExporter exporter;
    private final AtomicInteger crashes = new AtomicInteger();

    private static NodeConfig config(String nodeId, FaultClass faultClass, Duration rampWindow) {
        return NodeConfig.builder()
            .nodeId(nodeId)
            .httpPort(0)
            .faultClass(faultClass)
            .faultRampWindow(rampWindow)
            .loadCyclePeriod(Duration.ofMinutes(5))
            .workloadIterations(1000)
            .exitOnCrash(false)
            .build();
    }

    private static FaultEngine engine(NodeConfig config) {
        return new FaultEngine(config.getNodeId(), config.getFaultClass(),
            config.getFaultRampWindow(), config.getLoadCyclePeriod(), config.getWorkloadIterations(),
            Clock.systemUTC(), duration -> { });
    }

    private void start(NodeConfig config, FaultEngine engine) {
        exporter = new PrometheusMetricsExporter(new CompositeMeterRegistry());
        MetricsService metricsService = new MetricsService(exporter.getRegistry(), engine);

        httpServer = new HttpServer(config, engine, metricsService, exporter, crashes::incrementAndGet);
        DisposableServer server = httpServer.start();
        client = HttpClient.create().host("localhost").port(server.port()).disableRetry(true);
    }

    @BeforeEach
    void setUp() {
        NodeConfig config = config("node-2", FaultClass.BENIGN, Duration.ofMinutes(10));
        start(config, engine(config));
    }

    @AfterEach
    void tearDown() {
        httpServer.stop();
    }

    /**
     * Engine that has already crashed: every request aborts.
     */
    static class CrashedFaultEngine extends FaultEngine {
        CrashedFaultEngine(NodeConfig config) {
            super(config.getNodeId(), config.getFaultClass(), config.getFaultRampWindow(),
                config.getLoadCyclePeriod(), 0, Clock.systemUTC(), duration -> { });
        }

        @Override
        public ProcessOutcome handleRequest() {
            throw new NodeCrashedException(getNodeId());
        }
    }

    @Test
    void processReturnsWorkloadPayload() {
        String body = client.get().uri("/process")
            .responseSingle((res, content) -> {
                assertEquals(200, res.status().code());
                return content.asString();
            })
            .block(Duration.ofSeconds(10));

        Map<String, Object> payload = JsonUtils.readValue(body, new TypeReference<>() { });
        assertEquals("node-2", payload.get("node"));
        assertEquals("ok", payload.get("status"));
        assertTrue(((String) payload.get("processed_in")).endsWith("s"));
        assertEquals(1, ((Number) payload.get("request_num")).intValue());
        assertNotNull(payload.get("load_factor"));
    }

    @Test
    void healthReportsFaultTypeAndRequests() {
        client.get().uri("/process").response().block(Duration.ofSeconds(10));

        String body = client.get().uri("/health")
            .responseContent().aggregate().asString()
            .block(Duration.ofSeconds(10));

        Map<String, Object> health = JsonUtils.readValue(body, new TypeReference<>() { });
        assertEquals("node-2", health.get("node"));
        assertEquals("healthy", health.get("status"));
        assertEquals("benign", health.get("fault_type"));
        assertEquals(1, ((Number) health.get("total_requests")).intValue());
        assertTrue(health.containsKey("uptime_seconds"));
    }

    @Test
    void metricsEndpointServesPrometheusText() {
        client.get().uri("/process").response().block(Duration.ofSeconds(10));

        String scrape = client.get().uri("/metrics")
            .responseContent().aggregate().asString()
            .block(Duration.ofSeconds(10));

        assertNotNull(scrape);
        assertTrue(scrape.contains("http_requests_total"));
        assertTrue(scrape.contains("node_id=\"node-2\""));
    }

    @Test
    @DisplayName("Crashed node drops connections without a response and runs the crash hook once")
    void crashDropsConnectionWithoutResponse() throws InterruptedException {
        httpServer.stop();
        NodeConfig config = config("node-4", FaultClass.CRASH, Duration.ofMinutes(10));
        start(config, new CrashedFaultEngine(config));

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(client.get().uri("/process").responseSingle((res, content) -> content.asString()))
                .expectErrorMatches(err -> err instanceof PrematureCloseException)
                .verify(Duration.ofSeconds(10));
        }

        long deadline = System.currentTimeMillis() + 2_000;
        while (crashes.get() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        Thread.sleep(50);
        assertEquals(1, crashes.get());

        String scrape = client.get().uri("/metrics")
            .responseContent().aggregate().asString()
            .block(Duration.ofSeconds(10));
        assertNotNull(scrape);
        assertTrue(scrape.contains("http_requests_total{node_id=\"node-4\",status=\"error\"} 3.0"), scrape);
    }

    @Test
    @DisplayName("Error-500 node answers HTTP 500 with an error payload")
    void error500NodeAnswersServerError() {
        httpServer.stop();
        NodeConfig config = config("node-3", FaultClass.ERROR_500, Duration.ZERO);
        start(config, engine(config));

        int errors = 0;
        int ok = 0;
        for (int i = 0; i < 20; i++) {
            Tuple2<Integer, String> reply = client.get().uri("/process")
                .responseSingle((res, content) -> content.asString().map(body -> Tuples.of(res.status().code(), body)))
                .block(Duration.ofSeconds(10));
            assertNotNull(reply);
            Map<String, Object> payload = JsonUtils.readValue(reply.getT2(), new TypeReference<>() { });
            assertEquals("node-3", payload.get("node"));
            if (reply.getT1() == 500) {
                errors++;
                assertEquals("error", payload.get("status"));
            } else {
                ok++;
                assertEquals(200, reply.getT1());
                assertEquals("ok", payload.get("status"));
            }
        }
        assertTrue(errors > 0, "no error-500 response in 20 requests");
        assertTrue(ok > 0, "no successful response in 20 requests");
    }
}
