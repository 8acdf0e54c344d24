package com.twlb.loadbalancer.http;

import com.twlb.core.util.JsonUtils;
import com.twlb.loadbalancer.config.LBConfig;
import com.twlb.loadbalancer.dispatch.DispatchOutcome;
import com.twlb.loadbalancer.dispatch.IDispatcher;
import com.twlb.loadbalancer.metrics.Observation;
import com.twlb.loadbalancer.metrics.PrometheusMetricsExporter;
import com.twlb.loadbalancer.trust.RoutingTable;
import com.twlb.loadbalancer.trust.TrustState;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * HTTP server for load-balancer endpoints.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final LBConfig config;
    private final Supplier<RoutingTable> routingTable;
    private final IDispatcher dispatcher;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(
        LBConfig config,
        Supplier<RoutingTable> routingTable,
        IDispatcher dispatcher,
        PrometheusMetricsExporter metricsExporter
    ) {
        this.config = config;
        this.routingTable = routingTable;
        this.dispatcher = dispatcher;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Health check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Metrics endpoint
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            // Current routing table
            .get("/api/v1/routing", (req, res) ->
                Mono.fromCallable(() -> JsonUtils.writeValueAsString(routingSnapshot(routingTable.get())))
                    .flatMap(json -> sendJson(res, HttpResponseStatus.OK, json))
                    .onErrorResume(err -> {
                        log.error("Failed to serialize routing table", err);
                        return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                            .sendString(Mono.just("{\"error\":\"Serialization failed\"}")).then();
                    })
            )
            // Forward one request through the dispatcher
            .get("/api/v1/dispatch", (req, res) ->
                dispatcher.dispatch().flatMap(outcome -> respond(res, outcome))
            );
    }

    private Mono<Void> respond(HttpServerResponse res, DispatchOutcome outcome) {
        if (outcome.hasResponse()) {
            String body = outcome.getBody() != null ? outcome.getBody() : "";
            return sendJson(res, HttpResponseStatus.valueOf(outcome.getHttpStatus()), body);
        }
        return sendJson(res, HttpResponseStatus.BAD_GATEWAY,
            JsonUtils.writeValueAsString(outcome.toFailurePayload()));
    }

    private static Mono<Void> sendJson(HttpServerResponse res, HttpResponseStatus status, String json) {
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(json))
            .then();
    }

    static Map<String, Object> routingSnapshot(RoutingTable table) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (TrustState state : table.getStates().values()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("nodeId", state.getNodeId());
            node.put("weight", state.getWeight());
            node.put("tier", state.getTier().label());
            node.put("pFaulty", state.getPFaulty());
            node.put("probabilities", state.getProbabilities());
            Observation observation = state.getObservation();
            if (observation != null) {
                Map<String, Object> telemetry = new HashMap<>();
                telemetry.put("latencyMs", observation.getAvgLatencyMs());
                telemetry.put("errorCount", observation.getErrorCount());
                telemetry.put("cpuRate", observation.getCpuRate());
                telemetry.put("memoryMb", observation.getMemoryMb());
                node.put("observation", telemetry);
            }
            node.put("updatedAt", state.getUpdatedAt() != null ? state.getUpdatedAt().toString() : null);
            nodes.add(node);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("mode", table.getMode().name());
        response.put("builtAt", table.getBuiltAt().toString());
        response.put("totalWeight", table.totalWeight());
        response.put("nodes", nodes);
        return response;
    }
}
