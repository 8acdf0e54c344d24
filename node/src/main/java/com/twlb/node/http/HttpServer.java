package com.twlb.node.http;

import com.twlb.core.util.JsonUtils;
import com.twlb.node.config.NodeConfig;
import com.twlb.node.fault.FaultEngine;
import com.twlb.node.fault.NodeCrashedException;
import com.twlb.node.metrics.MetricsService;
import com.twlb.node.metrics.PrometheusMetricsExporter;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.Connection;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP server exposing the simulated workload, diagnostics and the Prometheus scrape target.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final NodeConfig config;
    private final FaultEngine faultEngine;
    private final MetricsService metricsService;
    private final PrometheusMetricsExporter metricsExporter;

    /**
     * Invoked once when the crash fault fires, after the connection has been dropped.
     */
    private final Runnable onCrash;

    private final AtomicBoolean crashHandled = new AtomicBoolean();
    private DisposableServer server;

    /**
     * Starts the HTTP server.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .route(this::configureRoutes)
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
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
            // Liveness check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Workload simulation with fault injection
            .get("/process", this::process)
            // Diagnostics
            .get("/health", (req, res) ->
                Mono.fromCallable(() -> JsonUtils.writeValueAsString(faultEngine.health()))
                    .flatMap(json ->
                        res.header("Content-Type", "application/json")
                            .sendString(Mono.just(json)).then()
                    )
            )
            // Prometheus scrape target
            .get("/metrics", (req, res) ->
                res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
            );
    }

    private Mono<Void> process(HttpServerRequest req, HttpServerResponse res) {
        return Mono.fromCallable(faultEngine::handleRequest)
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(metricsService::recordOutcome)
            .flatMap(outcome -> Mono.fromCallable(() -> JsonUtils.writeValueAsString(outcome.toPayload()))
                .flatMap(json ->
                    res.status(outcome.httpStatus())
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(json)).then()
                ))
            .onErrorResume(NodeCrashedException.class, err -> {
                metricsService.recordCrash();
                log.error("[{}] Dropping connection: {}", config.getNodeId(), err.getMessage());
                res.withConnection(Connection::dispose);
                if (crashHandled.compareAndSet(false, true)) {
                    onCrash.run();
                }
                return Mono.empty();
            })
            .onErrorResume(err -> {
                log.error("[{}] Request handling failed", config.getNodeId(), err);
                return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                    .sendString(Mono.just("{\"error\":\"Request handling failed\"}")).then();
            });
    }
}
