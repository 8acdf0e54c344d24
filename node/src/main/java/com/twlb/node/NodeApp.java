package com.twlb.node;

import com.twlb.node.config.NodeConfig;
import com.twlb.node.fault.FaultEngine;
import com.twlb.node.fault.Sleeper;
import com.twlb.node.http.HttpServer;
import com.twlb.node.metrics.MetricsService;
import com.twlb.node.metrics.PrometheusMetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.netty.DisposableServer;

import java.time.Clock;

/**
 * Main entry point for a simulated node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve the simulated workload at /process with the configured fault class</li>
 *   <li>Expose /health diagnostics and /healthz liveness</li>
 *   <li>Expose request, latency, CPU and memory meters at /metrics</li>
 *   <li>Terminate the process when the crash fault fires (EXIT_ON_CRASH)</li>
 * </ul>
 * </p>
 */
public class NodeApp {
    private static final Logger log = LoggerFactory.getLogger(NodeApp.class);

    public static void main(String[] args) {
        NodeConfig config = NodeConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting node: {}", config.getNodeId());
        log.info("  Fault type: {}", config.getFaultClass());
        log.info("  Fault ramp window: {}", config.getFaultRampWindow());

        FaultEngine faultEngine = new FaultEngine(
            config.getNodeId(),
            config.getFaultClass(),
            config.getFaultRampWindow(),
            config.getLoadCyclePeriod(),
            config.getWorkloadIterations(),
            Clock.systemUTC(),
            Sleeper.THREAD
        );

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter();
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), faultEngine);

        HttpServer httpServer = new HttpServer(
            config,
            faultEngine,
            metricsService,
            metricsExporter,
            () -> handleCrash(config)
        );

        DisposableServer disposableServer = httpServer.start();

        log.info("Node {} is ready", config.getNodeId());

        handleShutdown(config, httpServer);

        disposableServer.onDispose().block();
    }

    private static void handleCrash(NodeConfig config) {
        if (!config.isExitOnCrash()) {
            log.warn("Crash fault fired; node stays up but refuses all further requests");
            return;
        }
        // Exit off the event loop so the shutdown hook can dispose the server
        Thread exit = new Thread(() -> {
            log.error("Crash fault fired, exiting with status 1");
            System.exit(1);
        }, "crash-exit");
        exit.start();
    }

    private static void handleShutdown(NodeConfig config, HttpServer httpServer) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            httpServer.stop();

            log.info("Shutdown complete");
        }));
    }
}
