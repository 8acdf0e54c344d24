package com.twlb.loadbalancer;

import com.twlb.loadbalancer.config.LBConfig;
import com.twlb.loadbalancer.dispatch.HttpNodeClient;
import com.twlb.loadbalancer.dispatch.WeightedDispatcher;
import com.twlb.loadbalancer.http.HttpServer;
import com.twlb.loadbalancer.metrics.PrometheusMetricsExporter;
import com.twlb.loadbalancer.metrics.PrometheusObservationSource;
import com.twlb.loadbalancer.metrics.PrometheusQueryService;
import com.twlb.loadbalancer.trust.ITrustClassifier;
import com.twlb.loadbalancer.trust.TrustClassifiers;
import com.twlb.loadbalancer.trust.TrustWeightEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.netty.DisposableServer;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

public class LoadBalancerApp {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancerApp.class);

    public static void main(String[] args) {
        LBConfig config = LBConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting Trust-Weighted Load-Balancer");
        log.info("  Nodes: {} ({}:{})", config.getNodeCount(), config.getNodeHostTemplate(), config.getNodePort());
        log.info("  Prometheus: {}:{}", config.getPrometheusHost(), config.getPrometheusPort());
        log.info("  Model dir: {}", config.getModelDir().toAbsolutePath());

        // Setup metrics
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        PrometheusQueryService prometheusQueryService = new PrometheusQueryService(
            config.getPrometheusHost(), config.getPrometheusPort(), config.getMetricsQueryTimeout()
        );
        prometheusQueryService.healthCheck()
            .subscribe(healthy -> {
                if (!healthy) {
                    log.warn("Prometheus is not reachable yet, nodes will be observed with neutral telemetry");
                }
            });

        // Initialize components
        ITrustClassifier classifier = TrustClassifiers.load(config.getModelDir());
        TrustWeightEngine trustWeightEngine = new TrustWeightEngine(
            config,
            new PrometheusObservationSource(
                prometheusQueryService, config.getMetricsWindow(), config.getMetricsQueryTimeout(), Clock.systemUTC()
            ),
            classifier,
            metricsExporter.getRegistry(),
            Clock.systemUTC()
        );
        WeightedDispatcher dispatcher = new WeightedDispatcher(
            config.nodeIds(),
            trustWeightEngine,
            new HttpNodeClient(config.getNodeHostTemplate(), config.getNodePort(), config.getNodeRequestTimeout()),
            metricsExporter.getRegistry(),
            ThreadLocalRandom::current
        );

        // Start HTTP server
        HttpServer httpServer = new HttpServer(config, trustWeightEngine, dispatcher, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        trustWeightEngine.start();
        if (config.isDispatchEnabled()) {
            dispatcher.start(config.getDispatchInterval(), config.getMaxInFlight());
        } else {
            log.info("Dispatch loop disabled, serving /api/v1/dispatch only");
        }

        log.info("Load-Balancer is ready");

        handleShutDown(config, dispatcher, trustWeightEngine, classifier, httpServer);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(
        LBConfig config,
        WeightedDispatcher dispatcher,
        TrustWeightEngine trustWeightEngine,
        ITrustClassifier classifier,
        HttpServer httpServer
    ) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            dispatcher.stop(config.getShutdownGrace());

            trustWeightEngine.stop(config.getShutdownGrace());
            classifier.close();

            httpServer.stop();

            log.info("Shutdown complete");
        }));
    }
}
