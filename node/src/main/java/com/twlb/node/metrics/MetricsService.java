package com.twlb.node.metrics;

import com.twlb.core.metrics.MetricsNames;
import com.twlb.core.metrics.MetricsTags;
import com.twlb.node.fault.FaultEngine;
import com.twlb.node.fault.ProcessOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;

/**
 * Node-side meters scraped by Prometheus and consumed by the trust weight engine.
 */
public class MetricsService {

    static final String STATUS_OK = "200";
    static final String STATUS_SERVER_ERROR = "500";
    static final String STATUS_CRASH = "error";

    private final Counter requestsOk;
    private final Counter requestsServerError;
    private final Counter requestsCrashed;

    private final Timer latencyOk;
    private final Timer latencyServerError;

    public MetricsService(MeterRegistry registry, FaultEngine engine) {

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        String nodeId = engine.getNodeId();

        requestsOk = requestCounter(registry, nodeId, STATUS_OK);
        requestsServerError = requestCounter(registry, nodeId, STATUS_SERVER_ERROR);
        requestsCrashed = requestCounter(registry, nodeId, STATUS_CRASH);

        latencyOk = latencyTimer(registry, nodeId, STATUS_OK);
        latencyServerError = latencyTimer(registry, nodeId, STATUS_SERVER_ERROR);

        Gauge.builder(MetricsNames.NODE_CPU_USAGE_PERCENT, engine, FaultEngine::getCpuPercent)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Simulated CPU usage in percent")
            .register(registry);

        Gauge.builder(MetricsNames.NODE_MEMORY_MB, engine, FaultEngine::getMemoryMb)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Simulated resident memory in MB")
            .register(registry);
    }

    /**
     * Records a handled request. Uses the true latency, so a lying node is visible here.
     *
     * @param outcome handled request
     */
    public void recordOutcome(ProcessOutcome outcome) {
        if (outcome.isSuccess()) {
            requestsOk.increment();
            latencyOk.record(outcome.getLatency());
        } else {
            requestsServerError.increment();
            latencyServerError.record(outcome.getLatency());
        }
    }

    /**
     * Records a request lost to the crash fault. No latency is observed for it.
     */
    public void recordCrash() {
        requestsCrashed.increment();
    }

    private static Counter requestCounter(MeterRegistry registry, String nodeId, String status) {
        return Counter.builder(MetricsNames.HTTP_REQUESTS)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.STATUS, status)
            .description("Total HTTP Requests")
            .register(registry);
    }

    private static Timer latencyTimer(MeterRegistry registry, String nodeId, String status) {
        return Timer.builder(MetricsNames.REQUEST_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.STATUS, status)
            .description("Request latency distribution")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(250),
                Duration.ofMillis(500),
                Duration.ofMillis(1000),
                Duration.ofMillis(2500),
                Duration.ofMillis(5000),
                Duration.ofMillis(7500)
            )
            .register(registry);
    }
}
