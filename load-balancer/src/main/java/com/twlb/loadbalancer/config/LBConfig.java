package com.twlb.loadbalancer.config;

import com.twlb.core.model.NodeIds;
import com.twlb.loadbalancer.trust.TrustBands;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the trust-weighted load balancer, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class LBConfig {

    String nodeId;
    int httpPort;

    // Node population
    int nodeCount;
    String nodeHostTemplate;     // String.format template applied to the node id
    int nodePort;
    Duration nodeRequestTimeout;

    // Dispatch loop
    boolean dispatchEnabled;
    Duration dispatchInterval;
    int maxInFlight;

    // Trust weight refresh
    Duration refreshInterval;
    String metricsWindow;        // PromQL range, e.g. 30s
    Duration metricsQueryTimeout;
    Duration classifierTimeout;
    Path modelDir;
    String primaryFaultClass;    // null: p_faulty = 1 - P(benign)

    // Trust bands
    double suspiciousThreshold;
    double faultyThreshold;
    double trustedWeight;
    double suspiciousWeight;
    double faultyWeight;

    Duration shutdownGrace;

    // Prometheus configuration
    String prometheusHost;
    int prometheusPort;

    public static LBConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static LBConfig fromEnv(Map<String, String> env) {
        String primary = getEnv(env, "PRIMARY_FAULT_CLASS", "");
        return LBConfig.builder()
            .nodeId(getEnv(env, "NODE_ID", "tw-lb-1"))
            .httpPort(Integer.parseInt(getEnv(env, "HTTP_PORT", "8081")))
            .nodeCount(Integer.parseInt(getEnv(env, "NODE_COUNT", "15")))
            .nodeHostTemplate(getEnv(env, "NODE_HOST_TEMPLATE", "%s"))
            .nodePort(Integer.parseInt(getEnv(env, "NODE_PORT", "8000")))
            .nodeRequestTimeout(Duration.ofMillis(Long.parseLong(getEnv(env, "NODE_REQUEST_TIMEOUT_MS", "5000"))))
            .dispatchEnabled(Boolean.parseBoolean(getEnv(env, "DISPATCH_ENABLED", "true")))
            .dispatchInterval(Duration.ofMillis(Long.parseLong(getEnv(env, "DISPATCH_INTERVAL_MS", "500"))))
            .maxInFlight(Integer.parseInt(getEnv(env, "MAX_IN_FLIGHT", "64")))
            .refreshInterval(Duration.ofSeconds(Long.parseLong(getEnv(env, "REFRESH_INTERVAL_SEC", "5"))))
            .metricsWindow(getEnv(env, "METRICS_WINDOW", "30s"))
            .metricsQueryTimeout(Duration.ofMillis(Long.parseLong(getEnv(env, "METRICS_QUERY_TIMEOUT_MS", "2000"))))
            .classifierTimeout(Duration.ofMillis(Long.parseLong(getEnv(env, "CLASSIFIER_TIMEOUT_MS", "1000"))))
            .modelDir(Path.of(getEnv(env, "MODEL_DIR", "artifacts")))
            .primaryFaultClass(primary.isBlank() ? null : primary.trim())
            .suspiciousThreshold(Double.parseDouble(getEnv(env, "SUSPICIOUS_THRESHOLD", "0.20")))
            .faultyThreshold(Double.parseDouble(getEnv(env, "FAULTY_THRESHOLD", "0.60")))
            .trustedWeight(Double.parseDouble(getEnv(env, "TRUSTED_WEIGHT", "1.0")))
            .suspiciousWeight(Double.parseDouble(getEnv(env, "SUSPICIOUS_WEIGHT", "0.5")))
            .faultyWeight(Double.parseDouble(getEnv(env, "FAULTY_WEIGHT", "0.1")))
            .shutdownGrace(Duration.ofSeconds(Long.parseLong(getEnv(env, "SHUTDOWN_GRACE_SEC", "10"))))
            .prometheusHost(getEnv(env, "PROMETHEUS_HOST", "prometheus"))
            .prometheusPort(Integer.parseInt(getEnv(env, "PROMETHEUS_PORT", "9090")))
            .build();
    }

    /**
     * @return {@code node-1 .. node-N}
     */
    public List<String> nodeIds() {
        return NodeIds.range(nodeCount);
    }

    public TrustBands trustBands() {
        return TrustBands.builder()
            .suspiciousThreshold(suspiciousThreshold)
            .faultyThreshold(faultyThreshold)
            .trustedWeight(trustedWeight)
            .suspiciousWeight(suspiciousWeight)
            .faultyWeight(faultyWeight)
            .build();
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }
}
