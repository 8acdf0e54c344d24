package com.twlb.node.config;

import com.twlb.core.model.FaultClass;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for a simulated node, loaded from environment variables once at startup.
 */
@Value
@Builder(toBuilder = true)
public class NodeConfig {

    String nodeId;
    int httpPort;
    FaultClass faultClass;

    // Fault model
    Duration faultRampWindow;    // time until fault probability saturates at 1.5x base
    Duration loadCyclePeriod;    // length of one simulated traffic cycle
    long workloadIterations;     // CPU loop size at load factor 1.0

    // Whether the crash fault terminates the JVM
    boolean exitOnCrash;

    public static NodeConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static NodeConfig fromEnv(Map<String, String> env) {
        String nodeId = getEnv(env, "NODE_ID", "node-1");
        return NodeConfig.builder()
            .nodeId(nodeId)
            .httpPort(Integer.parseInt(getEnv(env, "HTTP_PORT", "8000")))
            .faultClass(FaultAssignments.forNode(env, nodeId))
            .faultRampWindow(Duration.ofSeconds(Long.parseLong(getEnv(env, "FAULT_RAMP_WINDOW_SEC", "600"))))
            .loadCyclePeriod(Duration.ofSeconds(Long.parseLong(getEnv(env, "LOAD_CYCLE_PERIOD_SEC", "300"))))
            .workloadIterations(Long.parseLong(getEnv(env, "WORKLOAD_ITERATIONS", "1000000")))
            .exitOnCrash(Boolean.parseBoolean(getEnv(env, "EXIT_ON_CRASH", "true")))
            .build();
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }
}
