package com.twlb.node.config;

import com.twlb.core.model.FaultClass;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NodeConfigTest {

    @Test
    void readsFaultForOwnNodeNumber() {
        Map<String, String> env = Map.of(
            "NODE_ID", "node-3",
            "NODE_3_FAULT", "500-error",
            "NODE_4_FAULT", "delay"
        );
        NodeConfig config = NodeConfig.fromEnv(env);

        assertEquals("node-3", config.getNodeId());
        assertEquals(FaultClass.ERROR_500, config.getFaultClass());
    }

    @Test
    void defaultsToBenignAndStandardSettings() {
        NodeConfig config = NodeConfig.fromEnv(Map.of("NODE_ID", "node-11"));

        assertEquals(FaultClass.BENIGN, config.getFaultClass());
        assertEquals(8000, config.getHttpPort());
        assertEquals(Duration.ofMinutes(10), config.getFaultRampWindow());
        assertEquals(Duration.ofMinutes(5), config.getLoadCyclePeriod());
        assertEquals(1_000_000, config.getWorkloadIterations());
        assertTrue(config.isExitOnCrash());
    }

    @Test
    void unknownFaultIsAConfigurationError() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> NodeConfig.fromEnv(Map.of("NODE_ID", "node-2", "NODE_2_FAULT", "byzantine")));
        assertTrue(error.getMessage().contains("NODE_2_FAULT"));
    }

    @Test
    void assignmentKeyUsesNodeNumber() {
        assertEquals("NODE_7_FAULT", FaultAssignments.keyFor("node-7"));
        assertEquals(FaultClass.LIE_LATENCY,
            FaultAssignments.forNode(Map.of("NODE_12_FAULT", "LIE_LATENCY"), "node-12"));
    }
}
