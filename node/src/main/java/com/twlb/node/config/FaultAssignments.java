package com.twlb.node.config;

import com.twlb.core.model.FaultClass;
import com.twlb.core.model.NodeIds;

import java.util.Map;

/**
 * Reads the {@code NODE_<n>_FAULT=<fault>} entries of an environment-style mapping.
 */
public final class FaultAssignments {
    private FaultAssignments() {
    }

    /**
     * @return the fault assigned to {@code nodeId}, benign when the key is absent
     */
    public static FaultClass forNode(Map<String, String> env, String nodeId) {
        String key = keyFor(nodeId);
        String value = env.get(key);
        return value == null ? FaultClass.BENIGN : parseValue(key, value);
    }

    public static String keyFor(String nodeId) {
        return "NODE_" + NodeIds.parse(nodeId) + "_FAULT";
    }

    private static FaultClass parseValue(String key, String value) {
        try {
            return FaultClass.fromLabel(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }
}
