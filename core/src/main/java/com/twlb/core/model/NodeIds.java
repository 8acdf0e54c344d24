package com.twlb.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the {@code node-<n>} identifier scheme shared by nodes and the load balancer.
 */
public final class NodeIds {
    private NodeIds() {
    }

    public static final String PREFIX = "node-";

    public static String format(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Node number must be >= 1, got " + number);
        }
        return PREFIX + number;
    }

    /**
     * Extracts the numeric part of a node id.
     *
     * @param nodeId id such as {@code node-7}
     * @return 7 for {@code node-7}
     * @throws IllegalArgumentException if the id does not follow the scheme
     */
    public static int parse(String nodeId) {
        if (nodeId == null || !nodeId.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Invalid node id: " + nodeId);
        }
        try {
            int number = Integer.parseInt(nodeId.substring(PREFIX.length()));
            if (number < 1) {
                throw new IllegalArgumentException("Invalid node id: " + nodeId);
            }
            return number;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid node id: " + nodeId, e);
        }
    }

    /**
     * @return {@code node-1 .. node-count}, in order
     */
    public static List<String> range(int count) {
        List<String> ids = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            ids.add(format(i));
        }
        return List.copyOf(ids);
    }
}
