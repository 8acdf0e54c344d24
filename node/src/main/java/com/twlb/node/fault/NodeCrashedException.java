package com.twlb.node.fault;

/**
 * Thrown when the crash fault fires. The node answers no further requests afterwards.
 */
public class NodeCrashedException extends RuntimeException {

    private final String nodeId;

    public NodeCrashedException(String nodeId) {
        super("Node " + nodeId + " crashed");
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
