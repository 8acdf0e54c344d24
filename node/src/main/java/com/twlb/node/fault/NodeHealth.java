package com.twlb.node.fault;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Diagnostic snapshot served by {@code GET /health}.
 */
@Value
@Builder
@JsonPropertyOrder({"node", "status", "uptime_seconds", "fault_type", "total_requests"})
public class NodeHealth {

    @JsonProperty("node")
    String node;

    /**
     * {@code healthy}, or {@code crashed} once the crash fault has fired.
     */
    @JsonProperty("status")
    String status;

    @JsonProperty("uptime_seconds")
    double uptimeSeconds;

    @JsonProperty("fault_type")
    String faultType;

    @JsonProperty("total_requests")
    long totalRequests;
}
