package com.twlb.loadbalancer.dispatch;

import com.twlb.loadbalancer.trust.RoutingMode;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one dispatched request. Failures are outcomes too.
 */
@Value
@Builder
public class DispatchOutcome {
    String nodeId;
    RoutingMode mode;
    DispatchStatus status;

    /**
     * 0 when no HTTP response was received.
     */
    int httpStatus;

    Duration latency;

    /**
     * Node response body, null when none was received.
     */
    String body;

    /**
     * Failure description, null on success.
     */
    String reason;

    public boolean hasResponse() {
        return httpStatus > 0;
    }

    /**
     * Body returned to a client when no node answered.
     */
    public Map<String, Object> toFailurePayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node", nodeId);
        payload.put("status", "failure");
        payload.put("reason", reason != null ? reason : status.tag());
        return payload;
    }
}
