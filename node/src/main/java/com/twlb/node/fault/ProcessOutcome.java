package com.twlb.node.fault;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Result of one handled request.
 * <p>
 * {@code latency} is what actually elapsed (and what the latency histogram records);
 * {@code reportedLatency} is what the node claims in its payload. The two differ only for
 * a lying node.
 * </p>
 */
@Value
@Builder
public class ProcessOutcome {

    public enum Status {
        OK(200, "ok"),
        ERROR(500, "error");

        private final int httpStatus;
        private final String label;

        Status(int httpStatus, String label) {
            this.httpStatus = httpStatus;
            this.label = label;
        }

        public int httpStatus() {
            return httpStatus;
        }

        public String label() {
            return label;
        }
    }

    String nodeId;
    Status status;
    Duration latency;
    Duration reportedLatency;
    double loadFactor;
    long requestNum;

    public int httpStatus() {
        return status.httpStatus();
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }

    /**
     * @return reported latency formatted like {@code 0.052s}
     */
    public String processedIn() {
        return String.format(Locale.ROOT, "%.3fs", reportedLatency.toNanos() / 1_000_000_000.0);
    }

    /**
     * Body of {@code GET /process}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node", nodeId);
        payload.put("status", status.label());
        payload.put("processed_in", processedIn());
        payload.put("load_factor", Math.round(loadFactor * 1000.0) / 1000.0);
        payload.put("request_num", requestNum);
        return payload;
    }
}
