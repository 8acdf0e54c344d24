package com.twlb.loadbalancer.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Wrapper for Prometheus query results with convenient accessors.
 * <p>
 * Non-finite samples ({@code NaN}, {@code +Inf}, {@code -Inf}) are reported as 0.0, the
 * neutral value for every metric the trust engine consumes.
 * </p>
 */
public class PrometheusQueryResult {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryResult.class);

    private final List<PrometheusQueryService.PrometheusResult> results;

    private PrometheusQueryResult(List<PrometheusQueryService.PrometheusResult> results) {
        this.results = results != null ? results : Collections.emptyList();
    }

    /**
     * Creates a PrometheusQueryResult from a Prometheus API response.
     *
     * @param response Prometheus API response
     * @return PrometheusQueryResult instance
     */
    public static PrometheusQueryResult from(PrometheusQueryService.PrometheusResponse response) {
        if (response == null || response.getData() == null) {
            return empty();
        }
        return new PrometheusQueryResult(response.getData().getResult());
    }

    /**
     * Creates an empty result.
     *
     * @return Empty PrometheusQueryResult
     */
    public static PrometheusQueryResult empty() {
        return new PrometheusQueryResult(Collections.emptyList());
    }

    /**
     * Gets the single scalar value from the query result.
     * Use this for queries that return a single number (e.g., sum(), avg()).
     *
     * @return Optional<Double> the value if present
     */
    public Optional<Double> getValue() {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return parseSample(results.get(0));
    }

    /**
     * Gets all results as a list.
     *
     * @return List of Prometheus results
     */
    public List<PrometheusQueryService.PrometheusResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int size() {
        return results.size();
    }

    private static Optional<Double> parseSample(PrometheusQueryService.PrometheusResult result) {
        // Prometheus returns [timestamp, "value"]
        if (result.getValue() == null || result.getValue().size() < 2) {
            return Optional.empty();
        }
        Object valueObj = result.getValue().get(1);
        try {
            double value;
            if (valueObj instanceof String valueStr) {
                // Prometheus spells infinities +Inf / -Inf
                value = valueStr.endsWith("Inf")
                    ? Double.POSITIVE_INFINITY
                    : Double.parseDouble(valueStr);
            } else if (valueObj instanceof Number number) {
                value = number.doubleValue();
            } else {
                return Optional.empty();
            }
            if (!Double.isFinite(value)) {
                log.debug("Received non-numeric value from Prometheus: {}", valueObj);
                return Optional.of(0.0);
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            log.error("Failed to parse Prometheus value: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
