package com.twlb.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Category of misbehavior a simulated node exhibits.
 * <p>
 * The label is the wire/configuration form (e.g. {@code NODE_3_FAULT=error-500}) and the
 * class name used by the trust classifier's label encoder.
 * </p>
 */
public enum FaultClass {
    BENIGN("benign", 0.0),
    CRASH("crash", 0.001),
    DELAY("delay", 0.5),
    ERROR_500("error-500", 0.4),
    LIE_LATENCY("lie-latency", 0.7);

    private final String label;
    private final double baseProbability;

    FaultClass(String label, double baseProbability) {
        this.label = label;
        this.baseProbability = baseProbability;
    }

    public String label() {
        return label;
    }

    /**
     * Probability of misbehaving on a single request before time-based degradation.
     */
    public double baseProbability() {
        return baseProbability;
    }

    public boolean isFaulty() {
        return this != BENIGN;
    }

    /**
     * Looks up a fault label. Accepts the legacy {@code 500-error} spelling and ignores case.
     *
     * @param value label as found in configuration or a model's label encoder
     * @return matching fault class, empty if the label is unknown or null
     */
    public static Optional<FaultClass> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if ("500-error".equals(normalized)) {
            return Optional.of(ERROR_500);
        }
        for (FaultClass faultClass : values()) {
            if (faultClass.label.equals(normalized)) {
                return Optional.of(faultClass);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a fault label, see {@link #find(String)}.
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static FaultClass fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Fault label must not be null");
        }
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown fault class: " + value));
    }

    @Override
    public String toString() {
        return label;
    }
}
