package com.twlb.loadbalancer.trust;

import com.twlb.core.model.FaultClass;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Class probabilities produced by a classifier for one feature vector.
 */
@Getter
public final class ClassPrediction {

    private final List<String> labels;
    private final double[] probabilities;
    @Getter(AccessLevel.NONE)
    private final List<String> canonicalLabels;

    public ClassPrediction(List<String> labels, double[] probabilities) {
        if (labels.size() != probabilities.length) {
            throw new IllegalArgumentException(
                "Got " + probabilities.length + " probabilities for " + labels.size() + " labels");
        }
        this.labels = List.copyOf(labels);
        this.probabilities = probabilities.clone();
        this.canonicalLabels = labels.stream().map(ClassPrediction::canonical).toList();
    }

    public double[] getProbabilities() {
        return probabilities.clone();
    }

    /**
     * Known fault labels match in any spelling {@link FaultClass#find(String)} accepts.
     *
     * @return probability of the given class, 0.0 when the model does not know it
     */
    public double probabilityOf(String label) {
        int index = canonicalLabels.indexOf(canonical(label));
        return index < 0 ? 0.0 : probabilities[index];
    }

    /**
     * Probability that the node misbehaves.
     *
     * @param primaryFaultClass when non-null, the class whose probability is used directly;
     *                          otherwise {@code 1 - P(benign)}
     */
    public double pFaulty(String primaryFaultClass) {
        double p = primaryFaultClass != null
            ? probabilityOf(primaryFaultClass)
            : 1.0 - probabilityOf(FaultClass.BENIGN.label());
        if (Double.isNaN(p)) {
            return p;
        }
        return Math.max(0.0, Math.min(1.0, p));
    }

    /**
     * @return label to probability, in model class order
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            map.put(labels.get(i), probabilities[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    private static String canonical(String label) {
        return FaultClass.find(label).map(FaultClass::label).orElse(label);
    }

    @Override
    public String toString() {
        return "ClassPrediction" + asMap();
    }
}
