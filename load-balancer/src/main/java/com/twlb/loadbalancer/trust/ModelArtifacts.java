package com.twlb.loadbalancer.trust;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Files a trained classifier is exported as.
 */
public final class ModelArtifacts {
    /**
     * Scaler + classifier pipeline exported with skl2onnx.
     */
    public static final String MODEL_FILE = "model.onnx";
    public static final String LABEL_ENCODER_FILE = "label-encoder.json";

    private ModelArtifacts() {
    }

    /**
     * {@code label-encoder.json}: class labels in model output order.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LabelEncoder {
        private List<String> classes;
    }
}
