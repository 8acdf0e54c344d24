package com.twlb.loadbalancer.trust;

import ai.onnxruntime.OrtException;
import com.twlb.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the trust classifier from a model directory.
 */
public final class TrustClassifiers {
    private static final Logger log = LoggerFactory.getLogger(TrustClassifiers.class);

    private TrustClassifiers() {
    }

    /**
     * Loads {@code model.onnx} and {@code label-encoder.json}.
     * <p>
     * Never fails startup: a missing, unreadable or inconsistent artifact yields
     * {@link NullTrustClassifier#INSTANCE}.
     * </p>
     *
     * @param modelDir directory holding the artifacts
     * @return loaded classifier or the null classifier
     */
    public static ITrustClassifier load(Path modelDir) {
        Path modelFile = modelDir.resolve(ModelArtifacts.MODEL_FILE);
        Path encoderFile = modelDir.resolve(ModelArtifacts.LABEL_ENCODER_FILE);

        for (Path file : new Path[]{modelFile, encoderFile}) {
            if (!Files.isRegularFile(file)) {
                log.warn("Model artifact {} not found, trust classifier disabled", file);
                return NullTrustClassifier.INSTANCE;
            }
        }

        try {
            ModelArtifacts.LabelEncoder encoder = JsonUtils.readFile(encoderFile, ModelArtifacts.LabelEncoder.class);
            OnnxTrustClassifier classifier = OnnxTrustClassifier.load(modelFile, encoder.getClasses());
            log.info("Loaded trust classifier from {}: {}", modelDir, classifier.describe());
            return classifier;
        } catch (OrtException | RuntimeException e) {
            log.warn("Failed to load model artifacts from {}: {}. Trust classifier disabled",
                modelDir, e.getMessage());
            return NullTrustClassifier.INSTANCE;
        }
    }
}
