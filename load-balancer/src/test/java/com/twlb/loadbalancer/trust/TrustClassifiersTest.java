package com.twlb.loadbalancer.trust;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TrustClassifiersTest {

    // MatMul + Add + Softmax over [N, 4]; logits are benign 0, error-500 = errors - 2
    private static final String FIXTURE_MODEL = "/models/error-rate.onnx";

    @TempDir
    Path modelDir;

    private ITrustClassifier classifier = NullTrustClassifier.INSTANCE;

    @AfterEach
    void tearDown() {
        classifier.close();
    }

    private void writeArtifacts(String labelsJson) throws IOException {
        try (InputStream model = TrustClassifiersTest.class.getResourceAsStream(FIXTURE_MODEL)) {
            assertNotNull(model, "fixture model on the test classpath");
            Files.copy(model, modelDir.resolve(ModelArtifacts.MODEL_FILE));
        }
        Files.writeString(modelDir.resolve(ModelArtifacts.LABEL_ENCODER_FILE), labelsJson);
    }

    private void writeArtifacts() throws IOException {
        writeArtifacts("{\"classes\":[\"benign\",\"error-500\"]}");
    }

    @Test
    @DisplayName("Loads an ONNX classifier from valid artifacts")
    void loadsValidArtifacts() throws IOException {
        writeArtifacts();

        classifier = TrustClassifiers.load(modelDir);

        assertTrue(classifier.isAvailable());
        assertInstanceOf(OnnxTrustClassifier.class, classifier);
        assertTrue(classifier.describe().contains(OnnxTrustClassifier.PROBABILITY_OUTPUT));

        ClassPrediction quiet = classifier.predict(new double[]{100.0, 0.0, 0.5, 64.0});
        assertEquals(1.0 / (1.0 + Math.exp(-2.0)), quiet.probabilityOf("benign"), 1e-5);

        ClassPrediction noisy = classifier.predict(new double[]{100.0, 10.0, 0.5, 64.0});
        assertTrue(noisy.pFaulty(null) > 0.99);

        double sum = 0.0;
        for (double p : noisy.getProbabilities()) {
            sum += p;
        }
        assertEquals(1.0, sum, 1e-5);
    }

    @Test
    void primaryFaultClassReadsModelOutput() throws IOException {
        writeArtifacts();
        classifier = TrustClassifiers.load(modelDir);

        ClassPrediction prediction = classifier.predict(new double[]{0.0, 2.0, 0.0, 0.0});

        // equal logits
        assertEquals(0.5, prediction.pFaulty("error-500"), 1e-5);
    }

    @Test
    @DisplayName("Missing artifact yields the null classifier")
    void missingArtifact() throws IOException {
        writeArtifacts();
        Files.delete(modelDir.resolve(ModelArtifacts.LABEL_ENCODER_FILE));

        classifier = TrustClassifiers.load(modelDir);

        assertFalse(classifier.isAvailable());
        assertSame(NullTrustClassifier.INSTANCE, classifier);
    }

    @Test
    void missingModel() throws IOException {
        writeArtifacts();
        Files.delete(modelDir.resolve(ModelArtifacts.MODEL_FILE));

        assertSame(NullTrustClassifier.INSTANCE, TrustClassifiers.load(modelDir));
    }

    @Test
    void missingDirectory() {
        assertFalse(TrustClassifiers.load(modelDir.resolve("does-not-exist")).isAvailable());
    }

    @Test
    @DisplayName("Corrupt model bytes yield the null classifier")
    void corruptModel() throws IOException {
        Files.write(modelDir.resolve(ModelArtifacts.MODEL_FILE), new byte[]{0x0a, 0x7f, 0x01, 0x02});
        Files.writeString(modelDir.resolve(ModelArtifacts.LABEL_ENCODER_FILE),
            "{\"classes\":[\"benign\",\"error-500\"]}");

        assertFalse(TrustClassifiers.load(modelDir).isAvailable());
    }

    @Test
    void malformedLabelEncoder() throws IOException {
        writeArtifacts("{not json");

        assertFalse(TrustClassifiers.load(modelDir).isAvailable());
    }

    @Test
    @DisplayName("Label count differing from the model's classes yields the null classifier")
    void classCountMismatch() throws IOException {
        writeArtifacts("{\"classes\":[\"benign\",\"error-500\",\"lie-latency\"]}");

        assertFalse(TrustClassifiers.load(modelDir).isAvailable());
    }

    @Test
    void rejectsWrongFeatureDimension() throws IOException {
        writeArtifacts();
        classifier = TrustClassifiers.load(modelDir);

        assertThrows(IllegalArgumentException.class, () -> classifier.predict(new double[]{1.0, 2.0}));
    }

    @Test
    void nullClassifierRefusesToPredict() {
        assertThrows(IllegalStateException.class, () -> NullTrustClassifier.INSTANCE.predict(new double[4]));
    }
}
