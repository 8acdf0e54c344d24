package com.twlb.loadbalancer.trust;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxJavaType;
import ai.onnxruntime.OnnxMap;
import ai.onnxruntime.OnnxSequence;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.twlb.loadbalancer.metrics.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ONNX Runtime implementation of {@link ITrustClassifier}.
 * <p>
 * Runs a scaler + classifier pipeline exported with skl2onnx. The probability output is read
 * either as a {@code [N, classes]} float tensor or as the ZipMap sequence of class-to-probability
 * maps skl2onnx emits by default. Class order comes from the label encoder.
 * </p>
 */
public final class OnnxTrustClassifier implements ITrustClassifier {
    private static final Logger log = LoggerFactory.getLogger(OnnxTrustClassifier.class);

    public static final String PROBABILITY_OUTPUT = "output_probability";

    private final OrtEnvironment env;
    private final OrtSession session;
    private final OrtSession.SessionOptions sessionOptions;
    private final String inputName;
    private final String probabilityOutput;
    private final List<String> labels;
    private final Path modelFile;

    private OnnxTrustClassifier(OrtEnvironment env,
                                OrtSession session,
                                OrtSession.SessionOptions sessionOptions,
                                String inputName,
                                String probabilityOutput,
                                List<String> labels,
                                Path modelFile) {
        this.env = env;
        this.session = session;
        this.sessionOptions = sessionOptions;
        this.inputName = inputName;
        this.probabilityOutput = probabilityOutput;
        this.labels = List.copyOf(labels);
        this.modelFile = modelFile;
    }

    /**
     * Opens an inference session and checks it with one warm-up prediction.
     *
     * @param modelFile ONNX model
     * @param labels    class labels in model output order
     * @throws OrtException             if the model cannot be opened or has an unexpected schema
     * @throws IllegalArgumentException if the model's class count differs from the labels
     */
    public static OnnxTrustClassifier load(Path modelFile, List<String> labels) throws OrtException {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("Label encoder has no classes");
        }
        var env = OrtEnvironment.getEnvironment();
        var sessionOptions = new OrtSession.SessionOptions();
        OrtSession session = null;
        try {
            sessionOptions.setIntraOpNumThreads(1);
            session = env.createSession(modelFile.toString(), sessionOptions);
            logModelMetadata(session);
            String inputName = validateInput(session);
            String output = selectProbabilityOutput(session);
            var classifier = new OnnxTrustClassifier(
                env, session, sessionOptions, inputName, output, labels, modelFile);
            classifier.warmUp();
            return classifier;
        } catch (OrtException | RuntimeException e) {
            closeAfterFailure(session, sessionOptions, e);
            throw e;
        }
    }

    @Override
    public ClassPrediction predict(double[] features) {
        if (features.length != Observation.FEATURE_COUNT) {
            throw new IllegalArgumentException(
                "Expected " + Observation.FEATURE_COUNT + " features, got " + features.length);
        }
        float[][] input = new float[1][features.length];
        for (int i = 0; i < features.length; i++) {
            input[0][i] = (float) features[i];
        }

        try (OnnxTensor tensor = OnnxTensor.createTensor(env, input);
             OrtSession.Result result = session.run(Map.of(inputName, tensor), Set.of(probabilityOutput))) {
            OnnxValue value = result.get(probabilityOutput)
                .orElseThrow(() -> new OrtException("Model produced no " + probabilityOutput));
            return new ClassPrediction(labels, probabilities(value));
        } catch (OrtException e) {
            throw new IllegalStateException("Inference failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String describe() {
        return "onnx(model=" + modelFile.getFileName() + ", input=" + inputName
            + ", output=" + probabilityOutput + ", classes=" + labels + ")";
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            log.warn("Error closing ONNX session: {}", e.getMessage());
        }
        sessionOptions.close();
    }

    private void warmUp() {
        ClassPrediction prediction = predict(new double[Observation.FEATURE_COUNT]);
        log.info("Warm-up inference complete: {}", prediction);
    }

    private double[] probabilities(OnnxValue value) throws OrtException {
        if (value instanceof OnnxTensor tensor) {
            Object raw = tensor.getValue();
            if (raw instanceof float[][] rows && rows.length > 0) {
                return toDoubles(rows[0]);
            }
            if (raw instanceof float[] row) {
                return toDoubles(row);
            }
            throw new OrtException("Unexpected probability tensor type: " + raw.getClass().getName());
        }
        if (value instanceof OnnxSequence sequence) {
            List<?> rows = sequence.getValue();
            if (rows.isEmpty()) {
                throw new OrtException("Empty probability sequence");
            }
            Object first = rows.get(0);
            if (first instanceof OnnxMap map) {
                return fromClassMap(map.getValue());
            }
            if (first instanceof Map<?, ?> map) {
                return fromClassMap(map);
            }
            throw new OrtException("Unexpected probability sequence element: " + first.getClass().getName());
        }
        throw new OrtException("Unexpected probability output: " + value.getInfo());
    }

    // ZipMap keys are class indices for integer-encoded targets, labels otherwise
    private double[] fromClassMap(Map<?, ?> byClass) throws OrtException {
        if (byClass.size() != labels.size()) {
            throw new IllegalArgumentException(
                "Got " + byClass.size() + " probabilities for " + labels.size() + " labels");
        }
        double[] probabilities = new double[labels.size()];
        for (Map.Entry<?, ?> entry : byClass.entrySet()) {
            int index = entry.getKey() instanceof Number number
                ? number.intValue()
                : labels.indexOf(String.valueOf(entry.getKey()));
            if (index < 0 || index >= probabilities.length) {
                throw new OrtException("Unknown class key in probability map: " + entry.getKey());
            }
            probabilities[index] = ((Number) entry.getValue()).doubleValue();
        }
        return probabilities;
    }

    private static double[] toDoubles(float[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i];
        }
        return out;
    }

    private static void logModelMetadata(OrtSession session) throws OrtException {
        log.info("Trust model metadata:");
        for (Map.Entry<String, NodeInfo> entry : session.getInputInfo().entrySet()) {
            log.info("  Input '{}': {}", entry.getKey(), entry.getValue().getInfo());
        }
        for (Map.Entry<String, NodeInfo> entry : session.getOutputInfo().entrySet()) {
            log.info("  Output '{}': {}", entry.getKey(), entry.getValue().getInfo());
        }
    }

    private static String validateInput(OrtSession session) throws OrtException {
        Map<String, NodeInfo> inputs = session.getInputInfo();
        if (inputs.size() != 1) {
            throw new OrtException("Expected a single input tensor, found: " + inputs.keySet());
        }
        Map.Entry<String, NodeInfo> input = inputs.entrySet().iterator().next();
        if (!(input.getValue().getInfo() instanceof TensorInfo tensorInfo)) {
            throw new OrtException("Input '" + input.getKey() + "' is not a tensor");
        }
        if (tensorInfo.type != OnnxJavaType.FLOAT) {
            throw new OrtException("Input '" + input.getKey() + "' must be float, found " + tensorInfo.type);
        }
        long[] shape = tensorInfo.getShape();
        long width = shape.length == 0 ? -1 : shape[shape.length - 1];
        // -1 marks a symbolic dimension
        if (width != -1 && width != Observation.FEATURE_COUNT) {
            throw new OrtException("Input '" + input.getKey() + "' takes " + width
                + " features, expected " + Observation.FEATURE_COUNT);
        }
        return input.getKey();
    }

    private static String selectProbabilityOutput(OrtSession session) throws OrtException {
        Set<String> outputs = session.getOutputNames();
        if (outputs.contains(PROBABILITY_OUTPUT)) {
            return PROBABILITY_OUTPUT;
        }
        if (outputs.size() == 1) {
            return outputs.iterator().next();
        }
        throw new OrtException("Expected output named '" + PROBABILITY_OUTPUT + "', found: " + outputs);
    }

    private static void closeAfterFailure(OrtSession session,
                                          OrtSession.SessionOptions sessionOptions,
                                          Exception cause) {
        if (session != null) {
            try {
                session.close();
            } catch (OrtException e) {
                cause.addSuppressed(e);
            }
        }
        sessionOptions.close();
    }
}
