package org.learningjava.facevec.infrastructure.adapter.out.onnx;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxModelMetadata;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import org.learningjava.facevec.application.port.InferenceRunnerPort;
import org.learningjava.facevec.domain.error.InferenceFailureException;
import org.learningjava.facevec.domain.error.ModelUnavailableException;
import org.learningjava.facevec.domain.model.FloatTensor;
import org.learningjava.facevec.domain.model.ModelInfo;
import org.learningjava.facevec.domain.options.EmbeddingOptions;
import org.learningjava.facevec.domain.service.embedding.ImagePreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;

/**
 * Hosts an ONNX Runtime session for the ArcFace model.
 *
 * <p>The model file is checked (existence, then optional SHA-256) before the
 * native runtime is touched. A requested CUDA provider that cannot be attached
 * is a {@link ModelUnavailableException}; there is no silent downgrade to CPU.</p>
 */
public class OnnxInferenceRunner implements InferenceRunnerPort, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OnnxInferenceRunner.class);

    static final int VECTOR_SIZE = 512;
    private static final String DEFAULT_MODEL_NAME = "arcface_r100_v1";

    private final OrtEnvironment env;
    private final OrtSession session;
    private final ModelInfo modelInfo;
    private final int computeUnits;
    private volatile boolean closed;

    public OnnxInferenceRunner(EmbeddingOptions options) {
        Path model = options.modelPath();
        if (!Files.isRegularFile(model)) {
            throw new ModelUnavailableException("ONNX model not found: " + model.toAbsolutePath());
        }
        if (options.verifyChecksum() && options.expectedContentHash() != null) {
            ModelChecksum.verify(model, options.expectedContentHash());
            log.info("Model checksum verified for {}", model);
        }

        String provider = options.executionProvider();
        try {
            this.env = OrtEnvironment.getEnvironment();
            try (OrtSession.SessionOptions so = new OrtSession.SessionOptions()) {
                so.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
                so.setExecutionMode(OrtSession.SessionOptions.ExecutionMode.SEQUENTIAL);
                if ("cuda".equals(provider)) {
                    try {
                        so.addCUDA(options.cudaDeviceId());
                    } catch (OrtException e) {
                        throw new ModelUnavailableException("CUDA execution provider unavailable on device "
                                + options.cudaDeviceId() + ": " + e.getMessage(), e);
                    }
                }
                this.session = env.createSession(model.toString(), so);
            }
        } catch (OrtException e) {
            throw new ModelUnavailableException("Failed to load ONNX model " + model + ": " + e.getMessage(), e);
        } catch (LinkageError e) {
            throw new ModelUnavailableException("ONNX Runtime native library could not be loaded", e);
        }

        this.computeUnits = "cuda".equals(provider) ? 1 : Runtime.getRuntime().availableProcessors();
        this.modelInfo = buildModelInfo(options, provider);
        if (modelInfo.vectorSize() != VECTOR_SIZE) {
            throw new ModelUnavailableException("Model produces " + modelInfo.vectorSize()
                    + "-d vectors, expected " + VECTOR_SIZE);
        }
        log.info("ONNX model {} ({}) loaded from {} with provider {}",
                modelInfo.modelName(), modelInfo.modelVersion(), model, provider);
    }

    @Override
    public ModelInfo modelInfo() {
        return modelInfo;
    }

    @Override
    public int activeComputeUnits() {
        return computeUnits;
    }

    @Override
    public float[] run(String inputName, FloatTensor batchTensor) {
        if (closed) {
            throw new ModelUnavailableException("ONNX session is closed");
        }
        int batchSize = batchTensor.dimension(0);
        long[] shape = Arrays.stream(batchTensor.shape()).asLongStream().toArray();
        try (OnnxTensor input = OnnxTensor.createTensor(env, FloatBuffer.wrap(batchTensor.data()), shape);
             OrtSession.Result result = session.run(Map.of(inputName, input))) {
            return flatten(result.get(0).getValue(), batchSize);
        } catch (OrtException e) {
            throw new InferenceFailureException("ONNX inference failed: " + e.getMessage(), batchSize, e);
        }
    }

    @Override
    public void close() throws OrtException {
        if (closed) {
            return;
        }
        closed = true;
        session.close();
    }

    private static float[] flatten(Object value, int batchSize) {
        if (value instanceof float[] flat) {
            return flat;
        }
        if (value instanceof float[][] rows) {
            int width = rows.length == 0 ? 0 : rows[0].length;
            float[] out = new float[rows.length * width];
            for (int i = 0; i < rows.length; i++) {
                System.arraycopy(rows[i], 0, out, i * width, width);
            }
            return out;
        }
        throw new InferenceFailureException("Unexpected ONNX output type "
                + (value == null ? "null" : value.getClass().getSimpleName()), batchSize);
    }

    private ModelInfo buildModelInfo(EmbeddingOptions options, String provider) {
        String name = DEFAULT_MODEL_NAME;
        String version = "unknown";
        int vectorSize = VECTOR_SIZE;
        try {
            OnnxModelMetadata metadata = session.getMetadata();
            if (metadata.getGraphName() != null && !metadata.getGraphName().isBlank()) {
                name = metadata.getGraphName();
            }
            if (metadata.getVersion() > 0) {
                version = Long.toString(metadata.getVersion());
            } else if (metadata.getProducerName() != null && !metadata.getProducerName().isBlank()) {
                version = metadata.getProducerName();
            }

            Iterator<NodeInfo> outputs = session.getOutputInfo().values().iterator();
            if (outputs.hasNext() && outputs.next().getInfo() instanceof TensorInfo info) {
                long[] outShape = info.getShape();
                long last = outShape.length == 0 ? -1 : outShape[outShape.length - 1];
                if (last > 0) {
                    vectorSize = (int) last;
                }
            }
        } catch (OrtException e) {
            log.warn("Could not read ONNX model metadata: {}", e.getMessage());
        }
        return new ModelInfo(
                name,
                version,
                provider,
                options.expectedContentHash() != null ? options.expectedContentHash() : "n/a",
                Instant.now(),
                vectorSize,
                ImagePreprocessor.TARGET_SIZE
        );
    }
}
