package eu.virtualparadox.companion.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.companion.error.EmbeddingUnavailableException;
import eu.virtualparadox.companion.util.OrtInitializer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Local sentence-embedding model run through ONNX Runtime.
 * <p>Expects {@code model.onnx} and {@code tokenizer.json} in the model folder. Token vectors
 * are mean-pooled over the attention mask and L2-normalized.</p>
 */
@Slf4j
public final class OnnxEmbeddingService implements EmbeddingService, AutoCloseable {

    private static final int MAX_LEN = 512;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final int batchSize;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final Path modelRoot, final int batchSize) {
        this.modelPath = modelRoot.resolve("model.onnx");
        this.tokenizerPath = modelRoot.resolve("tokenizer.json");
        this.batchSize = Math.max(1, batchSize);
    }

    public void init() throws IOException, OrtException {
        if (!Files.exists(modelPath) || !Files.exists(tokenizerPath)) {
            throw new EmbeddingUnavailableException("ONNX embedding model not found under " + modelPath.getParent());
        }
        this.env = OrtEnvironment.getEnvironment();
        final OrtSession.SessionOptions options = OrtInitializer.initializeOrt();

        this.session = env.createSession(modelPath.toString(), options);
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX embedding model: {}", modelPath);
        log.info("Model expects inputs: {}", session.getInputNames());
    }

    @Override
    public void close() throws OrtException {
        if (session != null) {
            session.close();
        }
        if (tokenizer != null) {
            tokenizer.close();
        }
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        final List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            final int to = Math.min(from + batchSize, texts.size());
            result.addAll(embedBatch(texts.subList(from, to)));
        }
        return result;
    }

    @Override
    public String modelName() {
        return "onnx:" + modelPath.getParent().getFileName();
    }

    private List<float[]> embedBatch(final List<String> texts) {
        try {
            final List<Encoding> encodings = new ArrayList<>();
            int maxLen = 0;

            for (final String text : texts) {
                final Encoding e = tokenizer.encode(text);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            maxLen = Math.min(Math.max(maxLen, 1), MAX_LEN);

            final int rows = encodings.size();
            final long[][] inputIdArr = new long[rows][maxLen];
            final long[][] attnMaskArr = new long[rows][maxLen];
            final long[][] tokenTypeArr = new long[rows][maxLen];

            for (int i = 0; i < rows; i++) {
                final long[] ids = encodings.get(i).getIds();
                final long[] mask = encodings.get(i).getAttentionMask();
                final int len = Math.min(ids.length, maxLen);

                System.arraycopy(ids, 0, inputIdArr[i], 0, len);
                System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
            }

            try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (final OrtSession.Result result = session.run(inputs)) {
                    final float[][][] embeddings = (float[][][]) result.get(0).getValue();

                    final List<float[]> out = new ArrayList<>(rows);
                    for (int i = 0; i < rows; i++) {
                        final float[] vec = meanPool(embeddings[i], attnMaskArr[i]);
                        normalize(vec);
                        out.add(vec);
                    }
                    return out;
                }
            }
        } catch (final OrtException e) {
            throw new EmbeddingUnavailableException("ONNX embedding failed", e);
        }
    }

    private float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    private void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
