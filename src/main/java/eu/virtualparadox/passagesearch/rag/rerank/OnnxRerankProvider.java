package eu.virtualparadox.passagesearch.rag.rerank;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.passagesearch.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.LongBuffer;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

/**
 * ONNX cross-encoder reranker with windowed scoring.
 * <p>
 * Encodings longer than {@link #MAX_LEN} tokens are split into overlapping windows; each window is
 * scored independently and the best logit wins, so content at the end of a long chunk is still
 * seen by the model. The logit is mapped to {@code [0, 1]} with a sigmoid.
 * <p>
 * A pair that fails to score yields {@link #NEUTRAL_SCORE} and a warning.
 */
@Slf4j
public final class OnnxRerankProvider implements RerankProvider {

    private static final int MAX_LEN = 512;

    private static final int WINDOW_SIZE = 480;

    private static final int WINDOW_OVERLAP = 50;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final int intraOpThreads;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxRerankProvider(final Path modelRoot, final int intraOpThreads) {
        this.modelPath = modelRoot.resolve("model.onnx");
        this.tokenizerPath = modelRoot.resolve("tokenizer.json");
        this.intraOpThreads = intraOpThreads;
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        final OrtSession.SessionOptions options = OrtInitializer.initializeOrt(intraOpThreads);

        this.session = env.createSession(modelPath.toString(), options);
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX reranker model from {}", modelPath);
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public double score(final String query, final String chunkText) {
        try {
            final Encoding encoding = tokenizer.encode(query, chunkText);

            final float logit = encoding.getIds().length > MAX_LEN
                    ? rerankWithWindows(encoding)
                    : runRerank(encoding);
            if (!Float.isFinite(logit)) {
                log.warn("Reranker produced a non-finite logit, using neutral score");
                return NEUTRAL_SCORE;
            }
            return sigmoid(logit);
        } catch (OrtException | RuntimeException e) {
            log.warn("Failed reranking candidate, using neutral score: {}", e.getMessage());
            return NEUTRAL_SCORE;
        }
    }

    private float rerankWithWindows(final Encoding encoding) throws OrtException {
        final long[] ids = encoding.getIds();
        final long[] mask = encoding.getAttentionMask();

        float bestScore = Float.NEGATIVE_INFINITY;

        for (int start = 0; start < ids.length; start += (WINDOW_SIZE - WINDOW_OVERLAP)) {
            final int end = Math.min(start + WINDOW_SIZE, ids.length);

            final long[] paddedIds = Arrays.copyOf(Arrays.copyOfRange(ids, start, end), MAX_LEN);
            final long[] paddedMask = Arrays.copyOf(Arrays.copyOfRange(mask, start, end), MAX_LEN);

            bestScore = Math.max(bestScore, runRerank(paddedIds, paddedMask));

            if (end == ids.length) {
                break;
            }
        }

        return bestScore;
    }

    private float runRerank(final Encoding encoding) throws OrtException {
        final int len = Math.min(MAX_LEN, encoding.getIds().length);
        final long[] ids = Arrays.copyOf(encoding.getIds(), MAX_LEN);
        final long[] mask = Arrays.copyOf(encoding.getAttentionMask(), MAX_LEN);
        Arrays.fill(ids, len, MAX_LEN, 0L);
        Arrays.fill(mask, len, MAX_LEN, 0L);
        return runRerank(ids, mask);
    }

    private float runRerank(final long[] ids, final long[] mask) throws OrtException {
        try (OnnxTensor inputIds = OnnxTensor.createTensor(env, LongBuffer.wrap(ids), new long[]{1, MAX_LEN});
             OnnxTensor attentionMask = OnnxTensor.createTensor(env, LongBuffer.wrap(mask), new long[]{1, MAX_LEN});
             OrtSession.Result result = session.run(Map.of(
                     "input_ids", inputIds,
                     "attention_mask", attentionMask
             ))) {

            final Object value = result.get(0).getValue();

            if (value instanceof float[][]) {
                final float[][] logits2d = (float[][]) value;
                // [batch, num_labels]: single regression score or [not relevant, relevant]
                return logits2d[0].length == 1 ? logits2d[0][0] : logits2d[0][1];
            }
            if (value instanceof float[]) {
                return ((float[]) value)[0];
            }
            throw new IllegalStateException("Unexpected output shape: " + value.getClass());
        }
    }

    private static double sigmoid(final float logit) {
        return 1.0 / (1.0 + Math.exp(-logit));
    }
}
