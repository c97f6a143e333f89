package eu.virtualparadox.passagesearch.rag.embed;

import eu.virtualparadox.passagesearch.rag.tokenize.Tokenizer;
import eu.virtualparadox.passagesearch.util.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic embedding provider based on feature hashing.
 * <p>
 * Every token, and every pair of adjacent tokens, is hashed into one of {@code dimension} buckets
 * with a hash-derived sign; the vector is L2-normalized. Texts sharing vocabulary end up with a
 * positive cosine similarity, which makes the provider usable for local runs and tests without
 * any model files.
 */
@Slf4j
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final float BIGRAM_WEIGHT = 0.5f;

    private final Tokenizer tokenizer;
    private final int dimension;

    public HashingEmbeddingProvider(final Tokenizer tokenizer, final int dimension) {
        if (tokenizer == null) {
            throw new IllegalArgumentException("tokenizer cannot be null");
        }
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.tokenizer = tokenizer;
        this.dimension = dimension;
        log.info("Using hashing embeddings with {} dimensions", dimension);
    }

    @Override
    public List<float[]> encode(final List<String> texts) {
        final List<float[]> vectors = new ArrayList<>(texts.size());
        for (final String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    private float[] embed(final String text) {
        final float[] vector = new float[dimension];
        final List<String> tokens = tokenizer.tokenize(text);
        for (int i = 0; i < tokens.size(); i++) {
            add(vector, tokens.get(i), 1.0f);
            if (i > 0) {
                add(vector, tokens.get(i - 1) + ' ' + tokens.get(i), BIGRAM_WEIGHT);
            }
        }
        VectorMath.normalize(vector);
        return vector;
    }

    private void add(final float[] vector, final String feature, final float weight) {
        final int hash = mix(feature.hashCode());
        final int bucket = Math.floorMod(hash, dimension);
        final float sign = (hash & 0x40000000) == 0 ? 1.0f : -1.0f;
        vector[bucket] += sign * weight;
    }

    // murmur3 finalizer
    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
