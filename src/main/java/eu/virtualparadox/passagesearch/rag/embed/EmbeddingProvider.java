package eu.virtualparadox.passagesearch.rag.embed;

import eu.virtualparadox.passagesearch.util.VectorMath;

import java.util.List;

/**
 * Computes dense vector embeddings for texts and compares them.
 */
public interface EmbeddingProvider {

    /**
     * Embeds a batch of texts.
     *
     * @param texts texts to embed
     * @return one vector per input text, in input order, all of the same dimension
     */
    List<float[]> encode(List<String> texts);

    /**
     * Embeds a single text, typically a query.
     */
    default float[] encode(final String text) {
        return encode(List.of(text)).get(0);
    }

    /**
     * Scores each row of {@code matrix} against {@code vector}.
     * The default is cosine similarity.
     *
     * @param vector query vector
     * @param matrix candidate vectors
     * @return one similarity per row
     */
    default double[] similarity(final float[] vector, final float[][] matrix) {
        final double[] scores = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            scores[i] = VectorMath.cosine(vector, matrix[i]);
        }
        return scores;
    }
}
