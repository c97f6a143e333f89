package eu.virtualparadox.passagesearch.rag.rerank;

/**
 * Scores the relevance of a single (query, passage) pair.
 * <p>
 * A reranker refines the ordering of a small candidate pool, typically with a cross-encoder.
 * Scores are expected in {@code [0, 1]}; implementations may be called concurrently.
 */
public interface RerankProvider {

    /**
     * Neutral score used when a pair cannot be scored.
     */
    double NEUTRAL_SCORE = 0.5;

    /**
     * @param query     user query
     * @param chunkText passage text
     * @return relevance in {@code [0, 1]}
     */
    double score(String query, String chunkText);
}
