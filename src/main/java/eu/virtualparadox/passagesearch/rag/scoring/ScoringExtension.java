package eu.virtualparadox.passagesearch.rag.scoring;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;

/**
 * Pluggable multiplicative score adjustment applied after the built-in boosts.
 */
@FunctionalInterface
public interface ScoringExtension {

    /**
     * @param query user query
     * @param chunk candidate chunk
     * @return multiplier, {@code 1.0} for no change
     */
    double factor(String query, Chunk chunk);
}
