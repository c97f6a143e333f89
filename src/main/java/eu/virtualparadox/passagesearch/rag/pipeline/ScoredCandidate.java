package eu.virtualparadox.passagesearch.rag.pipeline;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.rag.scoring.ScoreBreakdown;

/**
 * A chunk that survived the pipeline, with its final score and how it was computed.
 *
 * @param chunk     the chunk
 * @param position  snapshot position of the chunk
 * @param score     final (fused and boosted) score
 * @param breakdown score explanation
 */
public record ScoredCandidate(Chunk chunk, int position, double score, ScoreBreakdown breakdown) {

    public String chunkId() {
        return chunk.chunkId();
    }

    public int docId() {
        return chunk.parentDocId();
    }
}
