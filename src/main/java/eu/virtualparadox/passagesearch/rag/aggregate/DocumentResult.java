package eu.virtualparadox.passagesearch.rag.aggregate;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.rag.pipeline.ScoredCandidate;

import java.util.List;

/**
 * A document ranked by its aggregated chunk scores.
 *
 * @param docId         document id
 * @param score         aggregated score
 * @param bestChunks    up to three best chunks, best first
 * @param contextChunks context chunks in document order; empty unless context was expanded
 */
public record DocumentResult(int docId,
                             double score,
                             List<ScoredCandidate> bestChunks,
                             List<Chunk> contextChunks) {

    public DocumentResult {
        bestChunks = List.copyOf(bestChunks);
        contextChunks = List.copyOf(contextChunks);
    }

    public List<String> bestChunkIds() {
        return bestChunks.stream().map(ScoredCandidate::chunkId).toList();
    }

    public DocumentResult withContext(final List<Chunk> context) {
        return new DocumentResult(docId, score, bestChunks, context);
    }
}
