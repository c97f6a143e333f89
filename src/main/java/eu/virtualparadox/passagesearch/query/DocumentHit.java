package eu.virtualparadox.passagesearch.query;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.rag.pipeline.ScoredCandidate;

import java.util.List;

/**
 * A document-level hit.
 *
 * @param docId         document id
 * @param filename      document file name
 * @param score         aggregated score
 * @param totalChunks   number of chunks the document has in the index
 * @param bestChunks    best scoring chunks, best first
 * @param contextChunks best chunks plus neighbours in document order (context mode only)
 * @param preview       short preview built from the two best chunks
 * @param content       context chunks joined in document order (context mode only, otherwise empty)
 */
public record DocumentHit(int docId,
                          String filename,
                          double score,
                          int totalChunks,
                          List<ScoredCandidate> bestChunks,
                          List<Chunk> contextChunks,
                          String preview,
                          String content) {

    public DocumentHit {
        bestChunks = List.copyOf(bestChunks);
        contextChunks = List.copyOf(contextChunks);
    }
}
