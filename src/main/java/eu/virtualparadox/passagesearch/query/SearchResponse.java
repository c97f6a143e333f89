package eu.virtualparadox.passagesearch.query;

import eu.virtualparadox.passagesearch.rag.pipeline.ScoredCandidate;
import eu.virtualparadox.passagesearch.rag.pipeline.StageTrace;

import java.util.Collections;
import java.util.List;

/**
 * Result of a search.
 *
 * @param query            query text
 * @param mode             result shape
 * @param chunks           ranked chunks (chunk mode), otherwise the chunks fed to aggregation
 * @param documents        ranked documents (document and context modes), otherwise empty
 * @param trace            per-stage diagnostics; empty when the query had no usable tokens
 * @param deadlineExceeded whether stages were skipped because of the deadline
 * @param snapshotVersion  version of the snapshot that answered, {@code -1} if none was consulted
 */
public record SearchResponse(String query,
                             SearchMode mode,
                             List<ScoredCandidate> chunks,
                             List<DocumentHit> documents,
                             List<StageTrace> trace,
                             boolean deadlineExceeded,
                             long snapshotVersion) {

    public SearchResponse {
        chunks = List.copyOf(chunks);
        documents = List.copyOf(documents);
        trace = List.copyOf(trace);
    }

    public static SearchResponse empty(final String query, final SearchMode mode, final long snapshotVersion) {
        return new SearchResponse(query, mode, Collections.emptyList(), Collections.emptyList(),
                Collections.emptyList(), false, snapshotVersion);
    }

    public boolean isEmpty() {
        return mode == SearchMode.CHUNK ? chunks.isEmpty() : documents.isEmpty();
    }
}
