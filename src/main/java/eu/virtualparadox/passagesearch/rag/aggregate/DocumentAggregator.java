package eu.virtualparadox.passagesearch.rag.aggregate;

import eu.virtualparadox.passagesearch.rag.pipeline.ScoredCandidate;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups scored chunks by parent document and ranks documents.
 * <p>
 * Documents are ordered by aggregated score descending, ties by ascending doc id. Each result keeps
 * its three best chunks, ties by chunk id.
 */
@Slf4j
public class DocumentAggregator {

    private static final int BEST_CHUNKS = 3;

    @Getter
    private final AggregationLaw defaultLaw;

    public DocumentAggregator(final AggregationLaw defaultLaw) {
        if (defaultLaw == null) {
            throw new IllegalArgumentException("defaultLaw cannot be null");
        }
        this.defaultLaw = defaultLaw;
    }

    public List<DocumentResult> aggregate(final List<ScoredCandidate> candidates, final int topKDocuments) {
        return aggregate(candidates, topKDocuments, defaultLaw);
    }

    /**
     * @param candidates    scored chunks
     * @param topKDocuments number of documents to return
     * @param law           aggregation law
     * @return ranked documents
     */
    public List<DocumentResult> aggregate(final List<ScoredCandidate> candidates,
                                          final int topKDocuments,
                                          final AggregationLaw law) {
        if (topKDocuments <= 0) {
            throw new IllegalArgumentException("topKDocuments must be > 0");
        }
        final Map<Integer, List<ScoredCandidate>> byDocument = new LinkedHashMap<>();
        for (final ScoredCandidate candidate : candidates) {
            byDocument.computeIfAbsent(candidate.docId(), k -> new ArrayList<>()).add(candidate);
        }

        final Comparator<ScoredCandidate> bestFirst = Comparator.comparingDouble(ScoredCandidate::score).reversed()
                .thenComparing(ScoredCandidate::chunkId);

        final List<DocumentResult> results = new ArrayList<>(byDocument.size());
        for (final Map.Entry<Integer, List<ScoredCandidate>> entry : byDocument.entrySet()) {
            final List<ScoredCandidate> chunks = entry.getValue();
            final List<Double> scores = new ArrayList<>(chunks.size());
            for (final ScoredCandidate chunk : chunks) {
                scores.add(chunk.score());
            }
            chunks.sort(bestFirst);
            final List<ScoredCandidate> best = chunks.subList(0, Math.min(BEST_CHUNKS, chunks.size()));
            results.add(new DocumentResult(entry.getKey(), law.aggregate(scores), best, Collections.emptyList()));
        }

        results.sort(Comparator.comparingDouble(DocumentResult::score).reversed()
                .thenComparingInt(DocumentResult::docId));

        log.debug("Aggregated {} chunks into {} documents ({})", candidates.size(), results.size(), law.label());
        return results.size() > topKDocuments ? new ArrayList<>(results.subList(0, topKDocuments)) : results;
    }
}
