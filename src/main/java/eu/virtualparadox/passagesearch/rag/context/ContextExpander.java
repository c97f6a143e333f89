package eu.virtualparadox.passagesearch.rag.context;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshot;
import eu.virtualparadox.passagesearch.rag.pipeline.ScoredCandidate;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Widens the best chunks of a document with their neighbours.
 * <p>
 * For each best chunk at index {@code i} of the document's chunk sequence, indexes
 * {@code [i - window, i + window]} (clamped) are included; the union is returned in document order.
 */
public class ContextExpander {

    @Getter
    private final int window;

    public ContextExpander(final int window) {
        if (window < 0) {
            throw new IllegalArgumentException("context window must be >= 0");
        }
        this.window = window;
    }

    public List<Chunk> expand(final IndexSnapshot snapshot, final int docId, final List<ScoredCandidate> bestChunks) {
        final List<Integer> sequence = snapshot.documentPositions(docId);
        final TreeSet<Integer> indexes = new TreeSet<>();

        for (final ScoredCandidate best : bestChunks) {
            final int index = sequence.indexOf(best.position());
            if (index < 0) {
                continue;
            }
            final int from = Math.max(0, index - window);
            final int to = Math.min(sequence.size() - 1, index + window);
            for (int i = from; i <= to; i++) {
                indexes.add(i);
            }
        }

        final List<Chunk> context = new ArrayList<>(indexes.size());
        for (final Integer index : indexes) {
            context.add(snapshot.chunk(sequence.get(index)));
        }
        return context;
    }
}
