package eu.virtualparadox.passagesearch.rag.scoring;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.rag.tokenize.Tokenizer;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Rewards chunks whose {@code entities} metadata overlaps the query.
 * <p>
 * The metadata is written by the chunker's {@code EntityExtractor}. The value may be a collection of
 * entity strings or a map of entity kind to collection.
 * The factor is {@code 1 + weight * |query ∩ entities| / |query ∪ entities|} over tokenized forms;
 * chunks without entity metadata get {@code 1.0}.
 */
public class EntityOverlapExtension implements ScoringExtension {

    public static final String ENTITIES = Chunk.ENTITIES;

    private final Tokenizer tokenizer;
    private final double weight;

    public EntityOverlapExtension(final Tokenizer tokenizer, final double weight) {
        if (weight < 0 || !Double.isFinite(weight)) {
            throw new IllegalArgumentException("weight must be a finite value >= 0");
        }
        this.tokenizer = tokenizer;
        this.weight = weight;
    }

    @Override
    public double factor(final String query, final Chunk chunk) {
        final Set<String> entities = new HashSet<>();
        collect(chunk.metadata().get(ENTITIES), entities);
        if (entities.isEmpty()) {
            return 1.0;
        }
        final Set<String> queryTokens = new HashSet<>(tokenizer.tokenize(query));
        if (queryTokens.isEmpty()) {
            return 1.0;
        }

        final Set<String> union = new HashSet<>(queryTokens);
        union.addAll(entities);
        final Set<String> overlap = new HashSet<>(queryTokens);
        overlap.retainAll(entities);

        return 1.0 + weight * overlap.size() / union.size();
    }

    private void collect(final Object value, final Set<String> sink) {
        if (value instanceof Map) {
            for (final Object nested : ((Map<?, ?>) value).values()) {
                collect(nested, sink);
            }
        } else if (value instanceof Collection) {
            for (final Object item : (Collection<?>) value) {
                collect(item, sink);
            }
        } else if (value != null) {
            sink.addAll(tokenizer.tokenize(value.toString()));
        }
    }
}
