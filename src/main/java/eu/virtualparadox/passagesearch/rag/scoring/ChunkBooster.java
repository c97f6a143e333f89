package eu.virtualparadox.passagesearch.rag.scoring;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic multiplicative boosts based on chunk structure.
 * <ul>
 *   <li>type: OVERVIEW 1.3, SECTION 1.2, PARAGRAPH 1.0, SUB_SECTION 0.9, FIXED 0.8</li>
 *   <li>hierarchy level: 0 → 1.2, 1 → 1.1</li>
 *   <li>section title: query contained in title → 1.4, otherwise {@code k} shared words → {@code 1 + 0.1k}</li>
 *   <li>length: fewer than 20 words → 0.8, more than 200 words → 0.95</li>
 *   <li>the global boost factor, then any {@link ScoringExtension}s</li>
 * </ul>
 */
@Slf4j
public class ChunkBooster {

    private final double globalBoost;
    private final List<ScoringExtension> extensions;

    public ChunkBooster(final double globalBoost) {
        this(globalBoost, List.of());
    }

    public ChunkBooster(final double globalBoost, final List<ScoringExtension> extensions) {
        if (!(globalBoost > 0.0) || !Double.isFinite(globalBoost)) {
            throw new IllegalArgumentException("boost factor must be a finite value > 0");
        }
        this.globalBoost = globalBoost;
        this.extensions = extensions == null ? List.of() : List.copyOf(extensions);
    }

    /**
     * @return product of all multipliers for {@code chunk} under {@code query}
     */
    public double boostFactor(final String query, final Chunk chunk) {
        double factor = typeBoost(chunk) * levelBoost(chunk) * titleBoost(query, chunk) * lengthBoost(chunk);
        factor *= globalBoost;
        for (final ScoringExtension extension : extensions) {
            final double extra = extension.factor(query, chunk);
            if (Double.isFinite(extra) && extra >= 0.0) {
                factor *= extra;
            } else {
                log.warn("Ignoring invalid factor {} from {}", extra, extension.getClass().getSimpleName());
            }
        }
        return factor;
    }

    private static double typeBoost(final Chunk chunk) {
        return switch (chunk.chunkType()) {
            case OVERVIEW -> 1.3;
            case SECTION -> 1.2;
            case PARAGRAPH -> 1.0;
            case SUB_SECTION -> 0.9;
            case FIXED -> 0.8;
        };
    }

    private static double levelBoost(final Chunk chunk) {
        return switch (chunk.hierarchyLevel()) {
            case 0 -> 1.2;
            case 1 -> 1.1;
            default -> 1.0;
        };
    }

    private static double titleBoost(final String query, final Chunk chunk) {
        final String title = chunk.sectionTitle();
        if (title == null || query == null) {
            return 1.0;
        }
        final String q = query.strip().toLowerCase(Locale.ROOT);
        final String t = title.toLowerCase(Locale.ROOT);
        if (q.isEmpty()) {
            return 1.0;
        }
        if (t.contains(q)) {
            return 1.4;
        }
        final Set<String> queryWords = words(q);
        queryWords.retainAll(words(t));
        return queryWords.isEmpty() ? 1.0 : 1.0 + 0.1 * queryWords.size();
    }

    private static double lengthBoost(final Chunk chunk) {
        final int words = chunk.wordCount();
        if (words < 20) {
            return 0.8;
        }
        if (words > 200) {
            return 0.95;
        }
        return 1.0;
    }

    private static Set<String> words(final String text) {
        final Set<String> words = new HashSet<>(Arrays.asList(text.split("\\s+")));
        words.remove("");
        return words;
    }
}
