package eu.virtualparadox.passagesearch.ingest.chunker;

import java.util.Locale;

/**
 * Chunking strategies supported by {@link Chunker}.
 */
public enum ChunkingStrategy {
    /** Sliding word window with overlap. */
    FIXED("fixed"),
    /** One chunk per markdown section. */
    SECTION("section"),
    /** Overview, then sections, then paragraphs. */
    HIERARCHICAL("hierarchical"),
    /** Whole sections, with oversized sections split by the sliding window. */
    HYBRID("hybrid");

    private final String label;

    ChunkingStrategy(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses a strategy name. {@code semantic} is accepted as an alias of {@link #SECTION}.
     *
     * @param name strategy name, case-insensitive
     * @return the matching strategy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ChunkingStrategy fromName(final String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("chunking strategy cannot be blank");
        }
        final String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("semantic".equals(normalized)) {
            return SECTION;
        }
        for (final ChunkingStrategy strategy : values()) {
            if (strategy.label.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown chunking strategy: " + name);
    }
}
