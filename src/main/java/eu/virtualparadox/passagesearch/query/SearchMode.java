package eu.virtualparadox.passagesearch.query;

import java.util.Locale;

/**
 * Shape of a search result.
 */
public enum SearchMode {
    /** Ranked chunks. */
    CHUNK,
    /** Ranked documents with their best chunks. */
    DOCUMENT,
    /** Ranked documents with best chunks widened by neighbouring chunks. */
    CONTEXT;

    public static SearchMode fromName(final String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("search mode cannot be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown search mode: " + name + " (expected chunk, document or context)", e);
        }
    }
}
