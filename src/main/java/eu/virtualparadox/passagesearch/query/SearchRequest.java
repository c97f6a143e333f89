package eu.virtualparadox.passagesearch.query;

import lombok.Builder;

import java.time.Duration;

/**
 * A search call.
 *
 * @param query       query text
 * @param mode        result shape
 * @param topK        number of chunks (chunk mode) or documents (document and context modes)
 * @param timeout     optional time budget; {@code null} uses the configured default
 * @param aggregation optional aggregation law override, parsed leniently
 */
@Builder
public record SearchRequest(String query,
                            SearchMode mode,
                            int topK,
                            Duration timeout,
                            String aggregation) {

    public static SearchRequest of(final String query, final SearchMode mode, final int topK) {
        return new SearchRequest(query, mode, topK, null, null);
    }
}
