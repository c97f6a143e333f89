package eu.virtualparadox.passagesearch.ingest.entity;

import java.util.List;
import java.util.Map;

/**
 * Extracts named entities from chunk text so they can be stored in the chunk metadata.
 */
public interface EntityExtractor {

    /**
     * @param text chunk text
     * @return entity strings grouped by kind; kinds without entities are omitted
     */
    Map<String, List<String>> extract(String text);
}
