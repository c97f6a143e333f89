package eu.virtualparadox.passagesearch.ingest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable representation of a text chunk produced by the chunker.
 * <p>Contains the parent document id, a stable chunk id, the chunk text and the
 * structural metadata used by boosting and context expansion.</p>
 *
 * @param chunkId        unique, stable identifier within an index snapshot
 * @param parentDocId    id of the document the chunk was cut from
 * @param ordinalIndex   position of the chunk inside its document, starting at 0
 * @param content        chunk text
 * @param chunkType      structural role
 * @param hierarchyLevel depth in the document structure ({@code >= 0})
 * @param startOffset    inclusive character offset into the document content
 * @param endOffset      exclusive character offset into the document content
 * @param metadata       additional attributes such as {@link #SECTION_TITLE}
 */
public record Chunk(String chunkId,
                    int parentDocId,
                    int ordinalIndex,
                    String content,
                    ChunkType chunkType,
                    int hierarchyLevel,
                    int startOffset,
                    int endOffset,
                    Map<String, Object> metadata) {

    public static final String SECTION_TITLE = "section_title";
    public static final String FILE_NAME = "file_name";
    public static final String CHUNK_STRATEGY = "chunk_strategy";
    public static final String ENTITIES = "entities";

    public Chunk {
        if (chunkId == null || chunkId.isBlank()) {
            throw new IllegalArgumentException("chunkId cannot be null or blank");
        }
        if (chunkType == null) {
            throw new IllegalArgumentException("chunkType cannot be null");
        }
        if (hierarchyLevel < 0) {
            throw new IllegalArgumentException("hierarchyLevel must be non-negative");
        }
        content = content == null ? "" : content;
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * @return the section title recorded in the metadata, or {@code null} if the chunk has none
     */
    public String sectionTitle() {
        final Object title = metadata.get(SECTION_TITLE);
        return title == null ? null : title.toString();
    }

    /**
     * @return number of whitespace-separated words in the content
     */
    public int wordCount() {
        final String trimmed = content.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
