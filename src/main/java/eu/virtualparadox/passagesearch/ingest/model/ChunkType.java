package eu.virtualparadox.passagesearch.ingest.model;

/**
 * Structural role of a chunk inside its parent document.
 */
public enum ChunkType {
    OVERVIEW("overview"),
    SECTION("section"),
    SUB_SECTION("sub_section"),
    PARAGRAPH("paragraph"),
    FIXED("fixed");

    private final String label;

    ChunkType(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
