package eu.virtualparadox.passagesearch.ingest.chunker;

/**
 * Validated chunking parameters. All sizes in words except where noted.
 *
 * @param chunkSize            maximum window length in words (must be {@code > 0})
 * @param overlapSize          words shared by consecutive windows ({@code 0 <= overlap < chunkSize})
 * @param minChunkSize         minimum stripped length in characters for sections and paragraphs
 * @param overviewPreviewChars maximum characters of the leading paragraph in an overview chunk
 */
public record ChunkingParams(int chunkSize, int overlapSize, int minChunkSize, int overviewPreviewChars) {

    public static final int DEFAULT_OVERVIEW_PREVIEW_CHARS = 300;

    public ChunkingParams {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlapSize < 0 || overlapSize >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlapSize must be non-negative and less than chunkSize (overlap=" + overlapSize
                            + ", chunkSize=" + chunkSize + ")");
        }
        if (minChunkSize < 0) {
            throw new IllegalArgumentException("minChunkSize must be non-negative");
        }
        if (overviewPreviewChars <= 0) {
            throw new IllegalArgumentException("overviewPreviewChars must be positive");
        }
    }

    public ChunkingParams(final int chunkSize, final int overlapSize, final int minChunkSize) {
        this(chunkSize, overlapSize, minChunkSize, DEFAULT_OVERVIEW_PREVIEW_CHARS);
    }

    /**
     * @return distance in words between the starts of consecutive windows, always {@code > 0}
     */
    public int stride() {
        return chunkSize - overlapSize;
    }
}
