package eu.virtualparadox.passagesearch.ingest.lifecycle;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * Tracks embedding progress of the current indexing run.
 * <p>
 * Batches are embedded in parallel, so counters are updated under the instance lock.
 */
@Slf4j
public final class IndexingProgressTracker {

    private int totalChunks = 0;

    private int processedChunks = 0;

    /**
     * Optional callback invoked after each completed batch.
     */
    @Setter
    private Consumer<ProgressStatus> progressCallback;

    /**
     * Resets the tracker for a new run.
     *
     * @param chunkCount number of chunks that will be embedded
     */
    public synchronized void start(final int chunkCount) {
        totalChunks = chunkCount;
        processedChunks = 0;
        log.info("Indexing run started, {} chunks to embed", chunkCount);
    }

    /**
     * Records a completed batch.
     *
     * @param count chunks in the batch
     */
    public void step(final int count) {
        final ProgressStatus status;
        synchronized (this) {
            if (totalChunks == 0) {
                return;
            }
            processedChunks = Math.min(totalChunks, processedChunks + count);
            status = getProgressStatus();
        }
        log.debug("Embedded {}/{} chunks ({}%)", status.processedChunks(), status.totalChunks(), status.totalPercent());
        if (progressCallback != null) {
            progressCallback.accept(status);
        }
    }

    public synchronized ProgressStatus getProgressStatus() {
        final int totalPercent = totalChunks == 0 ? 100 : (int) ((processedChunks * 100L) / totalChunks);
        return new ProgressStatus(totalPercent, processedChunks, totalChunks);
    }
}
