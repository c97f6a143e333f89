package eu.virtualparadox.passagesearch.ingest.lifecycle;

/**
 * Progress status of an indexing run.
 *
 * @param totalPercent    overall embedding progress (0-100)
 * @param processedChunks chunks embedded so far
 * @param totalChunks     chunks to embed in this run
 */
public record ProgressStatus(int totalPercent, int processedChunks, int totalChunks) {

}
