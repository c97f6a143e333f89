package eu.virtualparadox.passagesearch.rag.pipeline;

/**
 * Outcome of one stage for one query.
 */
public enum StageStatus {
    /** Stage ran and produced scores. */
    EXECUTED,
    /** Stage is turned off in the settings. */
    DISABLED,
    /** Stage is enabled but its signal is missing or failed. */
    UNAVAILABLE,
    /** Stage was not started because the query deadline had passed. */
    SKIPPED_DEADLINE
}
