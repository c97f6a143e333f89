package eu.virtualparadox.passagesearch.rag.pipeline;

import java.util.List;

/**
 * Output of one pipeline run.
 *
 * @param candidates       ranked candidates, best first
 * @param trace            one entry per stage, in execution order
 * @param deadlineExceeded whether later stages were skipped because of the deadline
 */
public record PipelineResult(List<ScoredCandidate> candidates,
                             List<StageTrace> trace,
                             boolean deadlineExceeded) {

    public PipelineResult {
        candidates = List.copyOf(candidates);
        trace = List.copyOf(trace);
    }

    public StageTrace trace(final Stage stage) {
        for (final StageTrace entry : trace) {
            if (entry.stage() == stage) {
                return entry;
            }
        }
        throw new IllegalArgumentException("No trace for stage " + stage);
    }
}
