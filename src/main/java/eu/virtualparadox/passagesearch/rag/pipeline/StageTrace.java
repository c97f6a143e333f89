package eu.virtualparadox.passagesearch.rag.pipeline;

import java.util.List;

/**
 * Per-stage diagnostics of one query.
 *
 * @param stage         the stage
 * @param status        what happened
 * @param candidatesIn  pool size entering the stage
 * @param candidatesOut pool size leaving the stage
 * @param topScores     best raw scores produced by the stage, descending (empty unless executed)
 */
public record StageTrace(Stage stage,
                         StageStatus status,
                         int candidatesIn,
                         int candidatesOut,
                         List<Double> topScores) {

    public StageTrace {
        topScores = List.copyOf(topScores);
    }
}
