package eu.virtualparadox.passagesearch.rag.scoring;

import eu.virtualparadox.passagesearch.rag.pipeline.Stage;

import java.util.Map;

/**
 * Fused, not yet boosted, score of one pool position.
 */
public record FusedScore(int position,
                         Map<Stage, Double> rawScores,
                         Map<Stage, Double> normalizedScores,
                         Map<Stage, Double> weights,
                         double baseScore) {

    public ScoreBreakdown boosted(final double boostFactor) {
        return new ScoreBreakdown(rawScores, normalizedScores, weights, baseScore, boostFactor, baseScore * boostFactor);
    }
}
