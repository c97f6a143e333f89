package eu.virtualparadox.passagesearch.rag.scoring;

import eu.virtualparadox.passagesearch.rag.pipeline.Stage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Explains how a candidate's final score was computed.
 *
 * @param rawScores        raw score per contributing stage
 * @param normalizedScores max-normalized score per contributing stage
 * @param weights          effective (renormalized) weight per contributing stage
 * @param baseScore        weighted sum of normalized scores
 * @param boostFactor      product of all boost multipliers
 * @param finalScore       {@code baseScore * boostFactor}
 */
public record ScoreBreakdown(Map<Stage, Double> rawScores,
                             Map<Stage, Double> normalizedScores,
                             Map<Stage, Double> weights,
                             double baseScore,
                             double boostFactor,
                             double finalScore) {

    public ScoreBreakdown {
        rawScores = freeze(rawScores);
        normalizedScores = freeze(normalizedScores);
        weights = freeze(weights);
    }

    private static Map<Stage, Double> freeze(final Map<Stage, Double> source) {
        final Map<Stage, Double> copy = new EnumMap<>(Stage.class);
        copy.putAll(source);
        return Collections.unmodifiableMap(copy);
    }
}
