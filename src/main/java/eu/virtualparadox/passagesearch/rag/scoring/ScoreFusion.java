package eu.virtualparadox.passagesearch.rag.scoring;

import eu.virtualparadox.passagesearch.rag.pipeline.PipelineSettings;
import eu.virtualparadox.passagesearch.rag.pipeline.Stage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines per-stage scores into one base score.
 * <p>
 * Each contributing stage is max-normalized over the final pool and clamped to {@code [0, 1]};
 * a stage whose maximum is {@code <= 0} contributes 0. Configured weights are renormalized over the
 * contributing stages so they sum to 1. If all contributing stages have weight 0, they share the
 * weight equally.
 */
@Slf4j
public class ScoreFusion {

    /**
     * @param pool        final pool positions
     * @param stageScores raw scores by stage and position, only for stages that executed
     * @param settings    pipeline settings providing configured weights
     * @return one fused score per pool position, in pool order
     */
    public List<FusedScore> fuse(final List<Integer> pool,
                                 final Map<Stage, Map<Integer, Double>> stageScores,
                                 final PipelineSettings settings) {
        final Map<Stage, Double> weights = effectiveWeights(stageScores.keySet(), settings);

        final Map<Stage, Double> maxima = new EnumMap<>(Stage.class);
        for (final Map.Entry<Stage, Map<Integer, Double>> entry : stageScores.entrySet()) {
            double max = Double.NEGATIVE_INFINITY;
            for (final Integer position : pool) {
                max = Math.max(max, entry.getValue().getOrDefault(position, 0.0));
            }
            maxima.put(entry.getKey(), max);
        }

        final List<FusedScore> fused = new ArrayList<>(pool.size());
        for (final Integer position : pool) {
            final Map<Stage, Double> raw = new EnumMap<>(Stage.class);
            final Map<Stage, Double> normalized = new EnumMap<>(Stage.class);
            double base = 0.0;

            for (final Map.Entry<Stage, Double> weight : weights.entrySet()) {
                final Stage stage = weight.getKey();
                final double rawScore = stageScores.get(stage).getOrDefault(position, 0.0);
                final double norm = normalize(rawScore, maxima.get(stage));
                raw.put(stage, rawScore);
                normalized.put(stage, norm);
                base += weight.getValue() * norm;
            }
            fused.add(new FusedScore(position, raw, normalized, weights, base));
        }
        return fused;
    }

    /**
     * Renormalizes configured weights over the given stages.
     */
    public Map<Stage, Double> effectiveWeights(final Set<Stage> contributing, final PipelineSettings settings) {
        final Map<Stage, Double> weights = new EnumMap<>(Stage.class);
        if (contributing.isEmpty()) {
            return weights;
        }
        double sum = 0.0;
        for (final Stage stage : contributing) {
            sum += settings.weight(stage);
        }
        for (final Stage stage : contributing) {
            weights.put(stage, sum > 0.0 ? settings.weight(stage) / sum : 1.0 / contributing.size());
        }
        if (sum <= 0.0) {
            log.debug("Contributing stages {} all have weight 0, sharing equally", contributing);
        }
        return weights;
    }

    static double normalize(final double raw, final double max) {
        if (!(max > 0.0)) {
            return 0.0;
        }
        final double value = raw / max;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
