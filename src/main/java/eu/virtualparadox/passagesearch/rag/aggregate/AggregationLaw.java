package eu.virtualparadox.passagesearch.rag.aggregate;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * How chunk scores of one document collapse into a document score.
 */
@Slf4j
public enum AggregationLaw {

    /** Best chunk score. */
    MAX("max") {
        @Override
        public double aggregate(final List<Double> scores) {
            double max = Double.NEGATIVE_INFINITY;
            for (final double score : scores) {
                max = Math.max(max, score);
            }
            return max;
        }
    },

    /** Arithmetic mean of chunk scores. */
    MEAN("mean") {
        @Override
        public double aggregate(final List<Double> scores) {
            double sum = 0.0;
            for (final double score : scores) {
                sum += score;
            }
            return sum / scores.size();
        }
    },

    /**
     * Rank-discounted mean: scores sorted descending, the r-th (0-based) weighted {@code e^(-0.1 r)},
     * result {@code sum(s_r w_r) / sum(w_r)}.
     */
    WEIGHTED_SUM("weighted_sum") {
        @Override
        public double aggregate(final List<Double> scores) {
            final List<Double> sorted = new ArrayList<>(scores);
            sorted.sort(Comparator.reverseOrder());
            double weighted = 0.0;
            double weights = 0.0;
            for (int r = 0; r < sorted.size(); r++) {
                final double w = Math.exp(-0.1 * r);
                weighted += sorted.get(r) * w;
                weights += w;
            }
            return weighted / weights;
        }
    };

    private final String label;

    AggregationLaw(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Aggregates a non-empty list of chunk scores.
     */
    public abstract double aggregate(List<Double> scores);

    /**
     * Strict parsing for configuration.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static AggregationLaw fromName(final String name) {
        if (name != null) {
            final String key = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (final AggregationLaw law : values()) {
                if (law.label.equals(key)) {
                    return law;
                }
            }
        }
        throw new IllegalArgumentException("Unknown aggregation law: " + name
                + " (expected max, mean or weighted_sum)");
    }

    /**
     * Lenient parsing for per-request overrides: unknown names fall back to {@link #MAX}.
     */
    public static AggregationLaw parseOrDefault(final String name) {
        try {
            return fromName(name);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown aggregation law '{}', falling back to max", name);
            return MAX;
        }
    }
}
