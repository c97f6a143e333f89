package eu.virtualparadox.passagesearch.rag.pipeline;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * Immutable pipeline configuration: which stages run, how many candidates each keeps, and how
 * their normalized scores are weighted in the fused score.
 * <p>
 * Validated on construction: every top-k must be positive, weights must be finite and non-negative,
 * at least one stage must be enabled, and the weights of the enabled stages must sum to more than 0.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PipelineSettings {

    private final boolean lexicalEnabled;
    private final boolean denseEnabled;
    private final boolean rerankEnabled;
    private final int stage1TopK;
    private final int stage2TopK;
    private final int stage3TopK;
    private final double lexicalWeight;
    private final double denseWeight;
    private final double rerankWeight;

    @Builder(toBuilder = true)
    private PipelineSettings(final boolean lexicalEnabled,
                             final boolean denseEnabled,
                             final boolean rerankEnabled,
                             final int stage1TopK,
                             final int stage2TopK,
                             final int stage3TopK,
                             final double lexicalWeight,
                             final double denseWeight,
                             final double rerankWeight) {
        requirePositive("stage1TopK", stage1TopK);
        requirePositive("stage2TopK", stage2TopK);
        requirePositive("stage3TopK", stage3TopK);
        requireWeight("lexicalWeight", lexicalWeight);
        requireWeight("denseWeight", denseWeight);
        requireWeight("rerankWeight", rerankWeight);
        if (!lexicalEnabled && !denseEnabled && !rerankEnabled) {
            throw new IllegalArgumentException("At least one retrieval stage must be enabled");
        }
        final double enabledWeight = (lexicalEnabled ? lexicalWeight : 0.0)
                + (denseEnabled ? denseWeight : 0.0)
                + (rerankEnabled ? rerankWeight : 0.0);
        if (enabledWeight <= 0.0) {
            throw new IllegalArgumentException("Weights of the enabled stages must sum to more than 0");
        }

        this.lexicalEnabled = lexicalEnabled;
        this.denseEnabled = denseEnabled;
        this.rerankEnabled = rerankEnabled;
        this.stage1TopK = stage1TopK;
        this.stage2TopK = stage2TopK;
        this.stage3TopK = stage3TopK;
        this.lexicalWeight = lexicalWeight;
        this.denseWeight = denseWeight;
        this.rerankWeight = rerankWeight;
    }

    public boolean isEnabled(final Stage stage) {
        return switch (stage) {
            case LEXICAL -> lexicalEnabled;
            case DENSE -> denseEnabled;
            case RERANK -> rerankEnabled;
        };
    }

    public int topK(final Stage stage) {
        return switch (stage) {
            case LEXICAL -> stage1TopK;
            case DENSE -> stage2TopK;
            case RERANK -> stage3TopK;
        };
    }

    public double weight(final Stage stage) {
        return switch (stage) {
            case LEXICAL -> lexicalWeight;
            case DENSE -> denseWeight;
            case RERANK -> rerankWeight;
        };
    }

    /**
     * Full three-stage cascade: 100 → 50 → 20, weights 0.3 / 0.4 / 0.3.
     */
    public static PipelineSettings defaults() {
        return builder().build();
    }

    /**
     * Named use-case presets.
     * <ul>
     *   <li>{@code fast}: lexical only, 20 candidates</li>
     *   <li>{@code balanced}: lexical + dense, 100 → 20, weights 0.4 / 0.6</li>
     *   <li>{@code accurate}: all three stages, same as {@link #defaults()}</li>
     * </ul>
     *
     * @throws IllegalArgumentException for an unknown preset name
     */
    public static PipelineSettings preset(final String name) {
        final String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "fast" -> builder()
                    .denseEnabled(false)
                    .rerankEnabled(false)
                    .stage1TopK(20)
                    .lexicalWeight(1.0)
                    .build();
            case "balanced" -> builder()
                    .rerankEnabled(false)
                    .stage2TopK(20)
                    .lexicalWeight(0.4)
                    .denseWeight(0.6)
                    .build();
            case "accurate" -> defaults();
            default -> throw new IllegalArgumentException("Unknown pipeline preset: " + name);
        };
    }

    private static void requirePositive(final String name, final int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    private static void requireWeight(final String name, final double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException(name + " must be a finite value >= 0");
        }
    }

    public static class PipelineSettingsBuilder {
        private boolean lexicalEnabled = true;
        private boolean denseEnabled = true;
        private boolean rerankEnabled = true;
        private int stage1TopK = 100;
        private int stage2TopK = 50;
        private int stage3TopK = 20;
        private double lexicalWeight = 0.3;
        private double denseWeight = 0.4;
        private double rerankWeight = 0.3;
    }
}
