package eu.virtualparadox.passagesearch.rag.pipeline;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.rag.embed.EmbeddingProvider;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshot;
import eu.virtualparadox.passagesearch.rag.rerank.RerankProvider;
import eu.virtualparadox.passagesearch.rag.scoring.ChunkBooster;
import eu.virtualparadox.passagesearch.rag.scoring.FusedScore;
import eu.virtualparadox.passagesearch.rag.scoring.ScoreBreakdown;
import eu.virtualparadox.passagesearch.rag.scoring.ScoreFusion;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Cascading retrieval over an {@link IndexSnapshot}.
 *
 * <h2>Stages</h2>
 * <ol>
 *   <li><strong>Lexical:</strong> scores every chunk, keeps the best {@code stage1TopK}.</li>
 *   <li><strong>Dense:</strong> cosine similarity of the query embedding against the surviving rows only,
 *       keeps the best {@code stage2TopK}.</li>
 *   <li><strong>Rerank:</strong> scores (query, chunk) pairs in parallel on the rerank executor, keeps
 *       the best {@code min(stage3TopK, finalTopK)}.</li>
 * </ol>
 * A stage that is disabled or unavailable still truncates the pool to its top-k, ranked by the most
 * recent scores; before any stage has scored, the pool passes through untouched. Each stage only
 * sees the survivors of the previous one, so pool sizes never grow.
 *
 * <h2>Fusion</h2>
 * Survivors get a base score from {@link ScoreFusion}, multiplied by {@link ChunkBooster}; results
 * are ordered by final score descending, ties by ascending snapshot position.
 *
 * <h2>Determinism</h2>
 * Every ordering breaks ties by position and rerank results are joined in candidate order, so
 * repeated queries on the same snapshot return identical results.
 */
@Slf4j
public class StagePipeline {

    private static final int TRACE_TOP_SCORES = 5;

    @Getter
    private final PipelineSettings settings;
    private final EmbeddingProvider embeddingProvider;
    private final RerankProvider rerankProvider;
    private final Executor rerankExecutor;
    private final ScoreFusion scoreFusion;
    private final ChunkBooster booster;

    /**
     * @param settings          validated settings
     * @param embeddingProvider query embedder, or {@code null} when dense retrieval is not available
     * @param rerankProvider    reranker, or {@code null} when reranking is not available
     * @param rerankExecutor    executor for parallel pair scoring
     * @param scoreFusion       score fusion
     * @param booster           chunk booster
     */
    public StagePipeline(final PipelineSettings settings,
                         final EmbeddingProvider embeddingProvider,
                         final RerankProvider rerankProvider,
                         final Executor rerankExecutor,
                         final ScoreFusion scoreFusion,
                         final ChunkBooster booster) {
        if (settings == null || rerankExecutor == null || scoreFusion == null || booster == null) {
            throw new IllegalArgumentException("settings, rerankExecutor, scoreFusion and booster are required");
        }
        this.settings = settings;
        this.embeddingProvider = embeddingProvider;
        this.rerankProvider = rerankProvider;
        this.rerankExecutor = rerankExecutor;
        this.scoreFusion = scoreFusion;
        this.booster = booster;
    }

    /**
     * Runs the cascade for one query.
     *
     * @param snapshot    snapshot acquired once for this query
     * @param query       raw query text
     * @param queryTokens tokenized query
     * @param finalTopK   number of candidates to return
     * @param deadline    query deadline, checked before each stage; {@code null} for none
     * @return ranked candidates with per-stage trace
     */
    public PipelineResult run(final IndexSnapshot snapshot,
                              final String query,
                              final List<String> queryTokens,
                              final int finalTopK,
                              final Deadline deadline) {
        if (finalTopK <= 0) {
            throw new IllegalArgumentException("finalTopK must be > 0");
        }
        final Deadline effectiveDeadline = deadline == null ? Deadline.none() : deadline;
        final Run run = new Run(snapshot, query, queryTokens, finalTopK);
        final List<StageTrace> trace = new ArrayList<>();
        boolean deadlineExceeded = false;

        for (final Stage stage : Stage.values()) {
            if (deadlineExceeded || effectiveDeadline.isExpired()) {
                if (!deadlineExceeded) {
                    log.warn("Query deadline reached before {} stage, returning results of completed stages", stage.label());
                }
                deadlineExceeded = true;
                trace.add(new StageTrace(stage, StageStatus.SKIPPED_DEADLINE, run.pool.size(), run.pool.size(),
                        Collections.emptyList()));
                continue;
            }
            trace.add(run.execute(stage));
        }

        final List<ScoredCandidate> candidates = run.finish();
        return new PipelineResult(candidates, trace, deadlineExceeded);
    }

    /**
     * Mutable state of a single query. Never shared between threads except for the read-only
     * rerank fan-out.
     */
    private final class Run {

        private final IndexSnapshot snapshot;
        private final String query;
        private final List<String> queryTokens;
        private final int finalTopK;
        private final Map<Stage, Map<Integer, Double>> stageScores = new EnumMap<>(Stage.class);
        private List<Integer> pool;
        private Stage lastScored;

        private Run(final IndexSnapshot snapshot, final String query, final List<String> queryTokens, final int finalTopK) {
            this.snapshot = snapshot;
            this.query = query;
            this.queryTokens = queryTokens;
            this.finalTopK = finalTopK;
            this.pool = new ArrayList<>(snapshot.size());
            for (int position = 0; position < snapshot.size(); position++) {
                pool.add(position);
            }
        }

        private StageTrace execute(final Stage stage) {
            final int in = pool.size();
            final int k = stage == Stage.RERANK
                    ? Math.min(settings.topK(Stage.RERANK), finalTopK)
                    : settings.topK(stage);

            if (!settings.isEnabled(stage)) {
                truncateByLastScores(settings.topK(stage));
                return new StageTrace(stage, StageStatus.DISABLED, in, pool.size(), Collections.emptyList());
            }

            final Map<Integer, Double> scores;
            try {
                scores = score(stage);
            } catch (RuntimeException e) {
                log.warn("{} stage failed, continuing without it: {}", stage.label(), e.getMessage());
                log.debug("{} stage failure", stage.label(), e);
                truncateByLastScores(settings.topK(stage));
                return new StageTrace(stage, StageStatus.UNAVAILABLE, in, pool.size(), Collections.emptyList());
            }
            if (scores == null) {
                log.debug("{} stage unavailable for snapshot v{}", stage.label(), snapshot.version());
                truncateByLastScores(settings.topK(stage));
                return new StageTrace(stage, StageStatus.UNAVAILABLE, in, pool.size(), Collections.emptyList());
            }

            stageScores.put(stage, scores);
            lastScored = stage;
            pool = topK(pool, scores, k);
            return new StageTrace(stage, StageStatus.EXECUTED, in, pool.size(), topScores(scores));
        }

        /**
         * @return raw scores for the current pool, or {@code null} if the signal is missing
         */
        private Map<Integer, Double> score(final Stage stage) {
            return switch (stage) {
                case LEXICAL -> lexicalScores();
                case DENSE -> denseScores();
                case RERANK -> rerankScores();
            };
        }

        private Map<Integer, Double> lexicalScores() {
            if (!snapshot.hasLexicalScorer() || queryTokens.isEmpty()) {
                return null;
            }
            final double[] all = snapshot.lexicalScorer().score(queryTokens);
            if (all.length != snapshot.size()) {
                throw new IllegalStateException("Lexical scorer returned " + all.length
                        + " scores for " + snapshot.size() + " chunks");
            }
            final Map<Integer, Double> scores = new HashMap<>();
            for (final Integer position : pool) {
                scores.put(position, sanitize(all[position]));
            }
            return scores;
        }

        private Map<Integer, Double> denseScores() {
            if (embeddingProvider == null || !snapshot.hasEmbeddings()) {
                return null;
            }
            final float[] queryVector = embeddingProvider.encode(query);
            final float[][] rows = snapshot.embeddingRows(pool);
            final double[] similarities = embeddingProvider.similarity(queryVector, rows);
            if (similarities.length != rows.length) {
                throw new IllegalStateException("Similarity returned " + similarities.length
                        + " scores for " + rows.length + " rows");
            }
            final Map<Integer, Double> scores = new HashMap<>();
            for (int i = 0; i < pool.size(); i++) {
                scores.put(pool.get(i), sanitize(similarities[i]));
            }
            return scores;
        }

        private Map<Integer, Double> rerankScores() {
            if (rerankProvider == null) {
                return null;
            }
            final List<CompletableFuture<Double>> futures = new ArrayList<>(pool.size());
            for (final Integer position : pool) {
                final String text = snapshot.chunk(position).content();
                futures.add(CompletableFuture.supplyAsync(() -> scorePair(text), rerankExecutor));
            }
            final Map<Integer, Double> scores = new HashMap<>();
            for (int i = 0; i < pool.size(); i++) {
                scores.put(pool.get(i), futures.get(i).join());
            }
            return scores;
        }

        private double scorePair(final String text) {
            try {
                final double score = rerankProvider.score(query, text);
                if (Double.isNaN(score)) {
                    log.warn("Reranker returned NaN, using neutral score");
                    return RerankProvider.NEUTRAL_SCORE;
                }
                return Math.max(0.0, Math.min(1.0, score));
            } catch (RuntimeException e) {
                log.warn("Reranking a candidate failed, using neutral score: {}", e.getMessage());
                return RerankProvider.NEUTRAL_SCORE;
            }
        }

        private void truncateByLastScores(final int k) {
            if (lastScored == null) {
                return;
            }
            pool = topK(pool, stageScores.get(lastScored), k);
        }

        private List<ScoredCandidate> finish() {
            final List<FusedScore> fused = scoreFusion.fuse(pool, stageScores, settings);
            final List<ScoredCandidate> candidates = new ArrayList<>(fused.size());
            for (final FusedScore score : fused) {
                final Chunk chunk = snapshot.chunk(score.position());
                final ScoreBreakdown breakdown = score.boosted(booster.boostFactor(query, chunk));
                candidates.add(new ScoredCandidate(chunk, score.position(), breakdown.finalScore(), breakdown));
            }
            candidates.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed()
                    .thenComparingInt(ScoredCandidate::position));
            return candidates.size() > finalTopK
                    ? new ArrayList<>(candidates.subList(0, finalTopK))
                    : candidates;
        }
    }

    /**
     * Selects the best {@code k} positions by score, ties by ascending position.
     */
    static List<Integer> topK(final List<Integer> pool, final Map<Integer, Double> scores, final int k) {
        final List<Integer> ranked = new ArrayList<>(pool);
        ranked.sort(Comparator.<Integer>comparingDouble(p -> scores.getOrDefault(p, 0.0)).reversed()
                .thenComparingInt(p -> p));
        return ranked.size() > k ? new ArrayList<>(ranked.subList(0, k)) : ranked;
    }

    private static List<Double> topScores(final Map<Integer, Double> scores) {
        final List<Double> values = new ArrayList<>(scores.values());
        values.sort(Comparator.reverseOrder());
        return values.size() > TRACE_TOP_SCORES ? values.subList(0, TRACE_TOP_SCORES) : values;
    }

    private static double sanitize(final double score) {
        return Double.isFinite(score) ? score : 0.0;
    }
}
