package eu.virtualparadox.passagesearch.rag.index;

import eu.virtualparadox.passagesearch.ingest.lifecycle.IndexingProgressTracker;
import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.ingest.model.Document;
import eu.virtualparadox.passagesearch.rag.embed.EmbeddingProvider;
import eu.virtualparadox.passagesearch.rag.lexical.LexicalScorer;
import eu.virtualparadox.passagesearch.rag.lexical.LexicalScorerProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds immutable {@link IndexSnapshot}s.
 * <p>
 * The lexical scorer and the embedding matrix are built concurrently on the indexing executor;
 * embeddings are computed in batches. If one signal fails, the snapshot is still produced without
 * it and the failure is logged, so queries degrade instead of failing.
 * <p>
 * Input validation errors are raised before any work starts.
 */
@Slf4j
public class IndexBuilder {

    private final LexicalScorerProvider lexicalProvider;
    private final EmbeddingProvider embeddingProvider;
    private final Executor executor;
    private final int embeddingBatchSize;
    private final IndexingProgressTracker tracker;
    private final Clock clock;
    private final AtomicLong versions = new AtomicLong();

    /**
     * @param lexicalProvider    lexical scorer provider, or {@code null} to build without a lexical signal
     * @param embeddingProvider  embedding provider, or {@code null} to build without embeddings
     * @param executor           executor running the signal builds
     * @param embeddingBatchSize texts per embedding call
     * @param tracker            progress tracker for the embedding phase
     */
    public IndexBuilder(final LexicalScorerProvider lexicalProvider,
                        final EmbeddingProvider embeddingProvider,
                        final Executor executor,
                        final int embeddingBatchSize,
                        final IndexingProgressTracker tracker) {
        this(lexicalProvider, embeddingProvider, executor, embeddingBatchSize, tracker, Clock.systemUTC());
    }

    IndexBuilder(final LexicalScorerProvider lexicalProvider,
                 final EmbeddingProvider embeddingProvider,
                 final Executor executor,
                 final int embeddingBatchSize,
                 final IndexingProgressTracker tracker,
                 final Clock clock) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (embeddingBatchSize <= 0) {
            throw new IllegalArgumentException("embeddingBatchSize must be positive");
        }
        this.lexicalProvider = lexicalProvider;
        this.embeddingProvider = embeddingProvider;
        this.executor = executor;
        this.embeddingBatchSize = embeddingBatchSize;
        this.tracker = tracker == null ? new IndexingProgressTracker() : tracker;
        this.clock = clock;
    }

    public IndexSnapshot build(final List<Chunk> chunks,
                               final List<List<String>> tokenizedChunks,
                               final Map<String, Integer> chunkToDoc) {
        return build(chunks, tokenizedChunks, chunkToDoc, Collections.emptyList());
    }

    /**
     * Builds a snapshot.
     *
     * @param chunks          chunks in snapshot order
     * @param tokenizedChunks token list per chunk, aligned with {@code chunks}
     * @param chunkToDoc      parent document id per chunk id
     * @param documents       source documents (for file names and previews), may be empty
     * @return the new snapshot
     * @throws IllegalArgumentException if inputs are inconsistent
     */
    public IndexSnapshot build(final List<Chunk> chunks,
                               final List<List<String>> tokenizedChunks,
                               final Map<String, Integer> chunkToDoc,
                               final List<Document> documents) {
        validate(chunks, tokenizedChunks, chunkToDoc);

        final long version = versions.incrementAndGet();
        log.info("Building index snapshot v{} over {} chunks", version, chunks.size());

        final CompletableFuture<LexicalScorer> lexicalFuture = lexicalProvider == null
                ? CompletableFuture.completedFuture(null)
                : CompletableFuture.supplyAsync(() -> lexicalProvider.build(tokenizedChunks), executor);

        final float[][] embeddings = buildEmbeddings(chunks);
        final LexicalScorer lexicalScorer = awaitLexical(lexicalFuture, chunks.size());

        final IndexSnapshot snapshot = new IndexSnapshot(version, clock.instant(), chunks, chunkToDoc,
                documents == null ? Collections.emptyList() : documents, lexicalScorer, embeddings);

        log.info("Index snapshot v{} ready: {} chunks, {} documents, lexical={}, embeddings={}",
                version, snapshot.size(), snapshot.statistics().totalDocuments(),
                snapshot.hasLexicalScorer(), snapshot.hasEmbeddings());
        return snapshot;
    }

    private static void validate(final List<Chunk> chunks,
                                 final List<List<String>> tokenizedChunks,
                                 final Map<String, Integer> chunkToDoc) {
        if (chunks == null || tokenizedChunks == null || chunkToDoc == null) {
            throw new IllegalArgumentException("chunks, tokenizedChunks and chunkToDoc cannot be null");
        }
        if (chunks.size() != tokenizedChunks.size()) {
            throw new IllegalArgumentException("Got " + chunks.size() + " chunks but "
                    + tokenizedChunks.size() + " token lists");
        }
        final Set<String> ids = new HashSet<>();
        final Map<Integer, Integer> nextOrdinal = new HashMap<>();
        for (final Chunk chunk : chunks) {
            if (!ids.add(chunk.chunkId())) {
                throw new IllegalArgumentException("Duplicate chunk id: " + chunk.chunkId());
            }
            final Integer docId = chunkToDoc.get(chunk.chunkId());
            if (docId == null) {
                throw new IllegalArgumentException("Chunk " + chunk.chunkId() + " has no document mapping");
            }
            if (docId != chunk.parentDocId()) {
                throw new IllegalArgumentException("Chunk " + chunk.chunkId() + " maps to document " + docId
                        + " but belongs to " + chunk.parentDocId());
            }
            // ordinals of one document run 0, 1, 2, ... in input order
            final int expected = nextOrdinal.getOrDefault(docId, 0);
            if (chunk.ordinalIndex() != expected) {
                throw new IllegalArgumentException("Chunk " + chunk.chunkId() + " of document " + docId
                        + " has ordinal " + chunk.ordinalIndex() + ", expected " + expected);
            }
            nextOrdinal.put(docId, expected + 1);
        }
    }

    private LexicalScorer awaitLexical(final CompletableFuture<LexicalScorer> future, final int expectedSize) {
        try {
            final LexicalScorer scorer = future.join();
            if (scorer != null && scorer.size() != expectedSize) {
                log.error("Lexical scorer covers {} chunks instead of {}, lexical stage disabled for this snapshot",
                        scorer.size(), expectedSize);
                return null;
            }
            return scorer;
        } catch (CompletionException e) {
            log.error("Lexical index build failed, lexical stage disabled for this snapshot", e.getCause());
            return null;
        }
    }

    private float[][] buildEmbeddings(final List<Chunk> chunks) {
        if (embeddingProvider == null) {
            return null;
        }
        final float[][] matrix = new float[chunks.size()][];
        tracker.start(chunks.size());

        final List<CompletableFuture<Void>> batches = new ArrayList<>();
        for (int from = 0; from < chunks.size(); from += embeddingBatchSize) {
            final int start = from;
            final int end = Math.min(from + embeddingBatchSize, chunks.size());
            batches.add(CompletableFuture.runAsync(() -> embedBatch(chunks, start, end, matrix), executor));
        }

        try {
            CompletableFuture.allOf(batches.toArray(new CompletableFuture[0])).join();
            ensureConsistentDimension(matrix);
            return matrix;
        } catch (CompletionException e) {
            log.error("Embedding build failed, dense stage disabled for this snapshot", e.getCause());
            return null;
        } catch (IllegalStateException e) {
            log.error("Embedding matrix is inconsistent, dense stage disabled for this snapshot", e);
            return null;
        }
    }

    private void embedBatch(final List<Chunk> chunks, final int start, final int end, final float[][] matrix) {
        final List<String> texts = new ArrayList<>(end - start);
        for (int i = start; i < end; i++) {
            texts.add(chunks.get(i).content());
        }
        final List<float[]> vectors = embeddingProvider.encode(texts);
        if (vectors == null || vectors.size() != texts.size()) {
            throw new IllegalStateException("Embedding provider returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + texts.size() + " texts");
        }
        for (int i = 0; i < vectors.size(); i++) {
            matrix[start + i] = Objects.requireNonNull(vectors.get(i), "embedding vector");
        }
        tracker.step(texts.size());
    }

    private static void ensureConsistentDimension(final float[][] matrix) {
        if (matrix.length == 0) {
            return;
        }
        final int dimension = matrix[0].length;
        for (final float[] row : matrix) {
            if (row.length != dimension) {
                throw new IllegalStateException("Embedding dimension mismatch: expected " + dimension
                        + " but got " + row.length);
            }
        }
    }
}
