package eu.virtualparadox.passagesearch.rag.index;

import eu.virtualparadox.passagesearch.ingest.lifecycle.IndexingProgressTracker;
import eu.virtualparadox.passagesearch.ingest.lifecycle.ProgressStatus;
import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.ingest.model.ChunkType;
import eu.virtualparadox.passagesearch.ingest.model.Document;
import eu.virtualparadox.passagesearch.rag.embed.EmbeddingProvider;
import eu.virtualparadox.passagesearch.rag.lexical.LexicalScorerProvider;
import eu.virtualparadox.passagesearch.rag.lexical.LuceneBm25ScorerProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class IndexBuilderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    // ---------- Helpers ----------

    private static Chunk chunk(int docId, int ordinal, ChunkType type, int level, String content) {
        String id = docId + "_test_" + String.format("%05d", ordinal);
        return new Chunk(id, docId, ordinal, content, type, level, 0, content.length(),
                Map.of(Chunk.FILE_NAME, "doc" + docId + ".md"));
    }

    private static List<Chunk> sampleChunks() {
        return List.of(
                chunk(0, 0, ChunkType.OVERVIEW, 0, "overview of the first document"),
                chunk(0, 1, ChunkType.SECTION, 1, "section about lucene scoring"),
                chunk(1, 0, ChunkType.PARAGRAPH, 2, "paragraph about dense vectors and more words"),
                chunk(1, 1, ChunkType.PARAGRAPH, 2, "another paragraph"),
                chunk(2, 0, ChunkType.FIXED, 0, "fixed window text"));
    }

    private static List<List<String>> tokens(List<Chunk> chunks) {
        List<List<String>> tokens = new ArrayList<>();
        for (Chunk c : chunks) {
            tokens.add(List.of(c.content().split(" ")));
        }
        return tokens;
    }

    private static Map<String, Integer> mapping(List<Chunk> chunks) {
        Map<String, Integer> map = new HashMap<>();
        for (Chunk c : chunks) {
            map.put(c.chunkId(), c.parentDocId());
        }
        return map;
    }

    /** Embeds each text as [length, 1] and records batch sizes. */
    private static final class RecordingEmbeddings implements EmbeddingProvider {
        private final List<Integer> batches = new ArrayList<>();

        @Override
        public synchronized List<float[]> encode(List<String> texts) {
            batches.add(texts.size());
            List<float[]> vectors = new ArrayList<>();
            for (String text : texts) {
                vectors.add(new float[]{text.length(), 1f});
            }
            return vectors;
        }
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Builds all signals and exposes lookups")
    void buildsSnapshot() {
        List<Chunk> chunks = sampleChunks();
        RecordingEmbeddings embeddings = new RecordingEmbeddings();
        IndexBuilder builder = new IndexBuilder(new LuceneBm25ScorerProvider(1.5f, 0.75f), embeddings,
                Runnable::run, 2, new IndexingProgressTracker(), CLOCK);

        IndexSnapshot snapshot = builder.build(chunks, tokens(chunks), mapping(chunks),
                List.of(new Document(1, "guide.md", "Dense vectors")));

        assertEquals(1, snapshot.version());
        assertEquals(CLOCK.instant(), snapshot.builtAt());
        assertEquals(5, snapshot.size());
        assertTrue(snapshot.hasLexicalScorer());
        assertTrue(snapshot.hasEmbeddings());
        assertEquals(5, snapshot.lexicalScorer().size());
        assertEquals(List.of(2, 2, 1), embeddings.batches);

        assertEquals(2, snapshot.positionOf("1_test_00000").getAsInt());
        assertTrue(snapshot.positionOf("9_test_00000").isEmpty());
        assertEquals(1, snapshot.documentOf("1_test_00001"));
        assertNull(snapshot.documentOf("missing"));
        assertEquals(List.of(2, 3), snapshot.documentPositions(1));
        assertTrue(snapshot.documentPositions(42).isEmpty());
        assertEquals("guide.md", snapshot.filename(1));
        assertEquals("doc2.md", snapshot.filename(2));

        float[][] rows = snapshot.embeddingRows(List.of(4, 0));
        assertEquals("fixed window text".length(), rows[0][0]);
        rows[0][0] = -1f;
        assertEquals("fixed window text".length(), snapshot.embeddingRows(List.of(4))[0][0]);
    }

    @Test
    @DisplayName("Each build gets a new version")
    void versionsIncrease() {
        List<Chunk> chunks = sampleChunks();
        IndexBuilder builder = new IndexBuilder(null, null, Runnable::run, 4, null);

        assertEquals(1, builder.build(chunks, tokens(chunks), mapping(chunks)).version());
        assertEquals(2, builder.build(chunks, tokens(chunks), mapping(chunks)).version());
    }

    @Test
    @DisplayName("Inconsistent inputs are rejected before any work starts")
    void validation() {
        List<Chunk> chunks = sampleChunks();
        IndexBuilder builder = new IndexBuilder(null, null, Runnable::run, 4, null);

        assertThrows(IllegalArgumentException.class, () -> builder.build(null, tokens(chunks), mapping(chunks)));
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(chunks, tokens(chunks).subList(0, 4), mapping(chunks)));

        List<Chunk> duplicated = new ArrayList<>(chunks);
        duplicated.add(chunks.get(0));
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(duplicated, tokens(duplicated), mapping(duplicated)));

        Map<String, Integer> missing = mapping(chunks);
        missing.remove("2_test_00000");
        assertThrows(IllegalArgumentException.class, () -> builder.build(chunks, tokens(chunks), missing));

        Map<String, Integer> wrong = mapping(chunks);
        wrong.put("2_test_00000", 1);
        assertThrows(IllegalArgumentException.class, () -> builder.build(chunks, tokens(chunks), wrong));
    }

    @Test
    @DisplayName("Ordinals must run from 0 without duplicates or gaps inside each document")
    void ordinalValidation() {
        IndexBuilder builder = new IndexBuilder(null, null, Runnable::run, 4, null);

        List<Chunk> repeated = List.of(
                new Chunk("a", 1, 0, "first text", ChunkType.FIXED, 0, 0, 10, Map.of()),
                new Chunk("b", 1, 0, "second text", ChunkType.FIXED, 0, 0, 11, Map.of()));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> builder.build(repeated, tokens(repeated), mapping(repeated)));
        assertTrue(e.getMessage().contains("expected 1"));

        List<Chunk> gapped = List.of(
                new Chunk("a", 1, 5, "first text", ChunkType.FIXED, 0, 0, 10, Map.of()),
                new Chunk("b", 1, 9, "second text", ChunkType.FIXED, 0, 0, 11, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> builder.build(gapped, tokens(gapped), mapping(gapped)));

        List<Chunk> reversed = List.of(
                chunk(0, 1, ChunkType.SECTION, 1, "second"),
                chunk(0, 0, ChunkType.OVERVIEW, 0, "first"));
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(reversed, tokens(reversed), mapping(reversed)));

        // interleaved documents are fine as long as each one counts up from 0
        List<Chunk> interleaved = List.of(
                chunk(0, 0, ChunkType.FIXED, 0, "a"),
                chunk(1, 0, ChunkType.FIXED, 0, "b"),
                chunk(0, 1, ChunkType.FIXED, 0, "c"),
                chunk(1, 1, ChunkType.FIXED, 0, "d"));
        assertEquals(4, builder.build(interleaved, tokens(interleaved), mapping(interleaved)).size());
    }

    @Test
    @DisplayName("A failing lexical build leaves the snapshot without a lexical scorer")
    void lexicalFailure() {
        List<Chunk> chunks = sampleChunks();
        LexicalScorerProvider failing = corpus -> {
            throw new IllegalStateException("boom");
        };
        IndexSnapshot snapshot = new IndexBuilder(failing, new RecordingEmbeddings(), Runnable::run, 2, null)
                .build(chunks, tokens(chunks), mapping(chunks));

        assertFalse(snapshot.hasLexicalScorer());
        assertTrue(snapshot.hasEmbeddings());
    }

    @Test
    @DisplayName("A failing or inconsistent embedding build leaves the snapshot without embeddings")
    void embeddingFailure() {
        List<Chunk> chunks = sampleChunks();
        EmbeddingProvider failing = texts -> {
            throw new IllegalStateException("model missing");
        };
        IndexSnapshot failed = new IndexBuilder(new LuceneBm25ScorerProvider(1.5f, 0.75f), failing,
                Runnable::run, 2, null).build(chunks, tokens(chunks), mapping(chunks));
        assertTrue(failed.hasLexicalScorer());
        assertFalse(failed.hasEmbeddings());
        assertThrows(IllegalStateException.class, () -> failed.embeddingRows(List.of(0)));

        EmbeddingProvider ragged = texts -> {
            List<float[]> vectors = new ArrayList<>();
            for (String text : texts) {
                vectors.add(new float[text.length() % 2 == 0 ? 2 : 3]);
            }
            return vectors;
        };
        IndexSnapshot inconsistent = new IndexBuilder(null, ragged, Runnable::run, 5, null)
                .build(chunks, tokens(chunks), mapping(chunks));
        assertFalse(inconsistent.hasEmbeddings());
    }

    @Test
    @DisplayName("Embedding progress reaches 100% on a parallel executor")
    void progressTracking() {
        List<Chunk> chunks = sampleChunks();
        IndexingProgressTracker tracker = new IndexingProgressTracker();
        List<ProgressStatus> updates = new ArrayList<>();
        tracker.setProgressCallback(status -> {
            synchronized (updates) {
                updates.add(status);
            }
        });

        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            IndexSnapshot snapshot = new IndexBuilder(null, new RecordingEmbeddings(), executor, 1, tracker)
                    .build(chunks, tokens(chunks), mapping(chunks));
            assertTrue(snapshot.hasEmbeddings());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(5, updates.size());
        assertEquals(new ProgressStatus(100, 5, 5), tracker.getProgressStatus());
    }

    @Test
    @DisplayName("Empty corpus builds an empty snapshot")
    void emptyCorpus() {
        IndexSnapshot snapshot = new IndexBuilder(new LuceneBm25ScorerProvider(1.5f, 0.75f), new RecordingEmbeddings(),
                Runnable::run, 4, null).build(List.of(), List.of(), Map.of());

        assertEquals(0, snapshot.size());
        assertEquals(0, snapshot.statistics().totalChunks());
    }

    @Test
    @DisplayName("Metadata lookup and statistics")
    void metadataAndStatistics() {
        List<Chunk> chunks = sampleChunks();
        IndexSnapshot snapshot = new IndexBuilder(null, null, Runnable::run, 4, null)
                .build(chunks, tokens(chunks), mapping(chunks));

        List<Chunk> found = snapshot.findChunksByMetadata(Chunk.FILE_NAME, "doc1.md");
        assertEquals(List.of("1_test_00000", "1_test_00001"), found.stream().map(Chunk::chunkId).toList());
        assertTrue(snapshot.findChunksByMetadata("missing", "x").isEmpty());

        IndexStatistics stats = snapshot.statistics();
        assertEquals(5, stats.totalChunks());
        assertEquals(3, stats.totalDocuments());
        assertEquals(5 / 3.0, stats.avgChunksPerDocument(), 1e-12);
        assertEquals(2, stats.chunkTypes().get(ChunkType.PARAGRAPH));
        assertEquals(1, stats.chunkTypes().get(ChunkType.OVERVIEW));
        assertEquals(Map.of(0, 2, 1, 1, 2, 2), stats.hierarchyLevels());
        assertEquals(2, stats.minWords());
        assertEquals(7, stats.maxWords());
        assertEquals(4.0, stats.medianWords(), 1e-12);
        assertEquals(21 / 5.0, stats.avgWords(), 1e-12);
    }
}
