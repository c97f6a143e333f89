package eu.virtualparadox.passagesearch.ingest.lifecycle;

import eu.virtualparadox.passagesearch.application.config.SearchProperties;
import eu.virtualparadox.passagesearch.ingest.chunker.Chunker;
import eu.virtualparadox.passagesearch.ingest.model.ChunkType;
import eu.virtualparadox.passagesearch.ingest.model.Document;
import eu.virtualparadox.passagesearch.ingest.source.DocumentSource;
import eu.virtualparadox.passagesearch.rag.index.IndexBuilder;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshot;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshotHolder;
import eu.virtualparadox.passagesearch.rag.lexical.LuceneBm25ScorerProvider;
import eu.virtualparadox.passagesearch.rag.tokenize.LuceneTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndexLifecycleManagerTest {

    private static final List<Document> DOCUMENTS = List.of(
            new Document(0, "a.md", "# Alpha\n\nFirst document talks about lexical scoring in detail."),
            new Document(1, "b.md", "# Beta\n\nSecond document explains dense retrieval and embeddings."),
            new Document(2, "empty.md", "   "));

    private final SearchProperties properties = new SearchProperties();
    private final IndexSnapshotHolder holder = new IndexSnapshotHolder();

    // ---------- Helpers ----------

    private IndexLifecycleManager manager(DocumentSource source) {
        properties.getChunking().setMinChunkSize(10);
        DefaultListableBeanFactory factory = new DefaultListableBeanFactory();
        if (source != null) {
            factory.registerSingleton("documentSource", source);
        }
        return new IndexLifecycleManager(
                new Chunker(properties.getChunking().params()),
                new LuceneTokenizer(List.of(), 2),
                new IndexBuilder(new LuceneBm25ScorerProvider(1.5f, 0.75f), null, Runnable::run, 8, null),
                holder,
                factory.getBeanProvider(DocumentSource.class),
                properties);
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Rebuild chunks, indexes and publishes the documents")
    void rebuildPublishes() {
        IndexSnapshot snapshot = manager(null).rebuild(DOCUMENTS);

        assertSame(snapshot, holder.current());
        assertEquals(2, snapshot.size());
        assertEquals(2, snapshot.statistics().totalDocuments());
        assertEquals(2, snapshot.statistics().chunkTypes().get(ChunkType.SECTION));
        assertTrue(snapshot.hasLexicalScorer());
        assertEquals("b.md", snapshot.filename(1));
        assertEquals(1, snapshot.documentOf("1_hybrid_00000"));
    }

    @Test
    @DisplayName("Configured strategy drives chunk ids")
    void strategyFromProperties() {
        properties.getChunking().setStrategy("fixed");
        IndexSnapshot snapshot = manager(null).rebuild(DOCUMENTS);

        assertTrue(snapshot.positionOf("0_fixed_00000").isPresent());
        assertEquals(ChunkType.FIXED, snapshot.chunk(0).chunkType());
    }

    @Test
    @DisplayName("A second rebuild replaces the snapshot; held snapshots stay usable")
    void rebuildSwaps() {
        IndexLifecycleManager manager = manager(null);
        IndexSnapshot first = manager.rebuild(DOCUMENTS);
        IndexSnapshot second = manager.rebuild(DOCUMENTS.subList(0, 1));

        assertSame(second, holder.current());
        assertEquals(2, first.size());
        assertEquals(1, second.size());
        assertTrue(second.version() > first.version());
    }

    @Test
    @DisplayName("Duplicate document ids are rejected and the current snapshot is kept")
    void duplicateDocumentIds() {
        IndexLifecycleManager manager = manager(null);
        IndexSnapshot current = manager.rebuild(DOCUMENTS);

        List<Document> duplicated = List.of(new Document(4, "x.md", "# X\n\nsome text here"),
                new Document(4, "y.md", "# Y\n\nother text here"));
        assertThrows(IllegalArgumentException.class, () -> manager.rebuild(duplicated));
        assertSame(current, holder.current());
    }

    @Test
    @DisplayName("Rebuild from source requires a configured source")
    void rebuildWithoutSource() {
        assertThrows(IllegalStateException.class, () -> manager(null).rebuild());
    }

    @Test
    @DisplayName("Rebuild from source loads its documents")
    void rebuildFromSource() {
        IndexSnapshot snapshot = manager(() -> DOCUMENTS).rebuild();
        assertEquals(2, snapshot.size());
    }

    @Test
    @DisplayName("Startup indexing runs only when enabled and survives failures")
    void indexOnStartup() {
        manager(() -> DOCUMENTS).indexOnStartup();
        assertFalse(holder.isIndexed());

        properties.getData().setIndexOnStartup(true);
        manager(() -> {
            throw new IllegalStateException("unreadable");
        }).indexOnStartup();
        assertFalse(holder.isIndexed());

        manager(() -> DOCUMENTS).indexOnStartup();
        assertTrue(holder.isIndexed());
    }

    @Test
    @DisplayName("Progress tracker reports completion")
    void progressTracker() {
        IndexingProgressTracker tracker = new IndexingProgressTracker();
        assertEquals(new ProgressStatus(100, 0, 0), tracker.getProgressStatus());

        tracker.start(4);
        tracker.step(1);
        assertEquals(new ProgressStatus(25, 1, 4), tracker.getProgressStatus());
        tracker.step(10);
        assertEquals(new ProgressStatus(100, 4, 4), tracker.getProgressStatus());
    }
}
