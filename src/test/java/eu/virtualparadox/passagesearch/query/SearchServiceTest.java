package eu.virtualparadox.passagesearch.query;

import eu.virtualparadox.passagesearch.application.config.SearchProperties;
import eu.virtualparadox.passagesearch.ingest.chunker.Chunker;
import eu.virtualparadox.passagesearch.ingest.entity.PatternEntityExtractor;
import eu.virtualparadox.passagesearch.ingest.lifecycle.IndexLifecycleManager;
import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.ingest.model.Document;
import eu.virtualparadox.passagesearch.ingest.source.DocumentSource;
import eu.virtualparadox.passagesearch.rag.aggregate.DocumentAggregator;
import eu.virtualparadox.passagesearch.rag.context.ContextExpander;
import eu.virtualparadox.passagesearch.rag.embed.HashingEmbeddingProvider;
import eu.virtualparadox.passagesearch.rag.index.IndexBuilder;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshotHolder;
import eu.virtualparadox.passagesearch.rag.index.NotIndexedException;
import eu.virtualparadox.passagesearch.rag.lexical.LuceneBm25ScorerProvider;
import eu.virtualparadox.passagesearch.rag.pipeline.StagePipeline;
import eu.virtualparadox.passagesearch.rag.pipeline.StageStatus;
import eu.virtualparadox.passagesearch.rag.rerank.TokenOverlapRerankProvider;
import eu.virtualparadox.passagesearch.rag.scoring.ChunkBooster;
import eu.virtualparadox.passagesearch.rag.scoring.EntityOverlapExtension;
import eu.virtualparadox.passagesearch.rag.scoring.ScoreFusion;
import eu.virtualparadox.passagesearch.rag.tokenize.LuceneTokenizer;
import eu.virtualparadox.passagesearch.rag.tokenize.Tokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchServiceTest {

    private static final List<Document> DOCUMENTS = List.of(
            new Document(0, "install.md", """
                    # Installation

                    Install the search service with maven and java seventeen. Configure the data path before the first start.

                    ## Requirements

                    A recent JDK and enough memory for the embedding matrix are required.
                    """),
            new Document(1, "scoring.md", """
                    # Scoring

                    Scores from lexical, dense and rerank stages are normalized and fused with configurable weights.

                    ## Boosting

                    Structural boosts favour overview and section chunks over fixed windows.
                    """),
            new Document(2, "ops.md", """
                    # Operations

                    Rebuilding the index swaps snapshots atomically so running queries are never disturbed.
                    """));

    private SearchProperties properties;
    private IndexSnapshotHolder holder;
    private IndexLifecycleManager lifecycle;
    private SearchService service;

    // ---------- Helpers ----------

    @BeforeEach
    void setUp() {
        properties = new SearchProperties();
        properties.getChunking().setMinChunkSize(10);
        properties.getScoring().setChunksPerSearch(10);

        Tokenizer tokenizer = new LuceneTokenizer(properties.getTokenizer().getStopwords(), 2);
        HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider(tokenizer, 128);
        IndexBuilder builder = new IndexBuilder(new LuceneBm25ScorerProvider(1.5f, 0.75f), embeddings,
                Runnable::run, 4, null);
        StagePipeline pipeline = new StagePipeline(properties.getPipeline().settings(), embeddings,
                new TokenOverlapRerankProvider(tokenizer), Runnable::run, new ScoreFusion(), new ChunkBooster(1.2));

        holder = new IndexSnapshotHolder();
        lifecycle = new IndexLifecycleManager(new Chunker(properties.getChunking().params()), tokenizer, builder,
                holder, new DefaultListableBeanFactory().getBeanProvider(DocumentSource.class), properties);
        service = new SearchService(holder, tokenizer, pipeline,
                new DocumentAggregator(properties.getScoring().aggregationLaw()),
                new ContextExpander(properties.getScoring().getContextWindow()), properties);
    }

    private SearchService serviceFor(List<Document> documents, Chunker chunker, ChunkBooster booster) {
        Tokenizer tokenizer = new LuceneTokenizer(properties.getTokenizer().getStopwords(), 2);
        HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider(tokenizer, 128);
        IndexSnapshotHolder snapshots = new IndexSnapshotHolder();
        new IndexLifecycleManager(chunker, tokenizer,
                new IndexBuilder(new LuceneBm25ScorerProvider(1.5f, 0.75f), embeddings, Runnable::run, 4, null),
                snapshots, new DefaultListableBeanFactory().getBeanProvider(DocumentSource.class), properties)
                .rebuild(documents);
        StagePipeline pipeline = new StagePipeline(properties.getPipeline().settings(), embeddings,
                new TokenOverlapRerankProvider(tokenizer), Runnable::run, new ScoreFusion(), booster);
        return new SearchService(snapshots, tokenizer, pipeline,
                new DocumentAggregator(properties.getScoring().aggregationLaw()),
                new ContextExpander(properties.getScoring().getContextWindow()), properties);
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Searching before the first build fails")
    void notIndexed() {
        assertThrows(NotIndexedException.class, () -> service.search("weights", SearchMode.CHUNK, 5));
        assertThrows(NotIndexedException.class, () -> service.statistics());
    }

    @Test
    @DisplayName("Invalid requests are rejected")
    void invalidRequests() {
        lifecycle.rebuild(DOCUMENTS);

        assertThrows(IllegalArgumentException.class, () -> service.search("  ", SearchMode.CHUNK, 5));
        assertThrows(IllegalArgumentException.class, () -> service.search(null, SearchMode.CHUNK, 5));
        assertThrows(IllegalArgumentException.class, () -> service.search("weights", null, 5));
        assertThrows(IllegalArgumentException.class, () -> service.search("weights", SearchMode.CHUNK, 0));
    }

    @Test
    @DisplayName("A stopword-only query returns an empty result")
    void stopwordOnlyQuery() {
        lifecycle.rebuild(DOCUMENTS);

        SearchResponse response = service.search("the and", SearchMode.DOCUMENT, 5);

        assertTrue(response.isEmpty());
        assertTrue(response.trace().isEmpty());
        assertEquals(1, response.snapshotVersion());
    }

    @Test
    @DisplayName("Chunk mode ranks the matching section first")
    void chunkMode() {
        lifecycle.rebuild(DOCUMENTS);

        SearchResponse response = service.search("fused weights", SearchMode.CHUNK, 3);

        assertEquals(SearchMode.CHUNK, response.mode());
        assertEquals(3, response.chunks().size());
        assertEquals(1, response.chunks().get(0).docId());
        assertEquals("Scoring", response.chunks().get(0).chunk().sectionTitle());
        assertTrue(response.documents().isEmpty());
        assertEquals(3, response.trace().size());
        assertTrue(response.trace().stream().allMatch(t -> t.status() == StageStatus.EXECUTED));
    }

    @Test
    @DisplayName("Document mode aggregates chunks into ranked documents with previews")
    void documentMode() {
        lifecycle.rebuild(DOCUMENTS);

        SearchResponse response = service.search("index snapshots", SearchMode.DOCUMENT, 2);

        assertEquals(2, response.documents().size());
        DocumentHit top = response.documents().get(0);
        assertEquals(2, top.docId());
        assertEquals("ops.md", top.filename());
        assertEquals(1, top.totalChunks());
        assertTrue(top.preview().startsWith("[Operations] # Operations"));
        assertTrue(top.contextChunks().isEmpty());
        assertEquals("", top.content());
        assertTrue(top.score() >= response.documents().get(1).score());
    }

    @Test
    @DisplayName("Context mode expands best chunks with their neighbours")
    void contextMode() {
        lifecycle.rebuild(DOCUMENTS);

        SearchResponse response = service.search("structural boosts", SearchMode.CONTEXT, 1);

        assertEquals(SearchMode.CONTEXT, response.mode());
        DocumentHit hit = response.documents().get(0);
        assertEquals(1, hit.docId());
        assertEquals(2, hit.contextChunks().size());
        assertTrue(hit.content().startsWith("## Scoring\n# Scoring"));
        assertTrue(hit.content().contains("\n\n## Boosting\n## Boosting"));
    }

    @Test
    @DisplayName("Per-request aggregation and timeout are honoured")
    void requestOverrides() {
        lifecycle.rebuild(DOCUMENTS);

        SearchResponse lenient = service.search(SearchRequest.builder()
                .query("index snapshots")
                .mode(SearchMode.DOCUMENT)
                .topK(3)
                .aggregation("median")
                .build());
        assertFalse(lenient.isEmpty());

        SearchResponse expired = service.search(SearchRequest.builder()
                .query("index snapshots")
                .mode(SearchMode.CHUNK)
                .topK(3)
                .timeout(Duration.ZERO)
                .build());
        assertTrue(expired.deadlineExceeded());
        assertEquals(3, expired.chunks().size());
    }

    @Test
    @DisplayName("Entity overlap lifts the chunk naming the queried entity")
    void entityOverlapChangesRanking() {
        // same tokens after lowercasing, only doc 1 spells Paris as a name
        List<Document> documents = List.of(
                new Document(0, "lower.md", "# History\n\nIn 1783 the treaty of paris ended the long war."),
                new Document(1, "upper.md", "# History\n\nIn 1783 the treaty of Paris ended the long war."));
        Tokenizer tokenizer = new LuceneTokenizer(properties.getTokenizer().getStopwords(), 2);

        SearchService plain = serviceFor(documents, new Chunker(properties.getChunking().params()),
                new ChunkBooster(1.2));
        SearchResponse before = plain.search("treaty of paris 1783", SearchMode.CHUNK, 2);
        assertEquals(0, before.chunks().get(0).docId());
        assertEquals(before.chunks().get(0).score(), before.chunks().get(1).score(), 1e-12);

        SearchService entityAware = serviceFor(documents,
                new Chunker(properties.getChunking().params(), new PatternEntityExtractor()),
                new ChunkBooster(1.2, List.of(new EntityOverlapExtension(tokenizer, 0.2))));
        SearchResponse after = entityAware.search("treaty of paris 1783", SearchMode.CHUNK, 2);
        assertEquals(1, after.chunks().get(0).docId());
        assertTrue(after.chunks().get(0).score() > after.chunks().get(1).score());
        assertEquals(Map.of(PatternEntityExtractor.NAMES, List.of("Paris"),
                        PatternEntityExtractor.YEARS, List.of("1783")),
                after.chunks().get(0).chunk().metadata().get(Chunk.ENTITIES));
    }

    @Test
    @DisplayName("Statistics describe the current snapshot")
    void statistics() {
        lifecycle.rebuild(DOCUMENTS);

        assertEquals(3, service.statistics().totalDocuments());
        assertEquals(5, service.statistics().totalChunks());
    }
}
