package eu.virtualparadox.passagesearch.application.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.passagesearch.application.executor.IndexingExecutor;
import eu.virtualparadox.passagesearch.application.executor.RerankExecutor;
import eu.virtualparadox.passagesearch.ingest.chunker.Chunker;
import eu.virtualparadox.passagesearch.ingest.entity.EntityExtractor;
import eu.virtualparadox.passagesearch.ingest.entity.PatternEntityExtractor;
import eu.virtualparadox.passagesearch.ingest.lifecycle.IndexingProgressTracker;
import eu.virtualparadox.passagesearch.ingest.source.DocumentSource;
import eu.virtualparadox.passagesearch.ingest.source.JsonDocumentSource;
import eu.virtualparadox.passagesearch.rag.aggregate.DocumentAggregator;
import eu.virtualparadox.passagesearch.rag.context.ContextExpander;
import eu.virtualparadox.passagesearch.rag.embed.EmbeddingProvider;
import eu.virtualparadox.passagesearch.rag.embed.HashingEmbeddingProvider;
import eu.virtualparadox.passagesearch.rag.embed.OnnxEmbeddingProvider;
import eu.virtualparadox.passagesearch.rag.index.IndexBuilder;
import eu.virtualparadox.passagesearch.rag.lexical.LexicalScorerProvider;
import eu.virtualparadox.passagesearch.rag.lexical.LuceneBm25ScorerProvider;
import eu.virtualparadox.passagesearch.rag.pipeline.StagePipeline;
import eu.virtualparadox.passagesearch.rag.rerank.OnnxRerankProvider;
import eu.virtualparadox.passagesearch.rag.rerank.RerankProvider;
import eu.virtualparadox.passagesearch.rag.rerank.TokenOverlapRerankProvider;
import eu.virtualparadox.passagesearch.rag.scoring.ChunkBooster;
import eu.virtualparadox.passagesearch.rag.scoring.EntityOverlapExtension;
import eu.virtualparadox.passagesearch.rag.scoring.ScoreFusion;
import eu.virtualparadox.passagesearch.rag.scoring.ScoringExtension;
import eu.virtualparadox.passagesearch.rag.tokenize.LuceneTokenizer;
import eu.virtualparadox.passagesearch.rag.tokenize.Tokenizer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the retrieval components.
 * <p>Embedding and rerank providers are selected by {@code passagesearch.embedding.provider}
 * ({@code hashing | onnx | none}) and {@code passagesearch.rerank.provider}
 * ({@code token-overlap | onnx | none}); with {@code none} the corresponding stage reports
 * itself unavailable and its weight is redistributed.</p>
 */
@Configuration
public class RetrievalConfig {

    private static final String EMBEDDING_PROVIDER = "passagesearch.embedding.provider";
    private static final String RERANK_PROVIDER = "passagesearch.rerank.provider";
    private static final String ENTITY_OVERLAP = "passagesearch.scoring.entity-overlap-enabled";

    /**
     * Provides the tokenizer shared by indexing and querying.
     */
    @Bean
    public Tokenizer tokenizer(final SearchProperties props) {
        final SearchProperties.TokenizerSettings settings = props.getTokenizer();
        final List<String> stopwords = settings.isUseStopwords() ? settings.getStopwords() : Collections.emptyList();
        return new LuceneTokenizer(stopwords, settings.getMinTokenLength());
    }

    @Bean
    public LexicalScorerProvider lexicalScorerProvider(final SearchProperties props) {
        return new LuceneBm25ScorerProvider(props.getLexical().getK1(), props.getLexical().getB());
    }

    @Bean
    @ConditionalOnProperty(name = EMBEDDING_PROVIDER, havingValue = "hashing", matchIfMissing = true)
    public EmbeddingProvider hashingEmbeddingProvider(final Tokenizer tokenizer, final SearchProperties props) {
        return new HashingEmbeddingProvider(tokenizer, props.getEmbedding().getDimension());
    }

    /**
     * Provides the ONNX sentence-embedding model from {@code <models.root>/retriever}.
     */
    @Bean
    @ConditionalOnProperty(name = EMBEDDING_PROVIDER, havingValue = "onnx")
    public EmbeddingProvider onnxEmbeddingProvider(final SearchProperties props) {
        return new OnnxEmbeddingProvider(props.getModels().retriever(), props.getEmbedding().getMaxLength(),
                props.getModels().getIntraOpThreads());
    }

    @Bean
    @ConditionalOnProperty(name = RERANK_PROVIDER, havingValue = "token-overlap", matchIfMissing = true)
    public RerankProvider tokenOverlapRerankProvider(final Tokenizer tokenizer) {
        return new TokenOverlapRerankProvider(tokenizer);
    }

    /**
     * Provides the ONNX cross-encoder from {@code <models.root>/reranker}.
     */
    @Bean
    @ConditionalOnProperty(name = RERANK_PROVIDER, havingValue = "onnx")
    public RerankProvider onnxRerankProvider(final SearchProperties props) {
        return new OnnxRerankProvider(props.getModels().reranker(), props.getModels().getIntraOpThreads());
    }

    /**
     * Provides the entity extractor feeding the entity overlap boost.
     */
    @Bean
    @ConditionalOnProperty(name = ENTITY_OVERLAP, havingValue = "true")
    public EntityExtractor entityExtractor() {
        return new PatternEntityExtractor();
    }

    @Bean
    public Chunker chunker(final SearchProperties props, final ObjectProvider<EntityExtractor> entityExtractor) {
        return new Chunker(props.getChunking().params(), entityExtractor.getIfAvailable());
    }

    @Bean
    public IndexingProgressTracker indexingProgressTracker() {
        return new IndexingProgressTracker();
    }

    @Bean
    public IndexBuilder indexBuilder(final LexicalScorerProvider lexicalScorerProvider,
                                     final ObjectProvider<EmbeddingProvider> embeddingProvider,
                                     final IndexingExecutor indexingExecutor,
                                     final IndexingProgressTracker tracker,
                                     final SearchProperties props) {
        return new IndexBuilder(lexicalScorerProvider, embeddingProvider.getIfAvailable(), indexingExecutor,
                props.getEmbedding().getBatchSize(), tracker);
    }

    @Bean
    public ScoreFusion scoreFusion() {
        return new ScoreFusion();
    }

    @Bean
    @ConditionalOnProperty(name = ENTITY_OVERLAP, havingValue = "true")
    public ScoringExtension entityOverlapExtension(final Tokenizer tokenizer, final SearchProperties props) {
        return new EntityOverlapExtension(tokenizer, props.getScoring().getEntityOverlapWeight());
    }

    @Bean
    public ChunkBooster chunkBooster(final SearchProperties props, final ObjectProvider<ScoringExtension> extensions) {
        return new ChunkBooster(props.getScoring().getBoostFactor(),
                extensions.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public StagePipeline stagePipeline(final SearchProperties props,
                                       final ObjectProvider<EmbeddingProvider> embeddingProvider,
                                       final ObjectProvider<RerankProvider> rerankProvider,
                                       final RerankExecutor rerankExecutor,
                                       final ScoreFusion scoreFusion,
                                       final ChunkBooster chunkBooster) {
        return new StagePipeline(props.getPipeline().settings(), embeddingProvider.getIfAvailable(),
                rerankProvider.getIfAvailable(), rerankExecutor, scoreFusion, chunkBooster);
    }

    @Bean
    public DocumentAggregator documentAggregator(final SearchProperties props) {
        return new DocumentAggregator(props.getScoring().aggregationLaw());
    }

    @Bean
    public ContextExpander contextExpander(final SearchProperties props) {
        return new ContextExpander(props.getScoring().getContextWindow());
    }

    /**
     * Provides the JSON document source when {@code passagesearch.data.path} is set.
     */
    @Bean
    @ConditionalOnProperty(name = "passagesearch.data.path")
    public DocumentSource jsonDocumentSource(final SearchProperties props,
                                             final ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonDocumentSource(props.getData().getPath(), objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
