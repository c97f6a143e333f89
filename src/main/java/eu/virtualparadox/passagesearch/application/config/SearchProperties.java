package eu.virtualparadox.passagesearch.application.config;

import eu.virtualparadox.passagesearch.ingest.chunker.ChunkingParams;
import eu.virtualparadox.passagesearch.ingest.chunker.ChunkingStrategy;
import eu.virtualparadox.passagesearch.rag.aggregate.AggregationLaw;
import eu.virtualparadox.passagesearch.rag.pipeline.PipelineSettings;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * All {@code passagesearch.*} settings.
 * <p>
 * Values are validated at startup; an invalid configuration fails the context instead of
 * surfacing at query time.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "passagesearch")
@Getter @Setter
public class SearchProperties {

    private static final Set<String> EMBEDDING_PROVIDERS = Set.of("hashing", "onnx", "none");
    private static final Set<String> RERANK_PROVIDERS = Set.of("token-overlap", "onnx", "none");

    private Chunking chunking = new Chunking();
    private Pipeline pipeline = new Pipeline();
    private Scoring scoring = new Scoring();
    private Lexical lexical = new Lexical();
    private Embedding embedding = new Embedding();
    private Rerank rerank = new Rerank();
    private TokenizerSettings tokenizer = new TokenizerSettings();
    private Models models = new Models();
    private Data data = new Data();

    @PostConstruct
    public void validate() {
        chunking.params();
        chunking.strategy();
        final PipelineSettings settings = pipeline.settings();
        scoring.aggregationLaw();

        require(scoring.getBoostFactor() > 0 && Double.isFinite(scoring.getBoostFactor()),
                "passagesearch.scoring.boost-factor must be > 0");
        require(scoring.getChunksPerSearch() > 0, "passagesearch.scoring.chunks-per-search must be > 0");
        require(scoring.getContextWindow() >= 0, "passagesearch.scoring.context-window must be >= 0");
        require(scoring.getDefaultTopK() > 0, "passagesearch.scoring.default-top-k must be > 0");
        require(scoring.getTimeout() == null || !scoring.getTimeout().isNegative(),
                "passagesearch.scoring.timeout cannot be negative");
        require(embedding.getDimension() > 0, "passagesearch.embedding.dimension must be > 0");
        require(embedding.getBatchSize() > 0, "passagesearch.embedding.batch-size must be > 0");
        require(rerank.getParallelism() > 0, "passagesearch.rerank.parallelism must be > 0");
        require(tokenizer.getMinTokenLength() > 0, "passagesearch.tokenizer.min-token-length must be > 0");
        require(EMBEDDING_PROVIDERS.contains(embedding.getProvider()),
                "passagesearch.embedding.provider must be one of " + EMBEDDING_PROVIDERS);
        require(RERANK_PROVIDERS.contains(rerank.getProvider()),
                "passagesearch.rerank.provider must be one of " + RERANK_PROVIDERS);

        log.info("Search configuration: strategy={}, pipeline={}, aggregation={}, embedding={}, rerank={}",
                chunking.getStrategy(), settings, scoring.getAggregation(), embedding.getProvider(), rerank.getProvider());
    }

    private static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    @Getter @Setter
    public static class Chunking {
        private String strategy = "hybrid";
        private int chunkSize = 256;
        private int overlapSize = 32;
        private int minChunkSize = 50;
        private int overviewPreviewChars = 300;

        public ChunkingParams params() {
            return new ChunkingParams(chunkSize, overlapSize, minChunkSize, overviewPreviewChars);
        }

        public ChunkingStrategy strategy() {
            return ChunkingStrategy.fromName(strategy);
        }
    }

    /**
     * Stage switches, top-k cut-offs and fusion weights. A non-blank {@code preset}
     * ({@code fast}, {@code balanced}, {@code accurate}) replaces the individual values.
     */
    @Getter @Setter
    public static class Pipeline {
        private String preset;
        private boolean lexicalEnabled = true;
        private boolean denseEnabled = true;
        private boolean rerankEnabled = true;
        private int stage1TopK = 100;
        private int stage2TopK = 50;
        private int stage3TopK = 20;
        private double lexicalWeight = 0.3;
        private double denseWeight = 0.4;
        private double rerankWeight = 0.3;

        public PipelineSettings settings() {
            if (StringUtils.isNotBlank(preset)) {
                return PipelineSettings.preset(preset);
            }
            return PipelineSettings.builder()
                    .lexicalEnabled(lexicalEnabled)
                    .denseEnabled(denseEnabled)
                    .rerankEnabled(rerankEnabled)
                    .stage1TopK(stage1TopK)
                    .stage2TopK(stage2TopK)
                    .stage3TopK(stage3TopK)
                    .lexicalWeight(lexicalWeight)
                    .denseWeight(denseWeight)
                    .rerankWeight(rerankWeight)
                    .build();
        }
    }

    @Getter @Setter
    public static class Scoring {
        private double boostFactor = 1.2;
        private String aggregation = "max";
        private int chunksPerSearch = 50;
        private int contextWindow = 1;
        private int defaultTopK = 10;
        private Duration timeout;
        private boolean entityOverlapEnabled = false;
        private double entityOverlapWeight = 0.2;

        public AggregationLaw aggregationLaw() {
            return AggregationLaw.fromName(aggregation);
        }
    }

    @Getter @Setter
    public static class Lexical {
        private float k1 = 1.5f;
        private float b = 0.75f;
    }

    @Getter @Setter
    public static class Embedding {
        private String provider = "hashing";
        private int dimension = 384;
        private int batchSize = 32;
        private int maxLength = 512;
    }

    @Getter @Setter
    public static class Rerank {
        private String provider = "token-overlap";
        private int parallelism = 4;
    }

    @Getter @Setter
    public static class TokenizerSettings {
        public static final List<String> DEFAULT_STOPWORDS = List.of(
                "và", "của", "có", "cho", "với", "được", "từ", "trong",
                "là", "một", "các", "để", "theo", "này", "đó", "những",
                "nhưng", "hoặc", "nếu", "thì", "khi", "vì", "do", "bởi",
                "the", "a", "an", "and", "or", "but", "in", "on", "at",
                "to", "for", "of", "with", "by", "from", "as", "is", "was");

        private boolean useStopwords = true;
        private List<String> stopwords = new ArrayList<>(DEFAULT_STOPWORDS);
        private int minTokenLength = 2;
    }

    @Getter @Setter
    public static class Models {
        private Path root = Path.of("models");
        private int intraOpThreads = 0;

        public Path retriever() {
            return root.resolve("retriever");
        }

        public Path reranker() {
            return root.resolve("reranker");
        }
    }

    @Getter @Setter
    public static class Data {
        private Path path;
        private boolean indexOnStartup = false;
    }
}
