package eu.virtualparadox.passagesearch.application.config;

import eu.virtualparadox.passagesearch.ingest.entity.EntityExtractor;
import eu.virtualparadox.passagesearch.ingest.entity.PatternEntityExtractor;
import eu.virtualparadox.passagesearch.ingest.lifecycle.IndexLifecycleManager;
import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.ingest.model.Document;
import eu.virtualparadox.passagesearch.ingest.source.DocumentSource;
import eu.virtualparadox.passagesearch.ingest.source.JsonDocumentSource;
import eu.virtualparadox.passagesearch.query.SearchMode;
import eu.virtualparadox.passagesearch.query.SearchResponse;
import eu.virtualparadox.passagesearch.query.SearchService;
import eu.virtualparadox.passagesearch.rag.aggregate.AggregationLaw;
import eu.virtualparadox.passagesearch.rag.aggregate.DocumentAggregator;
import eu.virtualparadox.passagesearch.rag.embed.EmbeddingProvider;
import eu.virtualparadox.passagesearch.rag.embed.HashingEmbeddingProvider;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshot;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshotHolder;
import eu.virtualparadox.passagesearch.rag.pipeline.PipelineSettings;
import eu.virtualparadox.passagesearch.rag.pipeline.Stage;
import eu.virtualparadox.passagesearch.rag.pipeline.StagePipeline;
import eu.virtualparadox.passagesearch.rag.pipeline.StageStatus;
import eu.virtualparadox.passagesearch.rag.rerank.RerankProvider;
import eu.virtualparadox.passagesearch.rag.rerank.TokenOverlapRerankProvider;
import eu.virtualparadox.passagesearch.rag.scoring.EntityOverlapExtension;
import eu.virtualparadox.passagesearch.rag.scoring.ScoringExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RetrievalConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(SearchProperties.class, ExecutorConfig.class, RetrievalConfig.class,
                    IndexSnapshotHolder.class, IndexLifecycleManager.class, SearchService.class);

    @TempDir
    Path tempDir;

    @Test
    void usesLocalProvidersByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(HashingEmbeddingProvider.class);
            assertThat(context).getBean(RerankProvider.class).isInstanceOf(TokenOverlapRerankProvider.class);
            assertThat(context).doesNotHaveBean(DocumentSource.class);
            assertThat(context).doesNotHaveBean(ScoringExtension.class);
            assertThat(context).doesNotHaveBean(EntityExtractor.class);
            assertThat(context).hasSingleBean(SearchService.class);

            assertThat(context.getBean(StagePipeline.class).getSettings()).isEqualTo(PipelineSettings.defaults());
            assertThat(context.getBean(DocumentAggregator.class).getDefaultLaw()).isEqualTo(AggregationLaw.MAX);
            assertThat(context.getBean(IndexSnapshotHolder.class).isIndexed()).isFalse();
        });
    }

    @Test
    void degradesWhenProvidersAreDisabled() throws IOException {
        Path documents = tempDir.resolve("documents.json");
        Files.writeString(documents, """
                [
                  {"file_name": "lucene.md", "content": "# Lucene\\n\\nLucene computes BM25 scores for every chunk of text."},
                  {"file_name": "vectors.md", "content": "# Vectors\\n\\nDense vectors capture meaning beyond shared words."}
                ]
                """);

        contextRunner
                .withPropertyValues(
                        "passagesearch.embedding.provider=none",
                        "passagesearch.rerank.provider=none",
                        "passagesearch.chunking.min-chunk-size=10",
                        "passagesearch.data.path=" + documents)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).doesNotHaveBean(EmbeddingProvider.class);
                    assertThat(context).doesNotHaveBean(RerankProvider.class);
                    assertThat(context).getBean(DocumentSource.class).isInstanceOf(JsonDocumentSource.class);

                    context.getBean(IndexLifecycleManager.class).rebuild();
                    SearchResponse response = context.getBean(SearchService.class)
                            .search("bm25 scores", SearchMode.CHUNK, 1);

                    assertThat(response.chunks()).hasSize(1);
                    assertThat(response.chunks().get(0).docId()).isEqualTo(0);
                    assertThat(response.trace().get(0).status()).isEqualTo(StageStatus.EXECUTED);
                    assertThat(response.trace().get(1).status()).isEqualTo(StageStatus.UNAVAILABLE);
                    assertThat(response.trace().get(2).status()).isEqualTo(StageStatus.UNAVAILABLE);
                    assertThat(response.chunks().get(0).breakdown().weights()).containsOnlyKeys(Stage.LEXICAL);
                });
    }

    @Test
    void appliesPipelinePreset() {
        contextRunner
                .withPropertyValues("passagesearch.pipeline.preset=balanced", "passagesearch.scoring.aggregation=mean")
                .run(context -> {
                    assertThat(context.getBean(StagePipeline.class).getSettings())
                            .isEqualTo(PipelineSettings.preset("balanced"));
                    assertThat(context.getBean(DocumentAggregator.class).getDefaultLaw())
                            .isEqualTo(AggregationLaw.MEAN);
                });
    }

    @Test
    void registersEntityOverlapExtensionWhenEnabled() {
        contextRunner
                .withPropertyValues("passagesearch.scoring.entity-overlap-enabled=true",
                        "passagesearch.chunking.min-chunk-size=10")
                .run(context -> {
                    assertThat(context).getBean(ScoringExtension.class).isInstanceOf(EntityOverlapExtension.class);
                    assertThat(context).getBean(EntityExtractor.class).isInstanceOf(PatternEntityExtractor.class);

                    IndexSnapshot snapshot = context.getBean(IndexLifecycleManager.class).rebuild(List.of(
                            new Document(0, "paris.md", "# History\n\nIn 1783 the treaty of Paris ended the war.")));
                    assertThat(snapshot.chunk(0).metadata().get(Chunk.ENTITIES))
                            .isEqualTo(Map.of(PatternEntityExtractor.NAMES, List.of("Paris"),
                                    PatternEntityExtractor.YEARS, List.of("1783")));
                });
    }

    @Test
    void failsOnInvalidConfiguration() {
        contextRunner
                .withPropertyValues("passagesearch.chunking.overlap-size=256")
                .run(context -> assertThat(context).hasFailed());
        contextRunner
                .withPropertyValues("passagesearch.scoring.aggregation=median")
                .run(context -> assertThat(context).hasFailed());
        contextRunner
                .withPropertyValues("passagesearch.embedding.provider=magic")
                .run(context -> assertThat(context).hasFailed());
        contextRunner
                .withPropertyValues("passagesearch.pipeline.stage1-top-k=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
