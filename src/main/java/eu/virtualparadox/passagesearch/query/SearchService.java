package eu.virtualparadox.passagesearch.query;

import eu.virtualparadox.passagesearch.application.config.SearchProperties;
import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.rag.aggregate.AggregationLaw;
import eu.virtualparadox.passagesearch.rag.aggregate.DocumentAggregator;
import eu.virtualparadox.passagesearch.rag.aggregate.DocumentResult;
import eu.virtualparadox.passagesearch.rag.context.ContextExpander;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshot;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshotHolder;
import eu.virtualparadox.passagesearch.rag.index.IndexStatistics;
import eu.virtualparadox.passagesearch.rag.pipeline.Deadline;
import eu.virtualparadox.passagesearch.rag.pipeline.PipelineResult;
import eu.virtualparadox.passagesearch.rag.pipeline.ScoredCandidate;
import eu.virtualparadox.passagesearch.rag.pipeline.StagePipeline;
import eu.virtualparadox.passagesearch.rag.pipeline.StageTrace;
import eu.virtualparadox.passagesearch.rag.tokenize.Tokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entry point for queries.
 * <p>
 * Acquires the current snapshot once, tokenizes the query, runs the {@link StagePipeline} and shapes
 * the result for the requested {@link SearchMode}. A query without usable tokens yields an empty
 * response; a query before the first index build raises
 * {@link eu.virtualparadox.passagesearch.rag.index.NotIndexedException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {

    private static final int PREVIEW_CHUNKS = 2;
    private static final int PREVIEW_CHARS = 200;

    private final IndexSnapshotHolder snapshotHolder;
    private final Tokenizer tokenizer;
    private final StagePipeline pipeline;
    private final DocumentAggregator aggregator;
    private final ContextExpander contextExpander;
    private final SearchProperties properties;

    public SearchResponse search(final String query, final SearchMode mode, final int topK) {
        return search(SearchRequest.of(query, mode, topK));
    }

    /**
     * Runs a search.
     *
     * @throws IllegalArgumentException for a blank query, a missing mode or a non-positive topK
     * @throws eu.virtualparadox.passagesearch.rag.index.NotIndexedException if no snapshot is published
     */
    public SearchResponse search(final SearchRequest request) {
        if (request == null || StringUtils.isBlank(request.query())) {
            throw new IllegalArgumentException("query cannot be blank");
        }
        if (request.mode() == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (request.topK() <= 0) {
            throw new IllegalArgumentException("topK must be > 0");
        }

        final IndexSnapshot snapshot = snapshotHolder.current();
        final String query = request.query();
        final List<String> queryTokens = tokenizer.tokenize(query);
        if (queryTokens.isEmpty()) {
            log.debug("Query '{}' has no usable tokens, returning empty result", query);
            return SearchResponse.empty(query, request.mode(), snapshot.version());
        }

        final Duration timeout = request.timeout() != null ? request.timeout() : properties.getScoring().getTimeout();
        final Deadline deadline = Deadline.after(timeout);

        final SearchResponse response = switch (request.mode()) {
            case CHUNK -> searchChunks(snapshot, query, queryTokens, request.topK(), deadline);
            case DOCUMENT -> searchDocuments(snapshot, request, queryTokens, deadline, false);
            case CONTEXT -> searchDocuments(snapshot, request, queryTokens, deadline, true);
        };

        printDebugTrace(response.trace());
        return response;
    }

    /**
     * @return statistics of the current snapshot
     * @throws eu.virtualparadox.passagesearch.rag.index.NotIndexedException if no snapshot is published
     */
    public IndexStatistics statistics() {
        return snapshotHolder.current().statistics();
    }

    private SearchResponse searchChunks(final IndexSnapshot snapshot,
                                        final String query,
                                        final List<String> queryTokens,
                                        final int topK,
                                        final Deadline deadline) {
        final PipelineResult result = pipeline.run(snapshot, query, queryTokens, topK, deadline);
        printDebugChunks(result.candidates());
        return new SearchResponse(query, SearchMode.CHUNK, result.candidates(), Collections.emptyList(),
                result.trace(), result.deadlineExceeded(), snapshot.version());
    }

    private SearchResponse searchDocuments(final IndexSnapshot snapshot,
                                           final SearchRequest request,
                                           final List<String> queryTokens,
                                           final Deadline deadline,
                                           final boolean withContext) {
        final int chunksPerSearch = properties.getScoring().getChunksPerSearch();
        final PipelineResult result = pipeline.run(snapshot, request.query(), queryTokens, chunksPerSearch, deadline);

        final AggregationLaw law = request.aggregation() == null
                ? aggregator.getDefaultLaw()
                : AggregationLaw.parseOrDefault(request.aggregation());
        final List<DocumentResult> documents = aggregator.aggregate(result.candidates(), request.topK(), law);

        final List<DocumentHit> hits = new ArrayList<>(documents.size());
        for (final DocumentResult document : documents) {
            if (withContext) {
                final List<Chunk> context = contextExpander.expand(snapshot, document.docId(), document.bestChunks());
                hits.add(toHit(snapshot, document.withContext(context), combine(context)));
            } else {
                hits.add(toHit(snapshot, document, ""));
            }
        }

        return new SearchResponse(request.query(), withContext ? SearchMode.CONTEXT : SearchMode.DOCUMENT,
                result.candidates(), hits, result.trace(), result.deadlineExceeded(), snapshot.version());
    }

    private DocumentHit toHit(final IndexSnapshot snapshot, final DocumentResult document, final String content) {
        return new DocumentHit(
                document.docId(),
                snapshot.filename(document.docId()),
                document.score(),
                snapshot.documentPositions(document.docId()).size(),
                document.bestChunks(),
                document.contextChunks(),
                preview(document.bestChunks()),
                content);
    }

    private static String preview(final List<ScoredCandidate> bestChunks) {
        final List<String> parts = new ArrayList<>();
        for (int i = 0; i < Math.min(PREVIEW_CHUNKS, bestChunks.size()); i++) {
            final Chunk chunk = bestChunks.get(i).chunk();
            final String content = chunk.content().length() > PREVIEW_CHARS
                    ? chunk.content().substring(0, PREVIEW_CHARS) + "..."
                    : chunk.content();
            parts.add(chunk.sectionTitle() != null ? "[" + chunk.sectionTitle() + "] " + content : content);
        }
        return String.join(" | ", parts);
    }

    private static String combine(final List<Chunk> context) {
        final List<String> parts = new ArrayList<>(context.size());
        for (final Chunk chunk : context) {
            parts.add(chunk.sectionTitle() != null
                    ? "## " + chunk.sectionTitle() + "\n" + chunk.content()
                    : chunk.content());
        }
        return String.join("\n\n", parts);
    }

    private void printDebugChunks(final List<ScoredCandidate> candidates) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final ScoredCandidate c : candidates) {
            sb.append(" - [").append(String.format("%.4f", c.score())).append("] ")
                    .append(c.chunkId()).append(": ")
                    .append(StringUtils.abbreviate(c.chunk().content(), 80)).append("\n");
        }
        log.debug("Ranked chunks:\n{}", sb);
    }

    private void printDebugTrace(final List<StageTrace> trace) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final StageTrace t : trace) {
            sb.append(" - ").append(t.stage().label()).append(": ").append(t.status())
                    .append(" ").append(t.candidatesIn()).append(" -> ").append(t.candidatesOut())
                    .append(" top ").append(t.topScores()).append("\n");
        }
        log.debug("Stage trace:\n{}", sb);
    }
}
