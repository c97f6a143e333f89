package eu.virtualparadox.passagesearch.ingest.lifecycle;

import eu.virtualparadox.passagesearch.application.config.SearchProperties;
import eu.virtualparadox.passagesearch.ingest.chunker.Chunker;
import eu.virtualparadox.passagesearch.ingest.chunker.ChunkingStrategy;
import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.ingest.model.Document;
import eu.virtualparadox.passagesearch.ingest.source.DocumentSource;
import eu.virtualparadox.passagesearch.rag.index.IndexBuilder;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshot;
import eu.virtualparadox.passagesearch.rag.index.IndexSnapshotHolder;
import eu.virtualparadox.passagesearch.rag.tokenize.Tokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Manages the index lifecycle:
 * <ol>
 *   <li>load documents from the {@link DocumentSource}</li>
 *   <li>chunk them with the configured strategy</li>
 *   <li>tokenize chunks for the lexical scorer</li>
 *   <li>build a new snapshot and publish it</li>
 * </ol>
 * Rebuilds are serialized; queries keep reading the previous snapshot until the new one is published.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexLifecycleManager {

    private final Chunker chunker;
    private final Tokenizer tokenizer;
    private final IndexBuilder indexBuilder;
    private final IndexSnapshotHolder snapshotHolder;
    private final ObjectProvider<DocumentSource> documentSource;
    private final SearchProperties properties;

    /**
     * Indexes the configured document source once the application is up, if enabled.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void indexOnStartup() {
        if (!properties.getData().isIndexOnStartup()) {
            return;
        }
        try {
            rebuild();
        } catch (RuntimeException e) {
            log.error("Startup indexing failed, queries will be rejected until a rebuild succeeds", e);
        }
    }

    /**
     * Rebuilds the index from the configured document source.
     *
     * @throws IllegalStateException if no document source is configured or it cannot be read
     */
    public IndexSnapshot rebuild() {
        final DocumentSource source = documentSource.getIfAvailable();
        if (source == null) {
            throw new IllegalStateException("No document source configured (set passagesearch.data.path)");
        }
        return rebuild(source.load());
    }

    /**
     * Rebuilds the index from the given documents and publishes it.
     *
     * @param documents documents with unique ids
     * @return the published snapshot
     * @throws IllegalArgumentException on duplicate document ids
     */
    public synchronized IndexSnapshot rebuild(final List<Document> documents) {
        if (documents == null) {
            throw new IllegalArgumentException("documents cannot be null");
        }
        final ChunkingStrategy strategy = properties.getChunking().strategy();
        final long started = System.currentTimeMillis();

        final Set<Integer> docIds = new HashSet<>();
        final List<Chunk> chunks = new ArrayList<>();
        final Map<String, Integer> chunkToDoc = new HashMap<>();
        for (final Document document : documents) {
            if (!docIds.add(document.docId())) {
                throw new IllegalArgumentException("Duplicate document id: " + document.docId());
            }
            for (final Chunk chunk : chunker.chunk(document, strategy)) {
                chunks.add(chunk);
                chunkToDoc.put(chunk.chunkId(), document.docId());
            }
        }
        log.info("Chunked {} documents into {} chunks ({})", documents.size(), chunks.size(), strategy.label());

        final List<List<String>> tokenized = new ArrayList<>(chunks.size());
        for (final Chunk chunk : chunks) {
            tokenized.add(tokenizer.tokenize(chunk.content()));
        }

        final IndexSnapshot snapshot = indexBuilder.build(chunks, tokenized, chunkToDoc, documents);
        snapshotHolder.publish(snapshot);

        log.info("Rebuild finished in {} ms", System.currentTimeMillis() - started);
        return snapshot;
    }
}
