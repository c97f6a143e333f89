package eu.virtualparadox.passagesearch.rag.index;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.ingest.model.Document;
import eu.virtualparadox.passagesearch.rag.lexical.LexicalScorer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable, query-ready view of an indexed corpus.
 * <p>
 * Holds the chunk list (positions are indexes into it), chunk-to-document lookups, the per-document
 * chunk sequence in document order, and the optional lexical scorer and embedding matrix. A missing
 * signal means it failed or was not configured at build time; the pipeline then degrades that stage.
 * <p>
 * Instances are only created by {@link IndexBuilder} and never change afterwards, so any number of
 * queries may read one concurrently.
 */
public final class IndexSnapshot {

    private final long version;
    private final Instant builtAt;
    private final List<Chunk> chunks;
    private final Map<String, Integer> positionsById;
    private final Map<String, Integer> chunkToDoc;
    private final Map<Integer, List<Integer>> positionsByDoc;
    private final Map<Integer, Document> documents;
    private final LexicalScorer lexicalScorer;
    private final float[][] embeddings;
    private final IndexStatistics statistics;

    IndexSnapshot(final long version,
                  final Instant builtAt,
                  final List<Chunk> chunks,
                  final Map<String, Integer> chunkToDoc,
                  final List<Document> documents,
                  final LexicalScorer lexicalScorer,
                  final float[][] embeddings) {
        this.version = version;
        this.builtAt = builtAt;
        this.chunks = List.copyOf(chunks);
        this.chunkToDoc = Collections.unmodifiableMap(new HashMap<>(chunkToDoc));
        this.lexicalScorer = lexicalScorer;
        this.embeddings = embeddings;

        final Map<String, Integer> byId = new HashMap<>();
        final Map<Integer, List<Integer>> byDoc = new LinkedHashMap<>();
        for (int position = 0; position < this.chunks.size(); position++) {
            final Chunk chunk = this.chunks.get(position);
            byId.put(chunk.chunkId(), position);
            byDoc.computeIfAbsent(chunk.parentDocId(), k -> new ArrayList<>()).add(position);
        }
        final Map<Integer, List<Integer>> frozen = new LinkedHashMap<>();
        byDoc.forEach((docId, positions) -> {
            positions.sort((a, b) -> Integer.compare(this.chunks.get(a).ordinalIndex(), this.chunks.get(b).ordinalIndex()));
            frozen.put(docId, List.copyOf(positions));
        });
        this.positionsById = Collections.unmodifiableMap(byId);
        this.positionsByDoc = Collections.unmodifiableMap(frozen);

        final Map<Integer, Document> docs = new LinkedHashMap<>();
        for (final Document document : documents) {
            docs.put(document.docId(), document);
        }
        this.documents = Collections.unmodifiableMap(docs);
        this.statistics = IndexStatistics.of(this.chunks, frozen.size());
    }

    public long version() {
        return version;
    }

    public Instant builtAt() {
        return builtAt;
    }

    public int size() {
        return chunks.size();
    }

    public List<Chunk> chunks() {
        return chunks;
    }

    public Chunk chunk(final int position) {
        return chunks.get(position);
    }

    public OptionalInt positionOf(final String chunkId) {
        final Integer position = positionsById.get(chunkId);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    /**
     * @return parent document id of a chunk, or {@code null} when the chunk is unknown
     */
    public Integer documentOf(final String chunkId) {
        return chunkToDoc.get(chunkId);
    }

    /**
     * Positions of a document's chunks in document order.
     */
    public List<Integer> documentPositions(final int docId) {
        return positionsByDoc.getOrDefault(docId, Collections.emptyList());
    }

    public Optional<Document> document(final int docId) {
        return Optional.ofNullable(documents.get(docId));
    }

    /**
     * @return file name of a document, falling back to the first chunk's file name metadata
     */
    public String filename(final int docId) {
        final Document document = documents.get(docId);
        if (document != null) {
            return document.filename();
        }
        final List<Integer> positions = documentPositions(docId);
        if (positions.isEmpty()) {
            return "";
        }
        return Objects.toString(chunks.get(positions.get(0)).metadata().get(Chunk.FILE_NAME), "");
    }

    public boolean hasLexicalScorer() {
        return lexicalScorer != null;
    }

    public LexicalScorer lexicalScorer() {
        return lexicalScorer;
    }

    public boolean hasEmbeddings() {
        return embeddings != null;
    }

    /**
     * Copies the embedding rows of the given positions.
     *
     * @throws IllegalStateException if the snapshot has no embeddings
     */
    public float[][] embeddingRows(final List<Integer> positions) {
        if (embeddings == null) {
            throw new IllegalStateException("Snapshot has no embeddings");
        }
        final float[][] rows = new float[positions.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = embeddings[positions.get(i)].clone();
        }
        return rows;
    }

    /**
     * Finds chunks whose metadata value under {@code key} equals {@code value}.
     *
     * @return matching chunks in snapshot order
     */
    public List<Chunk> findChunksByMetadata(final String key, final Object value) {
        final List<Chunk> result = new ArrayList<>();
        for (final Chunk chunk : chunks) {
            if (chunk.metadata().containsKey(key) && Objects.equals(chunk.metadata().get(key), value)) {
                result.add(chunk);
            }
        }
        return result;
    }

    public IndexStatistics statistics() {
        return statistics;
    }
}
