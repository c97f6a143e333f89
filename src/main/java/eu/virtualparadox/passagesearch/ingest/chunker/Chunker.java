package eu.virtualparadox.passagesearch.ingest.chunker;

import eu.virtualparadox.passagesearch.ingest.entity.EntityExtractor;
import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.ingest.model.ChunkType;
import eu.virtualparadox.passagesearch.ingest.model.Document;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structure-aware {@code Chunker} that turns one document into an ordered list of {@link Chunk}s.
 *
 * <h2>Strategies</h2>
 * <ul>
 *   <li><strong>{@link ChunkingStrategy#FIXED}:</strong> sliding window of {@code chunkSize} words with
 *       stride {@code chunkSize - overlapSize}. The last window may be shorter. A document of at most
 *       {@code chunkSize} words yields exactly one chunk.</li>
 *   <li><strong>{@link ChunkingStrategy#SECTION}:</strong> one chunk per markdown section; sections whose
 *       stripped content is shorter than {@code minChunkSize} characters are dropped. The hierarchy level
 *       is the heading depth.</li>
 *   <li><strong>{@link ChunkingStrategy#HIERARCHICAL}:</strong> an overview chunk (file name, headings and
 *       a bounded preview of the first paragraph) at level 0, then every section at level 1 followed by
 *       its paragraphs at level 2.</li>
 *   <li><strong>{@link ChunkingStrategy#HYBRID}:</strong> sections as in {@code SECTION}; a section with
 *       more than {@code chunkSize} words is split by the sliding window into sub-sections one level
 *       deeper.</li>
 * </ul>
 *
 * <h2>Identifiers &amp; offsets</h2>
 * Chunk ids are {@code {docId}_{strategy}_{ordinal(5 digits)}}; ordinals start at 0 and increase by one
 * per emitted chunk. Offsets are character offsets into the document content; chunk text is the
 * whitespace-stripped source span, except for the synthesized overview chunk.
 *
 * <h2>Entities</h2>
 * With an {@link EntityExtractor}, every chunk gets its extracted entities under {@link Chunk#ENTITIES}.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * This component is stateless after construction and thus thread-safe. For a given document and
 * strategy, output is deterministic.
 */
@Slf4j
public class Chunker {

    private static final String ELLIPSIS = "...";

    private final ChunkingParams params;
    private final EntityExtractor entityExtractor;

    public Chunker(final ChunkingParams params) {
        this(params, null);
    }

    /**
     * Constructs a {@code Chunker}. Parameter validation happens in {@link ChunkingParams}, so an
     * invalid overlap is rejected before any chunker exists.
     *
     * @param params          validated chunking parameters
     * @param entityExtractor extractor filling {@link Chunk#ENTITIES}, or {@code null} to skip extraction
     * @throws IllegalArgumentException if {@code params} is null
     */
    public Chunker(final ChunkingParams params, final EntityExtractor entityExtractor) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        this.params = params;
        this.entityExtractor = entityExtractor;
    }

    public ChunkingParams getParams() {
        return params;
    }

    /**
     * Splits a document into chunks.
     *
     * @param document document to split (non-null)
     * @param strategy chunking strategy (non-null)
     * @return ordered chunks, empty if the document content is blank
     * @throws IllegalArgumentException if inputs are null
     */
    public List<Chunk> chunk(final Document document, final ChunkingStrategy strategy) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (document.content().isBlank()) {
            return Collections.emptyList();
        }

        final List<Chunk> chunks = switch (strategy) {
            case FIXED -> fixedChunks(document);
            case SECTION -> sectionChunks(document);
            case HIERARCHICAL -> hierarchicalChunks(document);
            case HYBRID -> hybridChunks(document);
        };

        log.debug("Document {} ({}) split into {} {} chunks",
                document.docId(), document.filename(), chunks.size(), strategy.label());
        return chunks;
    }

    private List<Chunk> fixedChunks(final Document document) {
        final String text = document.content();
        final Emitter emitter = new Emitter(document, ChunkingStrategy.FIXED, entityExtractor);

        final List<WordSpan> words = WordSpan.scan(text, 0, text.length());
        final List<int[]> windows = windows(words.size());
        for (final int[] window : windows) {
            final int start = words.get(window[0]).start;
            final int end = words.get(window[1] - 1).end;

            final Map<String, Object> metadata = emitter.baseMetadata();
            metadata.put("word_start", window[0]);
            metadata.put("word_end", window[1]);
            metadata.put("total_chunks", windows.size());

            emitter.emit(text.substring(start, end), ChunkType.FIXED, 0, start, end, metadata);
        }
        return emitter.chunks;
    }

    private List<Chunk> sectionChunks(final Document document) {
        final String text = document.content();
        final Emitter emitter = new Emitter(document, ChunkingStrategy.SECTION, entityExtractor);

        final List<Section> sections = SectionParser.sections(text);
        for (final Section section : sections) {
            final int[] bounds = SectionParser.strip(text, section.startOffset(), section.endOffset());
            if (bounds == null || bounds[1] - bounds[0] < params.minChunkSize()) {
                continue;
            }
            final Map<String, Object> metadata = sectionMetadata(emitter, section);
            metadata.put("total_sections", sections.size());

            emitter.emit(text.substring(bounds[0], bounds[1]), ChunkType.SECTION, section.level(),
                    bounds[0], bounds[1], metadata);
        }
        return emitter.chunks;
    }

    private List<Chunk> hierarchicalChunks(final Document document) {
        final String text = document.content();
        final Emitter emitter = new Emitter(document, ChunkingStrategy.HIERARCHICAL, entityExtractor);

        final String overview = buildOverview(document);
        emitter.emit(overview, ChunkType.OVERVIEW, 0, 0, text.length(), emitter.baseMetadata());

        for (final Section section : SectionParser.sections(text)) {
            final int[] bounds = SectionParser.strip(text, section.startOffset(), section.endOffset());
            if (bounds == null) {
                continue;
            }
            emitter.emit(text.substring(bounds[0], bounds[1]), ChunkType.SECTION, 1,
                    bounds[0], bounds[1], sectionMetadata(emitter, section));

            final List<int[]> paragraphs = SectionParser.paragraphs(text, bounds[0], bounds[1]);
            for (int i = 0; i < paragraphs.size(); i++) {
                final int[] paragraph = paragraphs.get(i);
                final String content = text.substring(paragraph[0], paragraph[1]);
                if (content.length() < params.minChunkSize() || isHeadingOnly(content)) {
                    continue;
                }
                final Map<String, Object> metadata = emitter.baseMetadata();
                metadata.put("parent_section", section.title());
                metadata.put("paragraph_index", i);

                emitter.emit(content, ChunkType.PARAGRAPH, 2, paragraph[0], paragraph[1], metadata);
            }
        }
        return emitter.chunks;
    }

    private List<Chunk> hybridChunks(final Document document) {
        final String text = document.content();
        final Emitter emitter = new Emitter(document, ChunkingStrategy.HYBRID, entityExtractor);

        for (final Section section : SectionParser.sections(text)) {
            final int[] bounds = SectionParser.strip(text, section.startOffset(), section.endOffset());
            if (bounds == null || bounds[1] - bounds[0] < params.minChunkSize()) {
                continue;
            }

            final List<WordSpan> words = WordSpan.scan(text, bounds[0], bounds[1]);
            if (words.size() <= params.chunkSize()) {
                emitter.emit(text.substring(bounds[0], bounds[1]), ChunkType.SECTION, section.level(),
                        bounds[0], bounds[1], sectionMetadata(emitter, section));
                continue;
            }

            // Oversized section: slide the fixed window over the section's own words.
            final List<int[]> windows = windows(words.size());
            for (int i = 0; i < windows.size(); i++) {
                final int[] window = windows.get(i);
                final int start = words.get(window[0]).start;
                final int end = words.get(window[1] - 1).end;

                final Map<String, Object> metadata = sectionMetadata(emitter, section);
                metadata.put("sub_chunk_index", i);
                metadata.put("total_sub_chunks", windows.size());

                emitter.emit(text.substring(start, end), ChunkType.SUB_SECTION, section.level() + 1,
                        start, end, metadata);
            }
        }
        return emitter.chunks;
    }

    /**
     * Computes sliding windows over {@code wordCount} words as half-open word index ranges.
     * Terminates because the stride is positive by construction of {@link ChunkingParams}.
     */
    List<int[]> windows(final int wordCount) {
        final List<int[]> windows = new ArrayList<>();
        if (wordCount == 0) {
            return windows;
        }
        if (wordCount <= params.chunkSize()) {
            windows.add(new int[]{0, wordCount});
            return windows;
        }

        int start = 0;
        while (start < wordCount) {
            final int end = Math.min(start + params.chunkSize(), wordCount);
            windows.add(new int[]{start, end});
            if (end >= wordCount) {
                break;
            }
            start += params.stride();
        }
        return windows;
    }

    /**
     * Builds the overview text:
     * <pre>
     *     Document: {filename}
     *
     *     Structure:
     *     # heading lines ...
     *
     *     Content Preview:
     *     first paragraph (bounded)
     * </pre>
     */
    private String buildOverview(final Document document) {
        final List<String> parts = new ArrayList<>();
        parts.add("Document: " + document.filename());

        final List<String> headings = new ArrayList<>();
        final List<String> firstParagraph = new ArrayList<>();
        boolean inFirstParagraph = false;
        boolean firstParagraphDone = false;

        for (final String rawLine : document.content().split("\n")) {
            final String line = rawLine.strip();
            if (SectionParser.isHeadingLine(rawLine)) {
                headings.add(line);
                if (inFirstParagraph) {
                    firstParagraphDone = true;
                    inFirstParagraph = false;
                }
            } else if (line.isEmpty()) {
                if (inFirstParagraph) {
                    firstParagraphDone = true;
                    inFirstParagraph = false;
                }
            } else if (!firstParagraphDone) {
                inFirstParagraph = true;
                firstParagraph.add(line);
            }
        }

        if (!headings.isEmpty()) {
            parts.add("Structure:\n" + String.join("\n", headings));
        }
        if (!firstParagraph.isEmpty()) {
            String preview = String.join(" ", firstParagraph);
            if (preview.length() > params.overviewPreviewChars()) {
                preview = preview.substring(0, params.overviewPreviewChars()) + ELLIPSIS;
            }
            parts.add("Content Preview:\n" + preview);
        }
        return String.join("\n\n", parts);
    }

    private static Map<String, Object> sectionMetadata(final Emitter emitter, final Section section) {
        final Map<String, Object> metadata = emitter.baseMetadata();
        if (section.hasTitle()) {
            metadata.put(Chunk.SECTION_TITLE, section.title());
        }
        metadata.put("section_level", section.level());
        return metadata;
    }

    private static boolean isHeadingOnly(final String paragraph) {
        for (final String line : paragraph.split("\n")) {
            if (!line.isBlank() && !SectionParser.isHeadingLine(line)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Assigns ordinals and ids to chunks of one document in emission order.
     */
    private static final class Emitter {

        private final Document document;
        private final ChunkingStrategy strategy;
        private final EntityExtractor entityExtractor;
        private final List<Chunk> chunks = new ArrayList<>();

        private Emitter(final Document document, final ChunkingStrategy strategy,
                        final EntityExtractor entityExtractor) {
            this.document = document;
            this.strategy = strategy;
            this.entityExtractor = entityExtractor;
        }

        private Map<String, Object> baseMetadata() {
            final Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(Chunk.FILE_NAME, document.filename());
            metadata.put(Chunk.CHUNK_STRATEGY, strategy.label());
            return metadata;
        }

        private void emit(final String content,
                          final ChunkType type,
                          final int level,
                          final int start,
                          final int end,
                          final Map<String, Object> metadata) {
            if (entityExtractor != null) {
                final Map<String, List<String>> entities = entityExtractor.extract(content);
                if (!entities.isEmpty()) {
                    metadata.put(Chunk.ENTITIES, entities);
                }
            }
            final int ordinal = chunks.size();
            chunks.add(new Chunk(buildChunkId(document.docId(), strategy, ordinal), document.docId(), ordinal,
                    content, type, level, start, end, metadata));
        }

        private static String buildChunkId(final int docId, final ChunkingStrategy strategy, final int ordinal) {
            return docId + "_" + strategy.label() + "_" + String.format(Locale.ROOT, "%05d", ordinal);
        }
    }
}
