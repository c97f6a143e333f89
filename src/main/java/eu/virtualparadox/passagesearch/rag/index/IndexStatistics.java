package eu.virtualparadox.passagesearch.rag.index;

import eu.virtualparadox.passagesearch.ingest.model.Chunk;
import eu.virtualparadox.passagesearch.ingest.model.ChunkType;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Descriptive statistics of an index snapshot.
 *
 * @param totalChunks          number of chunks
 * @param totalDocuments       number of distinct documents with at least one chunk
 * @param avgChunkLength       average chunk length in characters
 * @param avgChunksPerDocument average number of chunks per document
 * @param chunkTypes           chunk count per type
 * @param hierarchyLevels      chunk count per hierarchy level, ascending
 * @param minWords             smallest chunk word count
 * @param maxWords             largest chunk word count
 * @param avgWords             mean chunk word count
 * @param medianWords          median chunk word count
 */
public record IndexStatistics(int totalChunks,
                              int totalDocuments,
                              double avgChunkLength,
                              double avgChunksPerDocument,
                              Map<ChunkType, Integer> chunkTypes,
                              Map<Integer, Integer> hierarchyLevels,
                              int minWords,
                              int maxWords,
                              double avgWords,
                              double medianWords) {

    public IndexStatistics {
        final Map<ChunkType, Integer> types = new EnumMap<>(ChunkType.class);
        types.putAll(chunkTypes);
        chunkTypes = Collections.unmodifiableMap(types);
        hierarchyLevels = Collections.unmodifiableMap(new TreeMap<>(hierarchyLevels));
    }

    public static IndexStatistics of(final List<Chunk> chunks, final int totalDocuments) {
        if (chunks.isEmpty()) {
            return new IndexStatistics(0, totalDocuments, 0.0, 0.0,
                    new EnumMap<>(ChunkType.class), new TreeMap<>(), 0, 0, 0.0, 0.0);
        }

        final Map<ChunkType, Integer> types = new EnumMap<>(ChunkType.class);
        final Map<Integer, Integer> levels = new TreeMap<>();
        final int[] words = new int[chunks.size()];
        long totalLength = 0;
        long totalWords = 0;

        for (int i = 0; i < chunks.size(); i++) {
            final Chunk chunk = chunks.get(i);
            types.merge(chunk.chunkType(), 1, Integer::sum);
            levels.merge(chunk.hierarchyLevel(), 1, Integer::sum);
            totalLength += chunk.content().length();
            words[i] = chunk.wordCount();
            totalWords += words[i];
        }

        Arrays.sort(words);
        final int n = words.length;
        final double median = n % 2 == 1 ? words[n / 2] : (words[n / 2 - 1] + words[n / 2]) / 2.0;

        return new IndexStatistics(
                n,
                totalDocuments,
                (double) totalLength / n,
                totalDocuments == 0 ? 0.0 : (double) n / totalDocuments,
                types,
                levels,
                words[0],
                words[n - 1],
                (double) totalWords / n,
                median);
    }
}
