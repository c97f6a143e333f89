package eu.virtualparadox.passagesearch.rag.lexical;

import eu.virtualparadox.passagesearch.util.LuceneConstants;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.NoMergePolicy;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;

import java.io.IOException;
import java.util.List;

/**
 * BM25 {@link LexicalScorerProvider} on an in-memory Lucene index.
 * <p>
 * Each chunk becomes one Lucene document holding its pre-tokenized terms and its corpus position.
 * A query is a disjunction of term queries, so every query token (duplicates included) adds its
 * BM25 contribution, and chunks without any matching term score 0.
 */
@Slf4j
public class LuceneBm25ScorerProvider implements LexicalScorerProvider {

    private final float k1;
    private final float b;

    public LuceneBm25ScorerProvider(final float k1, final float b) {
        if (k1 < 0 || !Float.isFinite(k1)) {
            throw new IllegalArgumentException("BM25 k1 must be a finite value >= 0");
        }
        if (b < 0 || b > 1) {
            throw new IllegalArgumentException("BM25 b must be in [0, 1]");
        }
        this.k1 = k1;
        this.b = b;
    }

    @Override
    public LexicalScorer build(final List<List<String>> corpus) {
        if (corpus == null) {
            throw new IllegalArgumentException("corpus cannot be null");
        }
        final BM25Similarity similarity = new BM25Similarity(k1, b);
        final ByteBuffersDirectory directory = new ByteBuffersDirectory();

        final IndexWriterConfig config = new IndexWriterConfig()
                .setSimilarity(similarity)
                .setMergePolicy(NoMergePolicy.INSTANCE)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE);

        try (IndexWriter writer = new IndexWriter(directory, config)) {
            for (int position = 0; position < corpus.size(); position++) {
                final Document doc = new Document();
                doc.add(new StoredField(LuceneConstants.FIELD_POSITION, position));
                doc.add(new TextField(LuceneConstants.FIELD_TOKENS, new TokenListStream(corpus.get(position))));
                writer.addDocument(doc);
            }
            writer.commit();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to build BM25 index", e);
        }

        try {
            final DirectoryReader reader = DirectoryReader.open(directory);
            final IndexSearcher searcher = new IndexSearcher(reader);
            searcher.setSimilarity(similarity);

            final int[] positions = new int[reader.maxDoc()];
            final StoredFields storedFields = reader.storedFields();
            for (int docId = 0; docId < positions.length; docId++) {
                positions[docId] = storedFields.document(docId)
                        .getField(LuceneConstants.FIELD_POSITION)
                        .numericValue()
                        .intValue();
            }

            log.info("BM25 index built over {} chunks (k1={}, b={})", corpus.size(), k1, b);
            return new Bm25Scorer(searcher, positions, corpus.size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to open BM25 index", e);
        }
    }

    private static final class Bm25Scorer implements LexicalScorer {

        private final IndexSearcher searcher;
        private final int[] positions;
        private final int size;

        private Bm25Scorer(final IndexSearcher searcher, final int[] positions, final int size) {
            this.searcher = searcher;
            this.positions = positions;
            this.size = size;
        }

        @Override
        public double[] score(final List<String> queryTokens) {
            final double[] scores = new double[size];
            if (queryTokens == null || queryTokens.isEmpty() || size == 0) {
                return scores;
            }

            final int maxClauses = IndexSearcher.getMaxClauseCount();
            final List<String> tokens = queryTokens.size() > maxClauses
                    ? queryTokens.subList(0, maxClauses)
                    : queryTokens;
            if (tokens.size() < queryTokens.size()) {
                log.warn("Query has {} tokens, only the first {} are scored", queryTokens.size(), maxClauses);
            }

            final BooleanQuery.Builder query = new BooleanQuery.Builder();
            for (final String token : tokens) {
                query.add(new TermQuery(new Term(LuceneConstants.FIELD_TOKENS, token)), BooleanClause.Occur.SHOULD);
            }

            try {
                final TopDocs top = searcher.search(query.build(), size);
                for (final ScoreDoc hit : top.scoreDocs) {
                    scores[positions[hit.doc]] = hit.score;
                }
                return scores;
            } catch (IOException e) {
                throw new IllegalStateException("BM25 search failed", e);
            }
        }

        @Override
        public int size() {
            return size;
        }
    }
}
