package eu.virtualparadox.passagesearch.rag.tokenize;

import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * {@link Tokenizer} backed by a Lucene analysis chain:
 * <pre>
 *     NFC normalization → StandardTokenizer → LowerCaseFilter → StopFilter → LengthFilter(min..)
 * </pre>
 * StandardTokenizer follows Unicode word-break rules, so underscore-joined compounds
 * (e.g. {@code lịch_sử}) survive as single tokens.
 * <p>The analyzer reuses token stream components per thread, so one instance can serve
 * concurrent callers.</p>
 */
@Slf4j
public final class LuceneTokenizer implements Tokenizer, AutoCloseable {

    private static final String FIELD = "text";

    private final Analyzer analyzer;

    /**
     * @param stopwords      words removed after lowercasing; empty disables stopword filtering
     * @param minTokenLength tokens shorter than this are dropped (must be {@code >= 1})
     */
    public LuceneTokenizer(final Collection<String> stopwords, final int minTokenLength) {
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("minTokenLength must be >= 1");
        }
        final CharArraySet stopSet = stopwords == null || stopwords.isEmpty()
                ? CharArraySet.EMPTY_SET
                : CharArraySet.unmodifiableSet(new CharArraySet(stopwords, true));

        this.analyzer = new Analyzer() {
            @Override
            protected TokenStreamComponents createComponents(final String fieldName) {
                final StandardTokenizer source = new StandardTokenizer();
                TokenStream stream = new LowerCaseFilter(source);
                stream = new StopFilter(stream, stopSet);
                stream = new LengthFilter(stream, minTokenLength, Integer.MAX_VALUE);
                return new TokenStreamComponents(source, stream);
            }
        };
        log.info("Lucene tokenizer ready ({} stopwords, min token length {})", stopSet.size(), minTokenLength);
    }

    @Override
    public List<String> tokenize(final String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        final String normalized = Normalizer.normalize(text, Normalizer.Form.NFC);
        final List<String> tokens = new ArrayList<>();
        try (TokenStream stream = analyzer.tokenStream(FIELD, normalized)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to tokenize text", e);
        }
        return tokens;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
