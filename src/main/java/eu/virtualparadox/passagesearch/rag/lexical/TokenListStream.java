package eu.virtualparadox.passagesearch.rag.lexical;

import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.util.List;

/**
 * Feeds pre-tokenized terms into a Lucene field, bypassing analysis so the index holds
 * exactly the tokens produced by the external tokenizer.
 */
final class TokenListStream extends TokenStream {

    private final CharTermAttribute termAttribute = addAttribute(CharTermAttribute.class);
    private final List<String> tokens;
    private int next;

    TokenListStream(final List<String> tokens) {
        this.tokens = tokens;
    }

    @Override
    public boolean incrementToken() {
        if (next >= tokens.size()) {
            return false;
        }
        clearAttributes();
        termAttribute.setEmpty().append(tokens.get(next++));
        return true;
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        next = 0;
    }
}
