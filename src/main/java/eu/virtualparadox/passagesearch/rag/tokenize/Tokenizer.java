package eu.virtualparadox.passagesearch.rag.tokenize;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns text into an ordered sequence of normalized tokens.
 * <p>
 * Used for both the chunk corpus fed to the lexical scorer and the query before the lexical stage,
 * so both sides must go through the same implementation.
 */
public interface Tokenizer {

    /**
     * Tokenizes a text.
     *
     * @param text input text (may be null or blank)
     * @return ordered tokens; empty for blank or all-stopword input
     */
    List<String> tokenize(String text);

    /**
     * Tokenizes several texts in order.
     *
     * @param texts input texts
     * @return one token list per input text
     */
    default List<List<String>> tokenizeAll(final List<String> texts) {
        final List<List<String>> result = new ArrayList<>(texts.size());
        for (final String text : texts) {
            result.add(tokenize(text));
        }
        return result;
    }
}
