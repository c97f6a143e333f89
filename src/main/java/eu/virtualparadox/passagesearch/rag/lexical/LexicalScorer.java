package eu.virtualparadox.passagesearch.rag.lexical;

import java.util.List;

/**
 * Read-only lexical scorer over a fixed corpus of token lists.
 * Implementations must be safe for concurrent use.
 */
public interface LexicalScorer {

    /**
     * Scores every corpus entry against the query tokens.
     *
     * @param queryTokens tokenized query
     * @return one score per corpus entry, aligned with the corpus order; higher is better
     */
    double[] score(List<String> queryTokens);

    /**
     * @return number of corpus entries
     */
    int size();
}
