package eu.virtualparadox.passagesearch.rag.lexical;

import java.util.List;

/**
 * Builds {@link LexicalScorer}s from a tokenized corpus.
 */
public interface LexicalScorerProvider {

    /**
     * @param corpus one token list per chunk, in snapshot order
     * @return scorer whose results are aligned with {@code corpus}
     */
    LexicalScorer build(List<List<String>> corpus);
}
