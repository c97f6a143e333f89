package eu.virtualparadox.passagesearch.rag.rerank;

import eu.virtualparadox.passagesearch.rag.tokenize.Tokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Set;

/**
 * Deterministic reranker that estimates relevance as the share of distinct query tokens
 * that also occur in the passage. Stands in for a cross-encoder when no model is configured.
 */
@Slf4j
public class TokenOverlapRerankProvider implements RerankProvider {

    private final Tokenizer tokenizer;

    public TokenOverlapRerankProvider(final Tokenizer tokenizer) {
        if (tokenizer == null) {
            throw new IllegalArgumentException("tokenizer cannot be null");
        }
        this.tokenizer = tokenizer;
        log.info("Using token-overlap reranker");
    }

    @Override
    public double score(final String query, final String chunkText) {
        final Set<String> queryTokens = new HashSet<>(tokenizer.tokenize(query));
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        final Set<String> passageTokens = new HashSet<>(tokenizer.tokenize(chunkText));
        final long overlap = queryTokens.stream().filter(passageTokens::contains).count();
        return (double) overlap / queryTokens.size();
    }
}
