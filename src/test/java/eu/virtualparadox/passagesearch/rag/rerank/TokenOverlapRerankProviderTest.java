package eu.virtualparadox.passagesearch.rag.rerank;

import eu.virtualparadox.passagesearch.rag.tokenize.LuceneTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenOverlapRerankProviderTest {

    private final RerankProvider reranker = new TokenOverlapRerankProvider(new LuceneTokenizer(List.of("the"), 2));

    @Test
    @DisplayName("Score is the share of distinct query tokens found in the passage")
    void overlapShare() {
        assertEquals(2.0 / 3, reranker.score("lucene bm25 scoring", "Scoring with Lucene"), 1e-12);
        assertEquals(1.0, reranker.score("lucene lucene", "lucene index"), 1e-12);
        assertEquals(0.0, reranker.score("vectors", "lucene index"), 1e-12);
    }

    @Test
    @DisplayName("Query without tokens scores zero")
    void emptyQuery() {
        assertEquals(0.0, reranker.score("the", "the lucene index"), 1e-12);
    }
}
