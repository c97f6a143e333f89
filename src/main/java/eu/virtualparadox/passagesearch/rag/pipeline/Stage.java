package eu.virtualparadox.passagesearch.rag.pipeline;

/**
 * Retrieval stages, in execution order.
 */
public enum Stage {

    LEXICAL("lexical"),
    DENSE("dense"),
    RERANK("rerank");

    private final String label;

    Stage(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
