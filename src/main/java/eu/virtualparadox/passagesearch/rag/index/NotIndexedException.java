package eu.virtualparadox.passagesearch.rag.index;

/**
 * Thrown when a query arrives before any index snapshot has been published.
 */
public class NotIndexedException extends IllegalStateException {

    public NotIndexedException() {
        super("No index has been built yet");
    }
}
