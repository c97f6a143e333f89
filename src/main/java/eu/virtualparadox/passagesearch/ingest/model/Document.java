package eu.virtualparadox.passagesearch.ingest.model;

/**
 * Immutable source document as supplied by a {@code DocumentSource}.
 *
 * @param docId    numeric document identifier, unique within a corpus
 * @param filename original file name, used for display and overview chunks
 * @param content  full document text (may be empty)
 */
public record Document(int docId, String filename, String content) {

    public Document {
        if (filename == null) {
            filename = "";
        }
        if (content == null) {
            content = "";
        }
    }
}
