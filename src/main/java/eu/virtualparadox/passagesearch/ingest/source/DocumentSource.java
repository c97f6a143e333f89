package eu.virtualparadox.passagesearch.ingest.source;

import eu.virtualparadox.passagesearch.ingest.model.Document;

import java.util.List;

/**
 * Supplies the documents to index.
 */
public interface DocumentSource {

    /**
     * @return documents with unique ids
     * @throws IllegalStateException if the source cannot be read
     */
    List<Document> load();
}
