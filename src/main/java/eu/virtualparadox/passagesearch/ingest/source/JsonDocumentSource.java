package eu.virtualparadox.passagesearch.ingest.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.passagesearch.ingest.model.Document;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads documents from a JSON array:
 * <pre>
 * [
 *   {"file_name": "a.md", "content": "# Title ..."},
 *   ...
 * ]
 * </pre>
 * The document id is the array index. {@code filename} is accepted as an alias of {@code file_name};
 * a missing name becomes {@code document_<index>}.
 */
@Slf4j
public class JsonDocumentSource implements DocumentSource {

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonDocumentSource(final Path path, final ObjectMapper objectMapper) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        this.path = path;
        this.objectMapper = objectMapper == null ? new ObjectMapper() : objectMapper;
    }

    @Override
    public List<Document> load() {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Document file not found: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            final List<Document> documents = parse(objectMapper.readTree(in));
            log.info("Loaded {} documents from {}", documents.size(), path);
            return documents;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read documents from " + path, e);
        }
    }

    List<Document> parse(final JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalStateException("Expected a JSON array of documents in " + path);
        }
        final List<Document> documents = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            final JsonNode node = root.get(i);
            if (!node.isObject()) {
                throw new IllegalStateException("Document " + i + " in " + path + " is not a JSON object");
            }
            final String filename = node.hasNonNull("file_name")
                    ? node.get("file_name").asText()
                    : node.path("filename").asText("document_" + i);
            final String content = node.path("content").asText("");
            if (content.isBlank()) {
                log.warn("Document {} ({}) has no content", i, filename);
            }
            documents.add(new Document(i, filename, content));
        }
        return documents;
    }
}
