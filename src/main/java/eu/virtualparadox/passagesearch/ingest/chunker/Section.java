package eu.virtualparadox.passagesearch.ingest.chunker;

/**
 * A markdown section: the heading line plus everything up to the next heading.
 * Content before the first heading forms an untitled section at level 0.
 *
 * @param title       heading text without the leading {@code #} marks, empty for the preamble
 * @param level       heading depth (1-6), 0 for the preamble
 * @param startOffset inclusive character offset of the section in the document
 * @param endOffset   exclusive character offset of the section in the document
 */
record Section(String title, int level, int startOffset, int endOffset) {

    String content(final String source) {
        return source.substring(startOffset, endOffset);
    }

    boolean hasTitle() {
        return !title.isEmpty();
    }
}
