package eu.virtualparadox.passagesearch.util;

public class LuceneConstants {

    private LuceneConstants() {
        // Prevent instantiation
    }

    public static final String FIELD_POSITION = "position";
    public static final String FIELD_TOKENS = "tokens";
}
