package eu.virtualparadox.passagesearch.ingest.chunker;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable half-open span {@code [start, end)} of one whitespace-delimited word in the source text.
 */
final class WordSpan {

    private static final Pattern WORD = Pattern.compile("\\S+");

    /**
     * Inclusive start offset into the source text.
     */
    final int start;
    /**
     * Exclusive end offset into the source text.
     */
    final int end;

    WordSpan(final int start, final int end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Finds every word in {@code text[from, to)}. Offsets are absolute.
     */
    static List<WordSpan> scan(final String text, final int from, final int to) {
        final List<WordSpan> words = new ArrayList<>();
        final Matcher matcher = WORD.matcher(text).region(from, to);
        while (matcher.find()) {
            words.add(new WordSpan(matcher.start(), matcher.end()));
        }
        return words;
    }
}
