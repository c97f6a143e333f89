package eu.virtualparadox.passagesearch.ingest.chunker;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits markdown text into {@link Section}s on heading lines and sections into paragraphs.
 */
final class SectionParser {

    static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+)$");

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    private SectionParser() {
    }

    /**
     * Parses sections. Sections whose content is blank are not returned.
     *
     * @param text document text
     * @return sections in document order
     */
    static List<Section> sections(final String text) {
        final List<Section> sections = new ArrayList<>();

        String title = "";
        int level = 0;
        int sectionStart = 0;
        int pos = 0;

        while (pos < text.length()) {
            int lineEnd = text.indexOf('\n', pos);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            final Matcher heading = HEADING.matcher(stripCarriageReturn(text.substring(pos, lineEnd)));
            if (heading.matches()) {
                addIfNotBlank(sections, text, title, level, sectionStart, pos);
                title = heading.group(2).strip();
                level = heading.group(1).length();
                sectionStart = pos;
            }
            pos = lineEnd + 1;
        }
        addIfNotBlank(sections, text, title, level, sectionStart, text.length());
        return sections;
    }

    /**
     * Splits {@code text[from, to)} into blank-line separated paragraphs.
     *
     * @return absolute {@code [start, end)} offsets of each stripped, non-empty paragraph
     */
    static List<int[]> paragraphs(final String text, final int from, final int to) {
        final List<int[]> result = new ArrayList<>();
        final Matcher matcher = PARAGRAPH_BREAK.matcher(text).region(from, to);
        int last = from;
        while (matcher.find()) {
            addStripped(result, text, last, matcher.start());
            last = matcher.end();
        }
        addStripped(result, text, last, to);
        return result;
    }

    static boolean isHeadingLine(final String line) {
        return HEADING.matcher(stripCarriageReturn(line)).matches();
    }

    private static void addIfNotBlank(final List<Section> sections,
                                      final String text,
                                      final String title,
                                      final int level,
                                      final int start,
                                      final int end) {
        final int boundedEnd = Math.min(end, text.length());
        if (boundedEnd > start && !text.substring(start, boundedEnd).isBlank()) {
            sections.add(new Section(title, level, start, boundedEnd));
        }
    }

    /**
     * Narrows {@code [from, to)} so it neither starts nor ends with whitespace.
     *
     * @return stripped {@code [start, end)}, or {@code null} if the range holds only whitespace
     */
    static int[] strip(final String text, final int from, final int to) {
        int start = from;
        int end = to;
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return end > start ? new int[]{start, end} : null;
    }

    private static void addStripped(final List<int[]> out, final String text, final int from, final int to) {
        final int[] bounds = strip(text, from, to);
        if (bounds != null) {
            out.add(bounds);
        }
    }

    private static String stripCarriageReturn(final String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
