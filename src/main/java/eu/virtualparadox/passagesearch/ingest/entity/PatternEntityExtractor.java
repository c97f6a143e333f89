package eu.virtualparadox.passagesearch.ingest.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern based {@link EntityExtractor}.
 * <ul>
 *   <li>{@value #NAMES}: runs of capitalized words, e.g. {@code Ho Chi Minh} or {@code Paris}.
 *       A capitalized word opening a sentence or a line is not counted on its own.</li>
 *   <li>{@value #YEARS}: four digit years between 1000 and 2099.</li>
 * </ul>
 * Entities are deduplicated and kept in order of first appearance.
 */
public class PatternEntityExtractor implements EntityExtractor {

    public static final String NAMES = "names";
    public static final String YEARS = "years";

    private static final Pattern CAPITALIZED_RUN = Pattern.compile(
            "(?<![\\p{L}\\p{M}\\d_])\\p{Lu}[\\p{L}\\p{M}\\d]*(?:[ \\t]+\\p{Lu}[\\p{L}\\p{M}\\d]*)*");
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[ \\t]+");
    private static final Pattern YEAR = Pattern.compile("(?<!\\d)(1\\d{3}|20\\d{2})(?!\\d)");

    @Override
    public Map<String, List<String>> extract(final String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyMap();
        }
        final Map<String, List<String>> entities = new LinkedHashMap<>();
        put(entities, NAMES, names(text));
        put(entities, YEARS, years(text));
        return entities;
    }

    private static Set<String> names(final String text) {
        final Set<String> names = new LinkedHashSet<>();
        final Matcher matcher = CAPITALIZED_RUN.matcher(text);
        while (matcher.find()) {
            String name = matcher.group();
            if (opensSentence(text, matcher.start())) {
                final String[] words = WORD_SEPARATOR.split(name, 2);
                if (words.length < 2) {
                    continue;
                }
                name = words[1];
            }
            names.add(name);
        }
        return names;
    }

    private static Set<String> years(final String text) {
        final Set<String> years = new LinkedHashSet<>();
        final Matcher matcher = YEAR.matcher(text);
        while (matcher.find()) {
            years.add(matcher.group(1));
        }
        return years;
    }

    /**
     * True if only markdown markers and blanks separate {@code index} from the start of the text,
     * a line break or sentence punctuation.
     */
    static boolean opensSentence(final String text, final int index) {
        for (int i = index - 1; i >= 0; i--) {
            final char c = text.charAt(i);
            if (c == '\n' || c == '.' || c == '!' || c == '?' || c == ':') {
                return true;
            }
            if (c != ' ' && c != '\t' && c != '#' && c != '*' && c != '-' && c != '>' && c != '\r') {
                return false;
            }
        }
        return true;
    }

    private static void put(final Map<String, List<String>> entities, final String kind, final Set<String> values) {
        if (!values.isEmpty()) {
            entities.put(kind, Collections.unmodifiableList(new ArrayList<>(values)));
        }
    }
}
