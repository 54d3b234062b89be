package no.cantara.accreditation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword extraction shared by corpus search, evidence mapping and crosswalks.
 *
 * <p>A keyword is a lower-case run of ASCII letters longer than three characters
 * that is not a stop word. Insertion order follows first occurrence.
 */
public final class Keywords {

    private static final Pattern WORD = Pattern.compile("[a-z]+");
    private static final int MIN_LENGTH = 4;
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were", "has", "have", "had", "this", "that", "these", "those",
            "from", "into", "each", "such", "than", "then", "there", "their", "which", "will",
            "shall", "must", "been", "being", "also", "page");

    private Keywords() {}

    public static Set<String> of(String text) {
        if (text == null || text.isBlank()) return Set.of();
        Set<String> keywords = new LinkedHashSet<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String word = m.group();
            if (word.length() >= MIN_LENGTH && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return Collections.unmodifiableSet(keywords);
    }

    public static boolean isKeyword(String word) {
        return word != null && word.length() >= MIN_LENGTH && WORD.matcher(word).matches()
                && !STOP_WORDS.contains(word);
    }
}
