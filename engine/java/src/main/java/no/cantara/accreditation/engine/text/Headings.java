package no.cantara.accreditation.engine.text;

import java.util.regex.Pattern;

/**
 * Detects section headings in plain evidence text.
 */
public final class Headings {

    private static final Pattern MARKDOWN = Pattern.compile("(?m)^#{1,6}\\s+\\S");
    private static final Pattern NUMBERED = Pattern.compile("(?m)^\\d+(\\.\\d+)*\\.?\\s+[A-Z][^\\n]{0,80}$");
    private static final Pattern UPPER_CASE = Pattern.compile("(?m)^[A-Z][A-Z ,&/-]{3,60}$");

    private Headings() {}

    public static boolean present(String text) {
        if (text == null || text.isBlank()) return false;
        return MARKDOWN.matcher(text).find()
                || NUMBERED.matcher(text).find()
                || UPPER_CASE.matcher(text).find();
    }
}
