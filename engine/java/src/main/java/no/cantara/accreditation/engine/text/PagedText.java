package no.cantara.accreditation.engine.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evidence text with its page boundaries resolved.
 *
 * <p>A page boundary is any line containing {@code Page} followed by a number, for
 * example {@code --- Page 12 ---}. Text ahead of the first marker belongs to page 1.
 */
public final class PagedText {

    private static final Pattern MARKER = Pattern.compile("(?m)^[^\\n]*\\bPage\\s+(\\d{1,9})\\b[^\\n]*$");

    private record Marker(int offset, int page) {}

    private final String text;
    private final List<Marker> markers;

    public PagedText(String text) {
        this.text = text != null ? text : "";
        List<Marker> found = new ArrayList<>();
        Matcher m = MARKER.matcher(this.text);
        while (m.find()) {
            found.add(new Marker(m.start(), Integer.parseInt(m.group(1))));
        }
        this.markers = List.copyOf(found);
    }

    public String text() {
        return text;
    }

    public boolean hasPageMarkers() {
        return !markers.isEmpty();
    }

    /** Page number at a character offset. */
    public int pageAt(int offset) {
        int page = 1;
        for (Marker marker : markers) {
            if (marker.offset() > offset) break;
            page = marker.page();
        }
        return page;
    }

    /**
     * Highest page number seen, or 1 for text without markers.
     */
    public int pageCount() {
        return markers.stream().mapToInt(Marker::page).max().orElse(1);
    }
}
