package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.engine.Scores;

import java.util.List;

/**
 * A window of evidence text supporting a mapping.
 */
public record Excerpt(String text, int pageNumber, List<String> matchedKeywords, double score) {

    public Excerpt {
        text = text != null ? text : "";
        matchedKeywords = matchedKeywords != null ? List.copyOf(matchedKeywords) : List.of();
        score = Scores.clamp(score);
    }
}
