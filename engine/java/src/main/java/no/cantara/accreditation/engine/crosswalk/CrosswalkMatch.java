package no.cantara.accreditation.engine.crosswalk;

import no.cantara.accreditation.engine.Scores;

import java.util.List;

/**
 * A target standard similar to a source standard.
 *
 * @param similarity          Jaccard similarity of the two keyword sets.
 * @param overlappingKeywords Shared keywords, sorted.
 */
public record CrosswalkMatch(
        String sourceStandardId,
        String targetStandardId,
        double similarity,
        List<String> overlappingKeywords
) {
    public CrosswalkMatch {
        similarity = Scores.clamp(similarity);
        overlappingKeywords = List.copyOf(overlappingKeywords);
    }
}
