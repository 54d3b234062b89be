package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.Keywords;
import no.cantara.accreditation.engine.Scores;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Deterministic keyword-overlap relevance.
 *
 * <p>Four overlap ratios are blended: title keywords (0.30), description keywords
 * (0.25), all standard keywords (0.20) and the share of indicators with at least one
 * keyword present (0.25). A component whose reference set is empty drops out and the
 * remaining weights are renormalised.
 */
public class KeywordRelevanceScorer implements RelevanceScorer {

    static final double TITLE_WEIGHT = 0.30;
    static final double DESCRIPTION_WEIGHT = 0.25;
    static final double KEYWORD_WEIGHT = 0.20;
    static final double INDICATOR_WEIGHT = 0.25;

    @Override
    public Relevance score(String excerpt, StandardProfile profile) {
        Set<String> words = Keywords.of(excerpt);
        if (words.isEmpty() || profile.isEmpty()) {
            return new Relevance(0.0, MappingMethod.KEYWORD);
        }
        double weighted = 0.0;
        double weights = 0.0;
        if (!profile.titleKeywords().isEmpty()) {
            weighted += TITLE_WEIGHT * overlap(words, profile.titleKeywords());
            weights += TITLE_WEIGHT;
        }
        if (!profile.descriptionKeywords().isEmpty()) {
            weighted += DESCRIPTION_WEIGHT * overlap(words, profile.descriptionKeywords());
            weights += DESCRIPTION_WEIGHT;
        }
        weighted += KEYWORD_WEIGHT * overlap(words, profile.allKeywords());
        weights += KEYWORD_WEIGHT;
        if (!profile.indicatorKeywords().isEmpty()) {
            weighted += INDICATOR_WEIGHT * indicatorsHit(words, profile.indicatorKeywords());
            weights += INDICATOR_WEIGHT;
        }
        return new Relevance(Scores.clamp(Scores.ratio(weighted, weights, 0.0)), MappingMethod.KEYWORD);
    }

    /** Share of {@code reference} found in {@code words}. */
    static double overlap(Set<String> words, Set<String> reference) {
        long hits = reference.stream().filter(words::contains).count();
        return Scores.ratio(hits, reference.size(), 0.0);
    }

    private static double indicatorsHit(Set<String> words, List<Set<String>> indicators) {
        long hit = indicators.stream().filter(i -> !Collections.disjoint(words, i)).count();
        return Scores.ratio(hit, indicators.size(), 0.0);
    }
}
