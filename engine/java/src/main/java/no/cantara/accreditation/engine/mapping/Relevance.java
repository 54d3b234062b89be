package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.engine.Scores;

/** Score of one excerpt against one standard, and how it was obtained. */
public record Relevance(double score, MappingMethod method) {

    public Relevance {
        score = Scores.clamp(score);
    }
}
