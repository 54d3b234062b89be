package no.cantara.accreditation.engine.trust;

import no.cantara.accreditation.engine.Scores;

import java.util.List;

/**
 * Trust in one piece of evidence as support for one standard. Every component is in [0,1].
 *
 * @param overall         Weighted average of the five components.
 * @param recommendations Up to three remediation hints derived from weak components.
 */
public record TrustScore(
        String documentId,
        String standardId,
        double quality,
        double reliability,
        double confidence,
        double freshness,
        double completeness,
        double overall,
        TrustLevel level,
        List<String> recommendations
) {
    public TrustScore {
        quality = Scores.clamp(quality);
        reliability = Scores.clamp(reliability);
        confidence = Scores.clamp(confidence);
        freshness = Scores.clamp(freshness);
        completeness = Scores.clamp(completeness);
        overall = Scores.clamp(overall);
        level = level != null ? level : TrustLevel.of(overall);
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
}
