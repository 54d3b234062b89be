package no.cantara.accreditation.engine.risk;

import no.cantara.accreditation.engine.Scores;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Predicted risk that a standard would be judged non-compliant if reviewed now.
 *
 * @param contributions   Weighted contribution of each factor to {@code finalRisk}.
 * @param predictedIssues Up to three issues for the most elevated factors.
 */
public record RiskScore(
        String standardId,
        double coverageGap,
        double evidenceQuality,
        double mappingDensity,
        double recency,
        double finalRisk,
        RiskBucket bucket,
        Map<RiskFactor, Double> contributions,
        List<String> predictedIssues,
        String explanation
) {
    public RiskScore {
        coverageGap = Scores.clamp(coverageGap);
        evidenceQuality = Scores.clamp(evidenceQuality);
        mappingDensity = Scores.clamp(mappingDensity);
        recency = Scores.clamp(recency);
        finalRisk = Scores.clamp(finalRisk);
        bucket = bucket != null ? bucket : RiskBucket.of(finalRisk);
        contributions = contributions == null || contributions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(contributions));
        predictedIssues = predictedIssues != null ? List.copyOf(predictedIssues) : List.of();
        explanation = explanation != null ? explanation : "";
    }

    public double component(RiskFactor factor) {
        return switch (factor) {
            case COVERAGE_GAP -> coverageGap;
            case EVIDENCE_QUALITY -> evidenceQuality;
            case MAPPING_DENSITY -> mappingDensity;
            case RECENCY -> recency;
        };
    }
}
