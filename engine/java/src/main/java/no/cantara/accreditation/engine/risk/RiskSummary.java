package no.cantara.accreditation.engine.risk;

import no.cantara.accreditation.engine.ExplainedValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate over a set of risk scores.
 *
 * @param buckets    Count per bucket; every bucket is present.
 * @param topFactors Factors ordered by their total contribution.
 * @param topIssues  Most frequently predicted issues, at most five.
 */
public record RiskSummary(
        int scored,
        Map<RiskBucket, Integer> buckets,
        ExplainedValue averageRisk,
        List<FactorShare> topFactors,
        List<String> topIssues
) {
    /**
     * @param share Fraction of all contributions attributable to this factor.
     */
    public record FactorShare(RiskFactor factor, double contribution, double share) {}

    public RiskSummary {
        Map<RiskBucket, Integer> counts = new EnumMap<>(RiskBucket.class);
        for (RiskBucket bucket : RiskBucket.values()) {
            counts.put(bucket, buckets.getOrDefault(bucket, 0));
        }
        buckets = Collections.unmodifiableMap(counts);
        topFactors = List.copyOf(topFactors);
        topIssues = List.copyOf(topIssues);
    }
}
