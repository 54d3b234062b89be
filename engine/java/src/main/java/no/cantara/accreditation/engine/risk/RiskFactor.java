package no.cantara.accreditation.engine.risk;

/**
 * The four components of a standard's risk, with their fixed weights. The weights
 * sum to 1, so an uncovered standard never scores below the coverage gap weight.
 */
public enum RiskFactor {
    COVERAGE_GAP(0.40, "coverage gap", "Insufficient evidence coverage: gaps likely in documentation"),
    EVIDENCE_QUALITY(0.25, "evidence quality", "Low evidence quality: may not meet reviewer expectations"),
    MAPPING_DENSITY(0.20, "mapping density", "Sparse evidence: too few documents support this standard"),
    RECENCY(0.15, "recency", "Outdated evidence: requires refresh");

    private final double weight;
    private final String label;
    private final String issue;

    RiskFactor(double weight, String label, String issue) {
        this.weight = weight;
        this.label = label;
        this.issue = issue;
    }

    public double weight() {
        return weight;
    }

    public String label() {
        return label;
    }

    /** The issue predicted when this factor is elevated. */
    public String issue() {
        return issue;
    }
}
