package no.cantara.accreditation.engine.risk;

/**
 * Categorical risk, lower bound inclusive: critical from 0.85, high from 0.70,
 * medium from 0.40, low from 0.15, minimal below.
 */
public enum RiskBucket {
    CRITICAL(0.85),
    HIGH(0.70),
    MEDIUM(0.40),
    LOW(0.15),
    MINIMAL(0.0);

    private final double floor;

    RiskBucket(double floor) {
        this.floor = floor;
    }

    public double floor() {
        return floor;
    }

    public static RiskBucket of(double risk) {
        for (RiskBucket bucket : values()) {
            if (risk >= bucket.floor) return bucket;
        }
        return MINIMAL;
    }
}
