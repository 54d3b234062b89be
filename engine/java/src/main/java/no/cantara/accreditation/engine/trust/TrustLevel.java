package no.cantara.accreditation.engine.trust;

/** Trust bands of an overall trust value, lower bound inclusive. */
public enum TrustLevel {
    HIGH(0.8),
    MEDIUM(0.6),
    LOW(0.4),
    CRITICAL(0.0);

    private final double floor;

    TrustLevel(double floor) {
        this.floor = floor;
    }

    public double floor() {
        return floor;
    }

    public static TrustLevel of(double overall) {
        for (TrustLevel level : values()) {
            if (overall >= level.floor) return level;
        }
        return CRITICAL;
    }
}
