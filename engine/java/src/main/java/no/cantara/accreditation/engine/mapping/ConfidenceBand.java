package no.cantara.accreditation.engine.mapping;

/**
 * Display bands for mapping confidence, lower bound inclusive.
 */
public enum ConfidenceBand {
    HIGH(0.80, "strongly"),
    MEDIUM(0.55, "partially"),
    LOW(0.30, "weakly"),
    VERY_LOW(0.0, "minimally");

    private final double floor;
    private final String adverb;

    ConfidenceBand(double floor, String adverb) {
        this.floor = floor;
        this.adverb = adverb;
    }

    public double floor() {
        return floor;
    }

    /** How strongly a mapping in this band matches, for explanations. */
    public String adverb() {
        return adverb;
    }

    public static ConfidenceBand of(double confidence) {
        for (ConfidenceBand band : values()) {
            if (confidence >= band.floor) return band;
        }
        return VERY_LOW;
    }
}
