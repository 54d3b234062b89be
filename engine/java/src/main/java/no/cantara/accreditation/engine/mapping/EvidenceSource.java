package no.cantara.accreditation.engine.mapping;

import java.util.Locale;

/**
 * Where an evidence document came from, and how far that origin is trusted.
 */
public enum EvidenceSource {
    EXTERNAL_AUDIT(1.0),
    ERP(0.9),
    LMS(0.85),
    SIS(0.85),
    INTERNAL_SYSTEM(0.7),
    SURVEY(0.6),
    MANUAL(0.5);

    private final double reliability;

    EvidenceSource(double reliability) {
        this.reliability = reliability;
    }

    public double reliability() {
        return reliability;
    }

    /**
     * Case-insensitive lookup accepting {@code external-audit}, {@code external_audit} and the like.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static EvidenceSource parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
    }
}
