package no.cantara.accreditation.engine.trust;

import no.cantara.accreditation.engine.ValidationException;

/**
 * Weights of the five trust components. Normalised by their sum when applied,
 * so they need not add up to one.
 */
public record TrustWeights(
        double quality,
        double reliability,
        double confidence,
        double freshness,
        double completeness
) {
    public static final TrustWeights EQUAL = new TrustWeights(0.2, 0.2, 0.2, 0.2, 0.2);

    public TrustWeights {
        for (double w : new double[]{quality, reliability, confidence, freshness, completeness}) {
            if (!(w >= 0.0) || Double.isInfinite(w)) {
                throw new ValidationException("trust weights must be finite and non-negative");
            }
        }
        if (quality + reliability + confidence + freshness + completeness <= 0.0) {
            throw new ValidationException("at least one trust weight must be positive");
        }
    }

    double sum() {
        return quality + reliability + confidence + freshness + completeness;
    }
}
