package no.cantara.accreditation.engine;

import java.util.Locale;

/**
 * Arithmetic shared by every scorer. All public scores pass through {@link #clamp}.
 */
public final class Scores {

    private Scores() {}

    /** Clamps to [0,1]; NaN becomes 0. */
    public static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * {@code numerator / denominator}, or {@code fallback} when the denominator is zero.
     */
    public static double ratio(double numerator, double denominator, double fallback) {
        if (denominator == 0.0 || Double.isNaN(denominator)) return fallback;
        return numerator / denominator;
    }

    /** Rounds half-up to four decimals. */
    public static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    public static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value * 100.0);
    }
}
