package no.cantara.accreditation.engine;

import java.time.Duration;

/**
 * Range checks for {@link EngineSettings} sections. Kept out of {@code EngineSettings}
 * so that initializing a nested section never initializes the outer record first.
 */
final class SettingsChecks {

    private SettingsChecks() {}

    static void requireUnit(String key, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new ValidationException(key + " must be within [0,1], got " + value);
        }
    }

    static void requirePositive(String key, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ValidationException(key + " must be a positive duration");
        }
    }
}
