package no.cantara.accreditation.engine;

/**
 * Caller misuse: an unknown accreditor, a self crosswalk, an out-of-range argument.
 * Always surfaced, never replaced by a default.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
