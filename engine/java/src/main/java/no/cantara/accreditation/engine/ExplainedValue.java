package no.cantara.accreditation.engine;

/**
 * A number together with the sentence that explains it to an end user.
 */
public record ExplainedValue(double value, String explanation) {

    public ExplainedValue {
        value = Scores.clamp(value);
        explanation = explanation != null ? explanation : "";
    }

    public static ExplainedValue of(double value, String explanation) {
        return new ExplainedValue(value, explanation);
    }
}
