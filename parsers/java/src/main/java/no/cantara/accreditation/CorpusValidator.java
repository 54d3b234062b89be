package no.cantara.accreditation;

import no.cantara.accreditation.model.ClauseNode;
import no.cantara.accreditation.model.CorpusMetadata;
import no.cantara.accreditation.model.ParsedCorpus;
import no.cantara.accreditation.model.Rejection;
import no.cantara.accreditation.model.StandardNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a {@link ParsedCorpus} for problems an operator should see before the
 * corpus is trusted for scoring.
 *
 * <p>Returns a {@link ValidationResult} with separate {@code errors} (must fix) and
 * {@code warnings} (should fix) lists.
 */
public class CorpusValidator {

    private CorpusValidator() {}

    /**
     * Immutable result of validating a corpus.
     *
     * @param errors   Conditions that make the corpus unusable or lossy (MUST fix).
     * @param warnings Conditions that are permitted but suspicious (SHOULD fix).
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    public static ValidationResult validate(ParsedCorpus corpus) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        CorpusMetadata meta = corpus.metadata();
        String p = "corpus '" + meta.accreditor() + "'";

        if (corpus.standards().isEmpty()) {
            errors.add(p + ": 'standards' must not be empty");
        }
        for (Rejection r : corpus.rejections()) {
            errors.add(p + ": rejected " + r.nodeRef() + ": " + r.reason());
        }

        // Declared vs loaded count (silent data loss shows up here)
        if (meta.loadedNodeCount() > meta.standardCount()) {
            errors.add(p + ": declares " + meta.standardCount() + " standards but "
                    + meta.loadedNodeCount() + " were loaded");
        } else if (meta.hasDataLoss()) {
            warnings.add(p + ": declares " + meta.standardCount() + " standards but only "
                    + meta.loadedNodeCount() + " were loaded");
        }

        if (meta.version() == null || meta.version().isBlank()) {
            warnings.add(p + ": 'version' not declared");
        }
        if (meta.effectiveDate() == null) {
            warnings.add(p + ": 'effective_date' not declared");
        }

        for (StandardNode standard : corpus.standards()) {
            String s = "standard '" + standard.id() + "'";
            if (standard.description().isBlank()) {
                warnings.add(s + ": no 'description'; crosswalk matching falls back to the title");
            }
            if (standard.clauses().isEmpty()) {
                warnings.add(s + ": no clauses");
            }
            for (ClauseNode clause : standard.clauses()) {
                if (clause.indicators().isEmpty()) {
                    warnings.add(s + ": clause '" + clause.id() + "' has no indicators");
                }
            }
        }

        return new ValidationResult(errors, warnings);
    }
}
