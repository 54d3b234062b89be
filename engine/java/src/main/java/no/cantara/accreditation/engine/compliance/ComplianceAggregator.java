package no.cantara.accreditation.engine.compliance;

import no.cantara.accreditation.CorpusSnapshot;
import no.cantara.accreditation.engine.ExplainedValue;
import no.cantara.accreditation.engine.Scores;
import no.cantara.accreditation.engine.ValidationException;
import no.cantara.accreditation.engine.evidence.EvidenceLedger;
import no.cantara.accreditation.engine.evidence.StandardEvidence;
import no.cantara.accreditation.engine.trust.EvidenceTrustScorer;
import no.cantara.accreditation.engine.trust.TrustScore;
import no.cantara.accreditation.model.StandardNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Combines coverage and trust into a compliance score:
 * {@code compliance = 0.6 * coverage + 0.4 * average_trust}, rounded to four decimals.
 */
public class ComplianceAggregator {

    public static final String ALL = "ALL";
    static final double COVERAGE_WEIGHT = 0.6;
    static final double TRUST_WEIGHT = 0.4;

    private final Supplier<CorpusSnapshot> snapshots;
    private final EvidenceLedger ledger;

    public ComplianceAggregator(Supplier<CorpusSnapshot> snapshots, EvidenceLedger ledger) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    /**
     * @param scope an accreditor code, or {@code "all"} for every loaded corpus
     * @throws ValidationException for a blank scope or an accreditor that is not loaded
     */
    public ComplianceReport compute(String scope) {
        if (scope == null || scope.isBlank()) {
            throw new ValidationException("scope is required: an accreditor code or 'all'");
        }
        String code = scope.trim().toUpperCase(Locale.ROOT);
        CorpusSnapshot snapshot = snapshots.get();
        List<StandardNode> standards;
        if (ALL.equals(code)) {
            standards = snapshot.standards();
        } else if (snapshot.isLoaded(code)) {
            standards = snapshot.standards(code);
        } else {
            throw new ValidationException("accreditor not loaded: " + code);
        }

        Map<String, List<TrustScore>> trustByStandard = new LinkedHashMap<>();
        List<String> unmapped = new ArrayList<>();
        int mapped = 0;
        for (StandardNode standard : standards) {
            StandardEvidence evidence = ledger.evidenceFor(standard.id());
            trustByStandard.put(standard.id(), evidence.trust());
            if (evidence.hasEvidence()) {
                mapped++;
            } else {
                unmapped.add(standard.id());
            }
        }

        ExplainedValue coverage = coverage(mapped, standards.size(), code);
        ExplainedValue trust = EvidenceTrustScorer.averageTrust(trustByStandard);
        double score = Scores.clamp(Scores.round4(COVERAGE_WEIGHT * coverage.value() + TRUST_WEIGHT * trust.value()));
        ExplainedValue compliance = ExplainedValue.of(score, String.format(Locale.ROOT,
                "Compliance %s = 60%% of coverage (%s) + 40%% of average trust (%s); breadth of evidence is weighted above its depth.",
                Scores.percent(score), Scores.percent(coverage.value()), Scores.percent(trust.value())));

        return new ComplianceReport(code, standards.size(), mapped, coverage, trust, compliance, unmapped);
    }

    private static ExplainedValue coverage(int mapped, int total, String scope) {
        if (total == 0) {
            return ExplainedValue.of(0.0, "No standards are loaded for " + scope + ", so nothing can be covered yet.");
        }
        double value = Scores.clamp(Scores.ratio(mapped, total, 0.0));
        return ExplainedValue.of(value, String.format(Locale.ROOT,
                "%d of %d standard(s) in %s (%s) have at least one piece of mapped evidence.",
                mapped, total, scope, Scores.percent(value)));
    }
}
