package no.cantara.accreditation.engine.evidence;

import no.cantara.accreditation.engine.mapping.EvidenceMapping;
import no.cantara.accreditation.engine.trust.EvidenceTrustScorer;
import no.cantara.accreditation.engine.trust.TrustScore;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Everything known about the evidence of one standard at one point in time.
 *
 * @param trust            Trust of each mapping whose document is registered.
 * @param evidenceAgesDays Age of each registered document, in days.
 */
public record StandardEvidence(
        String standardId,
        List<EvidenceMapping> mappings,
        List<TrustScore> trust,
        List<Long> evidenceAgesDays
) {
    public StandardEvidence {
        mappings = List.copyOf(mappings);
        trust = List.copyOf(trust);
        evidenceAgesDays = List.copyOf(evidenceAgesDays);
    }

    public static StandardEvidence none(String standardId) {
        return new StandardEvidence(standardId, List.of(), List.of(), List.of());
    }

    public boolean hasEvidence() {
        return !mappings.isEmpty();
    }

    public int mappingCount() {
        return mappings.size();
    }

    /** Mean overall trust, empty when no mapping could be trust-scored. */
    public OptionalDouble standardTrust() {
        return EvidenceTrustScorer.standardTrust(trust);
    }
}
