package no.cantara.accreditation.engine.evidence;

import no.cantara.accreditation.engine.mapping.EvidenceDocument;
import no.cantara.accreditation.engine.mapping.EvidenceMapping;
import no.cantara.accreditation.engine.mapping.MappingRepository;
import no.cantara.accreditation.engine.trust.EvidenceTrustScorer;
import no.cantara.accreditation.engine.trust.TrustScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds {@link StandardEvidence} from the mapping repository, scoring trust on demand.
 * A mapping whose document is not registered still counts as evidence but carries
 * no trust and no age.
 */
public class RepositoryEvidenceLedger implements EvidenceLedger {

    private static final Logger log = LoggerFactory.getLogger(RepositoryEvidenceLedger.class);

    private final MappingRepository mappings;
    private final DocumentRegistry documents;
    private final EvidenceTrustScorer trustScorer;

    public RepositoryEvidenceLedger(MappingRepository mappings, DocumentRegistry documents,
                                    EvidenceTrustScorer trustScorer) {
        this.mappings = Objects.requireNonNull(mappings, "mappings");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.trustScorer = Objects.requireNonNull(trustScorer, "trustScorer");
    }

    @Override
    public StandardEvidence evidenceFor(String standardId) {
        List<EvidenceMapping> found = mappings.findByStandard(standardId);
        if (found.isEmpty()) {
            return StandardEvidence.none(standardId);
        }
        List<TrustScore> trust = new ArrayList<>(found.size());
        List<Long> ages = new ArrayList<>(found.size());
        for (EvidenceMapping mapping : found) {
            Optional<EvidenceDocument> document = documents.find(mapping.documentId());
            if (document.isEmpty()) {
                log.debug("Document {} of mapping to {} is not registered; no trust scored",
                        mapping.documentId(), standardId);
                continue;
            }
            trust.add(trustScorer.score(document.get(), mapping));
            ages.add(trustScorer.ageInDays(document.get()));
        }
        return new StandardEvidence(standardId, found, trust, ages);
    }
}
