package no.cantara.accreditation.engine.evidence;

import no.cantara.accreditation.engine.mapping.EvidenceDocument;
import no.cantara.accreditation.engine.mapping.EvidenceMapping;
import no.cantara.accreditation.engine.mapping.EvidenceSource;
import no.cantara.accreditation.engine.mapping.InMemoryMappingRepository;
import no.cantara.accreditation.engine.mapping.MappingMethod;
import no.cantara.accreditation.engine.trust.EvidenceTrustScorer;
import no.cantara.accreditation.engine.trust.TrustWeights;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryEvidenceLedgerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final InMemoryMappingRepository repository = new InMemoryMappingRepository();
    private final DocumentRegistry documents = new DocumentRegistry();
    private final RepositoryEvidenceLedger ledger = new RepositoryEvidenceLedger(repository, documents,
            new EvidenceTrustScorer(TrustWeights.EQUAL, Clock.fixed(NOW, ZoneOffset.UTC)));

    private static EvidenceMapping mapping(String doc, String standard) {
        return new EvidenceMapping(doc, standard, "ACC", 0.7, List.of(), MappingMethod.KEYWORD, "", NOW, NOW);
    }

    @Test
    void standardWithoutMappingsHasNoEvidence() {
        StandardEvidence evidence = ledger.evidenceFor("ACC_1");
        assertFalse(evidence.hasEvidence());
        assertEquals(0, evidence.mappingCount());
        assertTrue(evidence.standardTrust().isEmpty());
    }

    @Test
    void registeredDocumentsContributeTrustAndAge() {
        documents.register(new EvidenceDocument("d1", null, "text", 1, NOW.minus(Duration.ofDays(40)),
                EvidenceSource.ERP));
        repository.upsert(mapping("d1", "ACC_1"));
        repository.upsert(mapping("d2", "ACC_1"));
        repository.upsert(mapping("d1", "ACC_2"));

        StandardEvidence evidence = ledger.evidenceFor("ACC_1");
        assertEquals(2, evidence.mappingCount());
        assertEquals(1, evidence.trust().size());
        assertEquals(List.of(40L), evidence.evidenceAgesDays());
        assertTrue(evidence.standardTrust().isPresent());
    }

    @Test
    void reRegisteringReplacesTheDocument() {
        documents.register(new EvidenceDocument("d1", "old", "text", 1, NOW, EvidenceSource.MANUAL));
        documents.register(new EvidenceDocument("d1", "new", "text", 1, NOW, EvidenceSource.MANUAL));
        assertEquals(1, documents.size());
        assertEquals("new", documents.find("d1").orElseThrow().title());
        assertTrue(documents.remove("d1"));
        assertFalse(documents.remove("d1"));
    }
}
