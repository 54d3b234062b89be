package no.cantara.accreditation.engine;

import no.cantara.accreditation.CorpusSnapshot;
import no.cantara.accreditation.engine.compliance.ComplianceReport;
import no.cantara.accreditation.engine.crosswalk.CrosswalkResult;
import no.cantara.accreditation.engine.mapping.EvidenceDocument;
import no.cantara.accreditation.engine.mapping.EvidenceMapping;
import no.cantara.accreditation.engine.mapping.EvidenceSource;
import no.cantara.accreditation.engine.mapping.MappingMethod;
import no.cantara.accreditation.engine.mapping.MappingRun;
import no.cantara.accreditation.engine.risk.RiskBucket;
import no.cantara.accreditation.engine.risk.RiskScore;
import no.cantara.accreditation.engine.risk.RiskSummary;
import no.cantara.accreditation.engine.trust.TrustScore;
import no.cantara.accreditation.engine.trust.TrustWeights;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class AccreditationEngineTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static String handbook() throws IOException {
        return Files.readString(TestCorpus.resource("evidence/faculty-handbook.txt"));
    }

    @Test
    void mapsScoresAndAggregatesEndToEnd() {
        EngineSettings settings = new EngineSettings(EngineSettings.Mapper.DEFAULT, new TrustWeights(0, 1, 1, 0, 0),
                EngineSettings.Risk.DEFAULT, EngineSettings.Crosswalk.DEFAULT, Duration.ofSeconds(60));
        try (AccreditationEngine engine = AccreditationEngine.builder()
                .settings(settings)
                .clock(CLOCK)
                .corpusStore(TestCorpus.store(
                        TestCorpus.corpus("AAA", TestCorpus.standard("1", "Mission", "Mission statement"),
                                TestCorpus.standard("2", "Faculty", "Faculty credentials")),
                        TestCorpus.corpus("BBB", TestCorpus.standard("1", "Finance", "Financial resources"))))
                .build()) {

            EvidenceDocument doc = engine.registerDocument(new EvidenceDocument("doc-1", "Mission Report",
                    "Our mission statement.", 1, NOW.minus(Duration.ofDays(30)), EvidenceSource.INTERNAL_SYSTEM));
            EvidenceMapping mapping = engine.upsertMapping(new EvidenceMapping("doc-1", "AAA_1", "AAA", 0.9,
                    List.of(), MappingMethod.KEYWORD, "manual link", NOW, NOW));

            TrustScore trust = engine.scoreTrust(doc, mapping);
            assertEquals(0.8, trust.overall(), 1e-9);

            ComplianceReport report = engine.computeCompliance("AAA");
            assertEquals(0.5, report.coverage().value());
            assertEquals(0.8, report.averageTrust().value(), 1e-9);
            assertEquals(0.62, report.complianceScore().value());

            RiskScore uncovered = engine.scoreRisk("BBB_1");
            assertEquals(1.0, uncovered.coverageGap());
            assertEquals(RiskBucket.CRITICAL, uncovered.bucket());

            RiskScore covered = engine.scoreRisk("AAA_1");
            assertEquals(0.0, covered.coverageGap());
            assertEquals(0.2, covered.evidenceQuality(), 1e-9);

            List<RiskScore> all = engine.scoreRiskAll(null);
            assertEquals(3, all.size());
            RiskSummary summary = engine.aggregateRisk(all);
            assertEquals(3, summary.scored());
            assertEquals(2, summary.buckets().get(RiskBucket.CRITICAL));

            assertEquals(List.of("AAA_1"), engine.scoreRiskBulk(List.of("AAA_1", "ZZZ_1")).stream()
                    .map(RiskScore::standardId).toList());
            assertEquals(1, engine.mappingStatistics().total());
        }
    }

    @Test
    void mapsHandbookOntoLoadedCorpus() throws IOException {
        try (AccreditationEngine engine = AccreditationEngine.builder().clock(CLOCK).build()) {
            CorpusSnapshot snapshot = engine.loadCorpus(TestCorpus.resource("corpus"));
            assertEquals(List.of("HLC", "SACSCOC"), List.copyOf(snapshot.accreditors()));

            List<EvidenceMapping> mappings = engine.mapEvidence(handbook(), "sacscoc");
            assertFalse(mappings.isEmpty());
            EvidenceMapping best = mappings.get(0);
            assertEquals("SACSCOC_8.1", best.standardId());
            assertEquals(1, best.excerpts().get(0).pageNumber());
            assertTrue(best.explanation().contains("SACSCOC 8.1: Faculty Qualifications"));
            assertTrue(mappings.stream().allMatch(m -> m.accreditor().equals("SACSCOC")));

            int stored = engine.mappingsForDocument(best.documentId()).size();
            assertEquals(mappings.size(), stored);
            engine.mapEvidence(handbook(), "SACSCOC");
            assertEquals(stored, engine.mappingsForDocument(best.documentId()).size());
            assertEquals(stored, engine.mappingStatistics().total());

            ComplianceReport report = engine.computeCompliance("SACSCOC");
            assertEquals(3, report.totalStandards());
            assertTrue(report.coverage().value() > 0.0);
            assertTrue(report.averageTrust().value() > 0.0);
        }
    }

    @Test
    void reloadKeepsCountsAndBumpsGeneration() throws IOException {
        try (AccreditationEngine engine = AccreditationEngine.builder().build()) {
            CorpusSnapshot first = engine.loadCorpus(TestCorpus.resource("corpus"));
            CorpusSnapshot second = engine.reloadCorpus();
            assertEquals(first.standardCount(), second.standardCount());
            assertTrue(second.generation() > first.generation());
            assertEquals(2, engine.corpusMetadata().size());
        }
    }

    @Test
    void embeddingModelSwitchesToHybridScoring() throws IOException {
        try (AccreditationEngine engine = AccreditationEngine.builder()
                .clock(CLOCK)
                .embeddingModel(text -> new float[]{1f, 1f})
                .build()) {
            engine.loadCorpus(TestCorpus.resource("corpus"));
            List<EvidenceMapping> mappings = engine.mapEvidence(handbook(), "SACSCOC");
            assertFalse(mappings.isEmpty());
            assertTrue(mappings.stream().allMatch(m -> m.method() == MappingMethod.HYBRID));
        }
    }

    @Test
    void hangingEmbeddingModelIsBoundedPerMappingRun() throws IOException {
        CountDownLatch never = new CountDownLatch(1);
        EngineSettings.Mapper mapper = new EngineSettings.Mapper(240, 3, 0.0, 0.5,
                Duration.ofMillis(100), Duration.ofMillis(300));
        EngineSettings settings = new EngineSettings(mapper, TrustWeights.EQUAL, EngineSettings.Risk.DEFAULT,
                EngineSettings.Crosswalk.DEFAULT, Duration.ofSeconds(60));
        try (AccreditationEngine engine = AccreditationEngine.builder()
                .settings(settings)
                .clock(CLOCK)
                .embeddingModel(text -> {
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new float[]{1f, 1f};
                })
                .build()) {
            engine.loadCorpus(TestCorpus.resource("corpus"));

            long started = System.nanoTime();
            MappingRun run = engine.mapEvidenceRun(EvidenceDocument.of(handbook(), NOW), null);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;

            assertTrue(run.timedOut());
            assertFalse(run.mappings().isEmpty());
            assertTrue(run.mappings().stream().allMatch(m -> m.method() == MappingMethod.KEYWORD));
            assertTrue(elapsedMs < 2_000, "took " + elapsedMs + " ms");
        } finally {
            never.countDown();
        }
    }

    @Test
    void keywordMappingRunIsNotFlagged() throws IOException {
        try (AccreditationEngine engine = AccreditationEngine.builder().clock(CLOCK).build()) {
            engine.loadCorpus(TestCorpus.resource("corpus"));
            MappingRun run = engine.mapEvidenceRun(EvidenceDocument.of(handbook(), NOW), "SACSCOC");
            assertFalse(run.timedOut());
            assertEquals(Set.copyOf(run.mappings()),
                    Set.copyOf(engine.mappingsForDocument(run.mappings().get(0).documentId())));
        }
    }

    @Test
    void upsertStoresTheAccreditorOfTheLoadedStandard() throws IOException {
        try (AccreditationEngine engine = AccreditationEngine.builder().clock(CLOCK).build()) {
            engine.loadCorpus(TestCorpus.resource("corpus"));
            EvidenceMapping wrong = engine.upsertMapping(new EvidenceMapping("doc", "SACSCOC_8.1", "HLC", 0.7,
                    List.of(), MappingMethod.KEYWORD, "", NOW, NOW));
            EvidenceMapping missing = engine.upsertMapping(new EvidenceMapping("doc", "SACSCOC_1.1", null, 0.7,
                    List.of(), MappingMethod.KEYWORD, "", NOW, NOW));

            assertEquals("SACSCOC", wrong.accreditor());
            assertEquals("SACSCOC", missing.accreditor());
            assertEquals(2, engine.mappingStatistics().byAccreditor().get("SACSCOC"));
            assertNull(engine.mappingStatistics().byAccreditor().get("HLC"));
            assertNull(engine.mappingStatistics().byAccreditor().get("null"));
        }
    }

    @Test
    void crosswalksLoadedCorpora() throws IOException {
        try (AccreditationEngine engine = AccreditationEngine.builder().build()) {
            engine.loadCorpus(TestCorpus.resource("corpus"));
            CrosswalkResult result = engine.crosswalk("SACSCOC", "HLC", 0.1, 5);
            assertEquals("SACSCOC", result.sourceAccreditor());
            assertTrue(result.matches().containsKey("SACSCOC_1.1"));
            assertThrows(ValidationException.class, () -> engine.crosswalk("HLC", "hlc"));
        }
    }

    @Test
    void rejectsInvalidInput() throws IOException {
        try (AccreditationEngine engine = AccreditationEngine.builder().build()) {
            engine.loadCorpus(TestCorpus.resource("corpus"));
            EvidenceMapping unknown = new EvidenceMapping("doc", "SACSCOC_99", "SACSCOC", 0.5, List.of(),
                    MappingMethod.KEYWORD, "", NOW, NOW);
            assertThrows(ValidationException.class, () -> engine.upsertMapping(unknown));
            assertThrows(ValidationException.class, () -> engine.mapEvidence("text", "NOPE"));
            assertThrows(ValidationException.class, () -> engine.mapEvidence("text", " "));
            assertThrows(ValidationException.class, () -> engine.scoreRisk("SACSCOC_99"));
            assertThrows(ValidationException.class, () -> engine.scoreRiskAll("NOPE"));
            assertThrows(ValidationException.class, () -> engine.computeCompliance("NOPE"));
            assertThrows(ValidationException.class, () -> engine.mapEvidence((EvidenceDocument) null, null));
        }
    }

    @Test
    void emptyTextMapsToNothing() {
        try (AccreditationEngine engine = AccreditationEngine.builder().build()) {
            assertTrue(engine.mapEvidence("", null).isEmpty());
            assertEquals(0, engine.mappingStatistics().total());
        }
    }
}
