package no.cantara.accreditation.engine;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineSettingsLoaderTest {

    private static EngineSettings load(String yaml) {
        return EngineSettingsLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yaml");
    }

    @Test
    void defaultsMatchDocumentedValues() {
        EngineSettings d = EngineSettings.DEFAULT;
        assertEquals(240, d.mapper().excerptWindow());
        assertEquals(3, d.mapper().maxExcerpts());
        assertEquals(0.5, d.mapper().embeddingWeight());
        assertEquals(Duration.ofSeconds(2), d.mapper().embeddingTimeout());
        assertEquals(0.2, d.trust().freshness());
        assertEquals(Duration.ofSeconds(10), d.mapper().embeddingBudget());
        assertEquals(3, d.risk().mappingTarget());
        assertEquals(Duration.ofDays(365), d.risk().recencyFloor());
        assertEquals(Duration.ofDays(1095), d.risk().recencyCeiling());
        assertEquals(0.3, d.crosswalk().threshold());
        assertEquals(10, d.crosswalk().topK());
        assertEquals(Duration.ofSeconds(60), d.loaderBudget());
    }

    @Test
    void emptyFileYieldsDefaults() {
        assertEquals(EngineSettings.DEFAULT, load(""));
    }

    @Test
    void overridesOnlyWhatIsGiven() throws IOException {
        EngineSettings s = EngineSettingsLoader.load(TestCorpus.resource("settings.yaml"));
        assertEquals(5, s.mapper().maxExcerpts());
        assertEquals(0.25, s.mapper().embeddingWeight());
        assertEquals(240, s.mapper().excerptWindow());
        assertEquals(0.4, s.trust().freshness());
        assertEquals(0.2, s.trust().quality());
        assertEquals(Duration.ofMillis(3000), s.mapper().embeddingBudget());
        assertEquals(Duration.ofSeconds(2), s.mapper().embeddingTimeout());
        assertEquals(4, s.risk().mappingTarget());
        assertEquals(Duration.ofDays(180), s.risk().recencyFloor());
        assertEquals(3, s.crosswalk().topK());
        assertEquals(Duration.ofMillis(1000), s.crosswalk().budget());
        assertEquals(0.3, s.crosswalk().threshold());
    }

    @Test
    void unknownKeysAreIgnored() {
        assertEquals(EngineSettings.DEFAULT, load("colour: blue\nmapper:\n  shiny: true\n"));
    }

    @Test
    void riskWeightsCannotBeOverridden() {
        assertEquals(EngineSettings.DEFAULT, load("risk:\n  weights:\n    coverage_gap: 0\n    recency: 0.9\n"));
    }

    @Test
    void integersAreAcceptedForDecimals() {
        assertEquals(1.0, load("crosswalk:\n  threshold: 1\n").crosswalk().threshold());
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThrows(ValidationException.class, () -> load("crosswalk:\n  threshold: 1.5\n"));
        assertThrows(ValidationException.class, () -> load("crosswalk:\n  top_k: 0\n"));
        assertThrows(ValidationException.class, () -> load("mapper:\n  embedding_weight: -0.1\n"));
        assertThrows(ValidationException.class, () -> load("risk:\n  recency_floor_days: 1200\n"));
        assertThrows(ValidationException.class, () -> load("trust:\n  quality: -1\n"));
        assertThrows(ValidationException.class, () -> load("loader:\n  budget_ms: 0\n"));
        assertThrows(ValidationException.class, () -> load("mapper:\n  embedding_budget_ms: 0\n"));
    }

    @Test
    void wrongTypesAreRejected() {
        assertThrows(ValidationException.class, () -> load("mapper:\n  max_excerpts: many\n"));
        assertThrows(ValidationException.class, () -> load("mapper: [1, 2]\n"));
        assertThrows(ValidationException.class, () -> load("- just\n- a list\n"));
        assertThrows(ValidationException.class, () -> load("crosswalk:\n  budget_ms: 2.5\n"));
    }

    @Test
    void unparsableYamlIsAValidationError() {
        assertThrows(ValidationException.class, () -> load("mapper: {unterminated"));
    }
}
