package no.cantara.accreditation;

import no.cantara.accreditation.model.CorpusMetadata;
import no.cantara.accreditation.model.ParsedCorpus;
import no.cantara.accreditation.model.StandardNode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorpusParserTest {

    private static final Map<String, Object> MINIMAL = Map.of(
            "accreditor", "HLC",
            "metadata", Map.of("version", "2020", "effective_date", "2020-09-01"),
            "standards", List.of(Map.of(
                    "id", "1.A",
                    "title", "Mission Articulation",
                    "description", "The mission is articulated publicly",
                    "clauses", List.of(Map.of(
                            "id", "1.A.1",
                            "title", "Mission Development",
                            "indicators", List.of("Mission documents are current")
                    ))
            ))
    );

    private static Map<String, Object> minimalWith(String key, Object value) {
        Map<String, Object> m = new HashMap<>(MINIMAL);
        m.put(key, value);
        return m;
    }

    private static Map<String, Object> standard(String id, String title) {
        Map<String, Object> s = new HashMap<>();
        if (id != null) s.put("id", id);
        if (title != null) s.put("title", title);
        s.put("description", "Some description of " + title);
        return s;
    }

    private static ParsedCorpus parseYaml(String yaml, String source) {
        return CorpusParser.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), source);
    }

    // -----------------------------------------------------------------------
    // Parser tests
    // -----------------------------------------------------------------------

    @Test
    void parsesMinimalCorpus() {
        ParsedCorpus c = CorpusParser.fromMap(MINIMAL, "hlc.yaml");
        assertEquals("HLC", c.accreditor());
        assertEquals("2020", c.metadata().version());
        assertEquals(LocalDate.of(2020, 9, 1), c.metadata().effectiveDate());
        assertEquals(1, c.standards().size());
        assertTrue(c.rejections().isEmpty());
    }

    @Test
    void namespacesStandardAndClauseIds() {
        ParsedCorpus c = CorpusParser.fromMap(MINIMAL, "hlc.yaml");
        StandardNode s = c.standards().get(0);
        assertEquals("HLC_1.A", s.id());
        assertEquals("1.A", s.originalId());
        assertEquals("HLC", s.accreditor());
        assertEquals("HLC_1.A.1", s.clauses().get(0).id());
    }

    @Test
    void keepsIdsThatAlreadyCarryThePrefix() {
        assertEquals("HLC_1.A", CorpusParser.ensurePrefix("HLC", "HLC_1.A"));
        assertEquals("hlc_2", CorpusParser.ensurePrefix("HLC", "hlc_2"));
    }

    @Test
    void sanitisesSpacesAndSlashesInIds() {
        assertEquals("WASC_CFR_1.1", CorpusParser.ensurePrefix("wasc", "CFR 1/1"));
    }

    @Test
    void accreditorFallsBackToFileStem() {
        Map<String, Object> data = new HashMap<>(MINIMAL);
        data.remove("accreditor");
        ParsedCorpus c = CorpusParser.fromMap(data, "neche.standards.yaml");
        assertEquals("NECHE", c.accreditor());
        assertEquals("NECHE_1.A", c.standards().get(0).id());
    }

    @Test
    void accreditorCodeIsUpperCased() {
        ParsedCorpus c = CorpusParser.fromMap(minimalWith("accreditor", " msche "), "x.yaml");
        assertEquals("MSCHE", c.accreditor());
    }

    @Test
    void versionFallsBackToTopLevel() {
        Map<String, Object> data = new HashMap<>(MINIMAL);
        data.put("metadata", Map.of());
        data.put("version", "2019");
        data.put("effective_date", "2019-01-01");
        CorpusMetadata meta = CorpusParser.fromMap(data, "hlc.yaml").metadata();
        assertEquals("2019", meta.version());
        assertEquals(LocalDate.of(2019, 1, 1), meta.effectiveDate());
    }

    @Test
    void declaredCountComesFromMetadataWhenPresent() {
        Map<String, Object> data = minimalWith("metadata", Map.of("standard_count", 5));
        CorpusMetadata meta = CorpusParser.fromMap(data, "hlc.yaml").metadata();
        assertEquals(5, meta.standardCount());
        assertEquals(1, meta.loadedNodeCount());
        assertTrue(meta.hasDataLoss());
    }

    @Test
    void declaredCountDefaultsToEntriesInFile() {
        Map<String, Object> data = minimalWith("standards", List.of(
                standard("1", "One"), standard("2", null), standard(null, "Three")));
        ParsedCorpus c = CorpusParser.fromMap(data, "hlc.yaml");
        assertEquals(3, c.metadata().standardCount());
        assertEquals(1, c.metadata().loadedNodeCount());
    }

    @Test
    void rejectsStandardMissingTitle() {
        Map<String, Object> data = minimalWith("standards", List.of(standard("1", "One"), standard("2", null)));
        ParsedCorpus c = CorpusParser.fromMap(data, "hlc.yaml");
        assertEquals(1, c.standards().size());
        assertEquals(1, c.rejections().size());
        assertEquals("HLC_2", c.rejections().get(0).nodeRef());
        assertTrue(c.rejections().get(0).reason().contains("title"));
    }

    @Test
    void rejectsStandardMissingId() {
        Map<String, Object> data = minimalWith("standards", List.of(standard(null, "Nameless")));
        ParsedCorpus c = CorpusParser.fromMap(data, "hlc.yaml");
        assertTrue(c.standards().isEmpty());
        assertEquals("standards[0]", c.rejections().get(0).nodeRef());
    }

    @Test
    void rejectsDuplicateIdWithinFile() {
        Map<String, Object> data = minimalWith("standards", List.of(standard("1", "One"), standard("1", "Again")));
        ParsedCorpus c = CorpusParser.fromMap(data, "hlc.yaml");
        assertEquals(1, c.standards().size());
        assertEquals("One", c.standards().get(0).title());
        assertTrue(c.rejections().get(0).reason().contains("duplicate"));
    }

    @Test
    void rejectsOnlyTheBrokenClause() {
        Map<String, Object> s = standard("1", "One");
        s.put("clauses", List.of(
                Map.of("id", "1.1", "title", "Good clause"),
                Map.of("title", "No id")));
        ParsedCorpus c = CorpusParser.fromMap(minimalWith("standards", List.of(s)), "hlc.yaml");
        assertEquals(1, c.standards().size());
        assertEquals(1, c.standards().get(0).clauses().size());
        assertEquals(1, c.rejections().size());
        assertEquals("HLC_1.clauses[1]", c.rejections().get(0).nodeRef());
    }

    @Test
    void nonMappingStandardEntryIsRejected() {
        ParsedCorpus c = CorpusParser.fromMap(minimalWith("standards", List.of("just a string")), "hlc.yaml");
        assertTrue(c.standards().isEmpty());
        assertEquals(1, c.rejections().size());
    }

    @Test
    void numericIdsAreReadAsText() {
        ParsedCorpus c = parseYaml("""
                accreditor: SACSCOC
                standards:
                  - id: 10
                    title: Financial Resources
                """, "sacscoc.yaml");
        assertEquals("SACSCOC_10", c.standards().get(0).id());
    }

    @Test
    void parsesYamlDates() {
        ParsedCorpus c = parseYaml("""
                accreditor: WASC
                metadata:
                  effective_date: 2023-07-01
                  last_updated: 2024-02-15
                standards: []
                """, "wasc.yaml");
        assertEquals(LocalDate.of(2023, 7, 1), c.metadata().effectiveDate());
        assertEquals(LocalDate.of(2024, 2, 15), c.metadata().lastUpdated());
    }

    @Test
    void unparsableDateIsIgnored() {
        ParsedCorpus c = CorpusParser.fromMap(minimalWith("metadata", Map.of("effective_date", "soon")), "hlc.yaml");
        assertNull(c.metadata().effectiveDate());
        assertEquals(1, c.standards().size());
    }

    @Test
    void parsesJson() {
        ParsedCorpus c = parseYaml("""
                {"accreditor": "NWCCU", "standards": [{"id": "1.A", "title": "Mission"}]}
                """, "nwccu.json");
        assertEquals("NWCCU_1.A", c.standards().get(0).id());
    }

    @Test
    void indicatorsAreFlattenedInOrder() {
        Map<String, Object> s = standard("1", "One");
        s.put("clauses", List.of(
                Map.of("id", "1.1", "title", "A", "indicators", List.of("first", "second")),
                Map.of("id", "1.2", "title", "B", "indicators", List.of("third"))));
        StandardNode node = CorpusParser.fromMap(minimalWith("standards", List.of(s)), "x.yaml").standards().get(0);
        assertEquals(List.of("first", "second", "third"), node.indicators());
        assertTrue(node.searchableText().contains("third"));
    }

    // -----------------------------------------------------------------------
    // File-level failures
    // -----------------------------------------------------------------------

    @Test
    void invalidYamlIsAParseError() {
        CorpusParseException e = assertThrows(CorpusParseException.class,
                () -> parseYaml("standards: [unterminated", "bad.yaml"));
        assertEquals("bad.yaml", e.source());
    }

    @Test
    void nonMappingDocumentIsAParseError() {
        assertThrows(CorpusParseException.class, () -> parseYaml("- just\n- a list\n", "list.yaml"));
    }

    @Test
    void standardsMustBeAList() {
        assertThrows(CorpusParseException.class,
                () -> CorpusParser.fromMap(minimalWith("standards", "none"), "hlc.yaml"));
    }

    @Test
    void metadataMustBeAMapping() {
        assertThrows(CorpusParseException.class,
                () -> CorpusParser.fromMap(minimalWith("metadata", List.of("x")), "hlc.yaml"));
    }

    @Test
    void yamlTagsCannotInstantiateClasses() {
        assertThrows(CorpusParseException.class,
                () -> parseYaml("accreditor: !!javax.script.ScriptEngineManager []\n", "evil.yaml"));
    }
}
