package no.cantara.accreditation.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class AccreditationCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return AccreditationCli.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static String path(String resource) {
        return TestCorpus.resource(resource).toString();
    }

    @Test
    void printsJsonReport() throws Exception {
        int exit = run(path("corpus"), "--evidence", path("evidence/faculty-handbook.txt"),
                "--scope", "SACSCOC", "--crosswalk", "SACSCOC:HLC", "--config", path("settings.yaml"));
        assertEquals(0, exit, err.toString(StandardCharsets.UTF_8));

        JsonNode report = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals(2, report.get("corpora").size());
        assertEquals("SACSCOC_8.1", report.get("mappings").get(0).get("standard_id").asText());
        assertEquals("SACSCOC", report.get("compliance").get("scope").asText());
        assertEquals(3, report.get("compliance").get("total_standards").asInt());
        assertEquals(3, report.get("risk").get("scored").asInt());
        assertEquals("HLC", report.get("crosswalk").get("target").asText());
        assertTrue(report.get("mapping_statistics").get("total").asInt() > 0);
    }

    @Test
    void defaultsToEveryCorpus() throws Exception {
        assertEquals(0, run(path("corpus")));
        JsonNode report = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals("ALL", report.get("compliance").get("scope").asText());
        assertEquals(5, report.get("risk").get("scored").asInt());
        assertEquals(0, report.get("mappings").size());
    }

    @Test
    void usageErrorsExitWithOne() {
        assertEquals(1, run());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
        assertEquals(1, run(path("corpus"), "--bogus"));
        assertEquals(1, run(path("corpus"), "--crosswalk", "SACSCOC"));
        assertEquals(1, run(path("corpus"), "--scope"));
    }

    @Test
    void unknownScopeExitsWithTwo() {
        assertEquals(2, run(path("corpus"), "--scope", "NOPE"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("NOPE"));
    }

    @Test
    void parsesRepeatedEvidence() {
        AccreditationCli.Options options = AccreditationCli.parse(
                new String[]{"corpus", "--evidence", "a.txt", "--evidence", "b.txt"});
        assertEquals(2, options.evidence().size());
        assertNull(options.scope());
    }
}
