package no.cantara.accreditation.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import no.cantara.accreditation.engine.compliance.ComplianceReport;
import no.cantara.accreditation.engine.crosswalk.CrosswalkMatch;
import no.cantara.accreditation.engine.crosswalk.CrosswalkResult;
import no.cantara.accreditation.engine.mapping.EvidenceMapping;
import no.cantara.accreditation.engine.mapping.Excerpt;
import no.cantara.accreditation.engine.mapping.MappingStatistics;
import no.cantara.accreditation.engine.risk.RiskScore;
import no.cantara.accreditation.engine.risk.RiskSummary;
import no.cantara.accreditation.model.CorpusMetadata;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * JSON rendering of engine results, with snake_case field names.
 */
public final class JsonReport {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonReport() {}

    public static ObjectNode corpus(List<CorpusMetadata> metadata) {
        ObjectNode node = MAPPER.createObjectNode();
        ArrayNode corpora = node.putArray("corpora");
        for (CorpusMetadata m : metadata) {
            ObjectNode c = corpora.addObject();
            c.put("accreditor", m.accreditor());
            c.put("name", m.name());
            c.put("version", m.version());
            c.put("effective_date", m.effectiveDate() != null ? m.effectiveDate().toString() : null);
            c.put("last_updated", m.lastUpdated() != null ? m.lastUpdated().toString() : null);
            c.put("source_url", m.sourceUrl());
            c.put("license", m.license());
            c.put("disclaimer", m.disclaimer());
            c.put("coverage_notes", m.coverageNotes());
            c.put("standard_count", m.standardCount());
            c.put("loaded_node_count", m.loadedNodeCount());
            c.put("source_file", m.sourceFile());
        }
        return node;
    }

    public static ArrayNode mappings(Collection<EvidenceMapping> mappings) {
        ArrayNode array = MAPPER.createArrayNode();
        for (EvidenceMapping m : mappings) {
            ObjectNode node = array.addObject();
            node.put("document_id", m.documentId());
            node.put("standard_id", m.standardId());
            node.put("confidence_score", m.confidenceScore());
            node.put("confidence_band", m.band().name().toLowerCase(Locale.ROOT));
            node.put("mapping_method", m.method().name().toLowerCase(Locale.ROOT));
            node.put("explanation", m.explanation());
            ArrayNode excerpts = node.putArray("excerpts");
            for (Excerpt e : m.excerpts()) {
                ObjectNode x = excerpts.addObject();
                x.put("text", e.text());
                x.put("page_number", e.pageNumber());
                x.put("score", e.score());
                ArrayNode keywords = x.putArray("matched_keywords");
                e.matchedKeywords().forEach(keywords::add);
            }
            node.put("updated_at", m.updatedAt().toString());
        }
        return array;
    }

    public static ObjectNode statistics(MappingStatistics stats) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("total", stats.total());
        node.put("average_confidence", stats.averageConfidence());
        node.put("with_excerpts", stats.withExcerpts());
        ObjectNode bands = node.putObject("by_band");
        stats.byBand().forEach((band, count) -> bands.put(band.name().toLowerCase(Locale.ROOT), count));
        ObjectNode accreditors = node.putObject("by_accreditor");
        stats.byAccreditor().forEach((code, count) -> accreditors.put(code, count.intValue()));
        return node;
    }

    public static ObjectNode compliance(ComplianceReport report) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("scope", report.scope());
        node.put("total_standards", report.totalStandards());
        node.put("mapped_standards", report.mappedStandards());
        explained(node, "coverage", report.coverage());
        explained(node, "average_trust", report.averageTrust());
        explained(node, "compliance_score", report.complianceScore());
        ArrayNode gaps = node.putArray("unmapped_standards");
        report.unmappedStandards().forEach(gaps::add);
        return node;
    }

    public static ObjectNode risk(List<RiskScore> scores, RiskSummary summary) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("scored", summary.scored());
        explained(node, "average_risk", summary.averageRisk());
        ObjectNode buckets = node.putObject("buckets");
        summary.buckets().forEach((bucket, count) -> buckets.put(bucket.name().toLowerCase(Locale.ROOT), count));
        ArrayNode factors = node.putArray("top_factors");
        for (RiskSummary.FactorShare f : summary.topFactors()) {
            ObjectNode factor = factors.addObject();
            factor.put("factor", f.factor().label());
            factor.put("contribution", f.contribution());
            factor.put("share", f.share());
        }
        ArrayNode issues = node.putArray("top_issues");
        summary.topIssues().forEach(issues::add);
        ArrayNode standards = node.putArray("standards");
        for (RiskScore s : scores) {
            ObjectNode standard = standards.addObject();
            standard.put("standard_id", s.standardId());
            standard.put("coverage_gap", s.coverageGap());
            standard.put("evidence_quality", s.evidenceQuality());
            standard.put("mapping_density", s.mappingDensity());
            standard.put("recency", s.recency());
            standard.put("final_risk", s.finalRisk());
            standard.put("bucket", s.bucket().name().toLowerCase(Locale.ROOT));
            standard.put("explanation", s.explanation());
            ArrayNode predicted = standard.putArray("predicted_issues");
            s.predictedIssues().forEach(predicted::add);
        }
        return node;
    }

    public static ObjectNode crosswalk(CrosswalkResult result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("source", result.sourceAccreditor());
        node.put("target", result.targetAccreditor());
        node.put("timed_out", result.timedOut());
        explained(node, "coverage_estimate", result.coverageEstimate());
        ObjectNode matches = node.putObject("matches");
        result.matches().forEach((sourceId, list) -> {
            ArrayNode array = matches.putArray(sourceId);
            for (CrosswalkMatch m : list) {
                ObjectNode match = array.addObject();
                match.put("target_standard_id", m.targetStandardId());
                match.put("similarity", m.similarity());
                ArrayNode keywords = match.putArray("overlapping_keywords");
                m.overlappingKeywords().forEach(keywords::add);
            }
        });
        return node;
    }

    public static String write(ObjectNode node) {
        return node.toPrettyString();
    }

    private static void explained(ObjectNode parent, String field, ExplainedValue value) {
        ObjectNode node = parent.putObject(field);
        node.put("value", value.value());
        node.put("explanation", value.explanation());
    }
}
