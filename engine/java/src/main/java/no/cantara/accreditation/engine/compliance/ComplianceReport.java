package no.cantara.accreditation.engine.compliance;

import no.cantara.accreditation.engine.ExplainedValue;

import java.util.List;

/**
 * Compliance of one scope. Every number carries its explanation.
 *
 * @param scope              Accreditor code, or {@code ALL}.
 * @param unmappedStandards  Standards in scope without any evidence.
 */
public record ComplianceReport(
        String scope,
        int totalStandards,
        int mappedStandards,
        ExplainedValue coverage,
        ExplainedValue averageTrust,
        ExplainedValue complianceScore,
        List<String> unmappedStandards
) {
    public ComplianceReport {
        unmappedStandards = List.copyOf(unmappedStandards);
    }
}
