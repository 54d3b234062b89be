package no.cantara.accreditation.engine.evidence;

/**
 * Read view over mappings and their trust, consumed by risk and compliance scoring.
 */
public interface EvidenceLedger {

    StandardEvidence evidenceFor(String standardId);
}
