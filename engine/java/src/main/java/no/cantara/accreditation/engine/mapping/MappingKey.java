package no.cantara.accreditation.engine.mapping;

import java.util.Objects;

/** Identity of an {@link EvidenceMapping}: one document against one standard. */
public record MappingKey(String documentId, String standardId) {

    public MappingKey {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(standardId, "standardId");
    }
}
