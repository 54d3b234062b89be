package no.cantara.accreditation.engine.evidence;

import no.cantara.accreditation.engine.mapping.EvidenceDocument;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evidence documents known to the engine, by id. Registering a document with an
 * existing id replaces it.
 */
public class DocumentRegistry {

    private final Map<String, EvidenceDocument> documents = new ConcurrentHashMap<>();

    public EvidenceDocument register(EvidenceDocument document) {
        documents.put(document.id(), document);
        return document;
    }

    public Optional<EvidenceDocument> find(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    public boolean remove(String documentId) {
        return documents.remove(documentId) != null;
    }

    public int size() {
        return documents.size();
    }
}
