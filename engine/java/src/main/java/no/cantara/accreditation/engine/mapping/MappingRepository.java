package no.cantara.accreditation.engine.mapping;

import java.util.List;
import java.util.Optional;

/**
 * Store of evidence mappings keyed by (document, standard). Implementations
 * serialize writes per key and allow writes to different keys in parallel.
 */
public interface MappingRepository {

    /**
     * Inserts the mapping or replaces the one stored under the same key. A replacement
     * keeps the creation time of the record it replaces.
     *
     * @return the stored mapping
     */
    EvidenceMapping upsert(EvidenceMapping mapping);

    Optional<EvidenceMapping> find(MappingKey key);

    List<EvidenceMapping> findByStandard(String standardId);

    List<EvidenceMapping> findByDocument(String documentId);

    List<EvidenceMapping> findAll();

    int removeDocument(String documentId);

    int size();
}
