package no.cantara.accreditation.engine.mapping;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MappingRepository} over a {@link ConcurrentHashMap}. {@code compute} locks
 * the key's bin, which gives per-key write serialization.
 *
 * <p>Keys are also indexed by standard and by document. An index entry is added before
 * its mapping is published and may outlive it after a removal; lookups resolve keys
 * against the primary map and skip the missing ones.
 */
public class InMemoryMappingRepository implements MappingRepository {

    private static final Comparator<EvidenceMapping> ORDER = Comparator
            .comparing(EvidenceMapping::documentId)
            .thenComparing(EvidenceMapping::standardId);

    private final Map<MappingKey, EvidenceMapping> mappings = new ConcurrentHashMap<>();
    private final Map<String, Set<MappingKey>> byStandard = new ConcurrentHashMap<>();
    private final Map<String, Set<MappingKey>> byDocument = new ConcurrentHashMap<>();

    @Override
    public EvidenceMapping upsert(EvidenceMapping mapping) {
        return mappings.compute(mapping.key(), (key, previous) -> {
            index(byStandard, key.standardId(), key);
            index(byDocument, key.documentId(), key);
            return previous == null ? mapping : mapping.replacing(previous);
        });
    }

    @Override
    public Optional<EvidenceMapping> find(MappingKey key) {
        return Optional.ofNullable(mappings.get(key));
    }

    @Override
    public List<EvidenceMapping> findByStandard(String standardId) {
        return resolve(byStandard.get(standardId));
    }

    @Override
    public List<EvidenceMapping> findByDocument(String documentId) {
        return resolve(byDocument.get(documentId));
    }

    @Override
    public List<EvidenceMapping> findAll() {
        return mappings.values().stream().sorted(ORDER).toList();
    }

    @Override
    public int removeDocument(String documentId) {
        Set<MappingKey> keys = byDocument.remove(documentId);
        if (keys == null) return 0;
        int removed = 0;
        for (MappingKey key : keys) {
            if (mappings.remove(key) != null) removed++;
            Set<MappingKey> siblings = byStandard.get(key.standardId());
            if (siblings != null) siblings.remove(key);
        }
        return removed;
    }

    @Override
    public int size() {
        return mappings.size();
    }

    private static void index(Map<String, Set<MappingKey>> index, String id, MappingKey key) {
        index.computeIfAbsent(id, ignored -> ConcurrentHashMap.newKeySet()).add(key);
    }

    private List<EvidenceMapping> resolve(Set<MappingKey> keys) {
        if (keys == null) return List.of();
        return keys.stream()
                .map(mappings::get)
                .filter(Objects::nonNull)
                .sorted(ORDER)
                .toList();
    }
}
