package no.cantara.accreditation.engine.mapping;

import java.util.List;

/**
 * Result of mapping one document.
 *
 * @param mappings matching standards, highest confidence first
 * @param timedOut true when the embedding budget ran out and later excerpts were scored by keywords only
 */
public record MappingRun(List<EvidenceMapping> mappings, boolean timedOut) {

    public MappingRun {
        mappings = List.copyOf(mappings);
    }

    public static MappingRun empty() {
        return new MappingRun(List.of(), false);
    }
}
