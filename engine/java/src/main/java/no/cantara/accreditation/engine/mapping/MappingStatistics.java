package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.engine.Scores;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of a set of mappings.
 *
 * @param byBand       Count per confidence band; every band is present.
 * @param byAccreditor Count per accreditor, sorted by code.
 * @param withExcerpts Mappings carrying at least one excerpt.
 */
public record MappingStatistics(
        int total,
        double averageConfidence,
        Map<ConfidenceBand, Integer> byBand,
        Map<String, Integer> byAccreditor,
        int withExcerpts
) {
    public static MappingStatistics of(Collection<EvidenceMapping> mappings) {
        Map<ConfidenceBand, Integer> bands = new EnumMap<>(ConfidenceBand.class);
        for (ConfidenceBand band : ConfidenceBand.values()) {
            bands.put(band, 0);
        }
        Map<String, Integer> accreditors = new TreeMap<>();
        double sum = 0.0;
        int withExcerpts = 0;
        for (EvidenceMapping m : mappings) {
            bands.merge(m.band(), 1, Integer::sum);
            accreditors.merge(String.valueOf(m.accreditor()), 1, Integer::sum);
            sum += m.confidenceScore();
            if (!m.excerpts().isEmpty()) withExcerpts++;
        }
        return new MappingStatistics(
                mappings.size(),
                Scores.clamp(Scores.ratio(sum, mappings.size(), 0.0)),
                Collections.unmodifiableMap(bands),
                Collections.unmodifiableMap(accreditors),
                withExcerpts);
    }

    public int highConfidence() {
        return byBand.getOrDefault(ConfidenceBand.HIGH, 0);
    }
}
