package no.cantara.accreditation.engine.crosswalk;

import no.cantara.accreditation.engine.ExplainedValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Crosswalk matches grouped by source standard id, in source corpus order. Only
 * source standards with at least one match appear.
 *
 * @param timedOut         True when the time budget ran out; {@code matches} then covers
 *                         only the source standards compared so far.
 * @param coverageEstimate Share of source standards with at least one match.
 */
public record CrosswalkResult(
        String sourceAccreditor,
        String targetAccreditor,
        Map<String, List<CrosswalkMatch>> matches,
        boolean timedOut,
        ExplainedValue coverageEstimate
) {
    public CrosswalkResult {
        Map<String, List<CrosswalkMatch>> copy = new LinkedHashMap<>();
        matches.forEach((id, list) -> copy.put(id, List.copyOf(list)));
        matches = Collections.unmodifiableMap(copy);
    }

    public int matchCount() {
        return matches.values().stream().mapToInt(List::size).sum();
    }
}
