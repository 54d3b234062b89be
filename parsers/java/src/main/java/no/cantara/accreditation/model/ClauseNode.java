package no.cantara.accreditation.model;

import java.util.List;

/**
 * A clause nested under a {@link StandardNode}, with its evidence indicators.
 */
public record ClauseNode(
        String id,
        String title,
        String description,
        List<String> indicators
) {
    public ClauseNode {
        description = description != null ? description : "";
        indicators = indicators != null ? List.copyOf(indicators) : List.of();
    }
}
