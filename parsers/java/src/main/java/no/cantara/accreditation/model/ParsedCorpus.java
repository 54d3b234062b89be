package no.cantara.accreditation.model;

import java.util.List;

/**
 * The validated content of a single corpus file.
 */
public record ParsedCorpus(
        CorpusMetadata metadata,
        List<StandardNode> standards,
        List<Rejection> rejections
) {
    public ParsedCorpus {
        standards = standards != null ? List.copyOf(standards) : List.of();
        rejections = rejections != null ? List.copyOf(rejections) : List.of();
    }

    public String accreditor() {
        return metadata.accreditor();
    }
}
