package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.engine.Scores;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The link between one evidence document and one standard.
 *
 * @param accreditor      Accreditor owning the standard.
 * @param confidenceScore Highest excerpt score, clamped to [0,1].
 * @param excerpts        Supporting excerpts, best first.
 * @param explanation     Human-readable summary of the match.
 */
public record EvidenceMapping(
        String documentId,
        String standardId,
        String accreditor,
        double confidenceScore,
        List<Excerpt> excerpts,
        MappingMethod method,
        String explanation,
        Instant createdAt,
        Instant updatedAt
) {
    public EvidenceMapping {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(standardId, "standardId");
        confidenceScore = Scores.clamp(confidenceScore);
        excerpts = excerpts != null ? List.copyOf(excerpts) : List.of();
        method = method != null ? method : MappingMethod.KEYWORD;
        explanation = explanation != null ? explanation : "";
        updatedAt = updatedAt != null ? updatedAt : Instant.now();
        createdAt = createdAt != null ? createdAt : updatedAt;
    }

    public MappingKey key() {
        return new MappingKey(documentId, standardId);
    }

    public ConfidenceBand band() {
        return ConfidenceBand.of(confidenceScore);
    }

    public EvidenceMapping withAccreditor(String accreditor) {
        return new EvidenceMapping(documentId, standardId, accreditor, confidenceScore, excerpts, method,
                explanation, createdAt, updatedAt);
    }

    /** This mapping as a replacement of {@code previous}: keeps the original creation time. */
    public EvidenceMapping replacing(EvidenceMapping previous) {
        return new EvidenceMapping(documentId, standardId, accreditor, confidenceScore, excerpts, method,
                explanation, previous.createdAt(), updatedAt);
    }
}
