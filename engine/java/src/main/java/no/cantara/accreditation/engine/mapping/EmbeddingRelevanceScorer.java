package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.engine.Scores;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cosine similarity between the embedding of an excerpt and the embedding of the
 * standard's reference text. Negative similarity counts as zero.
 */
public class EmbeddingRelevanceScorer implements RelevanceScorer {

    private final EmbeddingModel model;
    private final Map<String, float[]> referenceEmbeddings = new ConcurrentHashMap<>();

    public EmbeddingRelevanceScorer(EmbeddingModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    @Override
    public Relevance score(String excerpt, StandardProfile profile) {
        float[] reference = referenceEmbeddings.computeIfAbsent(profile.referenceText(), model::embed);
        float[] candidate = model.embed(excerpt);
        return new Relevance(Scores.clamp(cosine(candidate, reference)), MappingMethod.EMBEDDING);
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalStateException("embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        return Scores.ratio(dot, Math.sqrt(normA) * Math.sqrt(normB), 0.0);
    }
}
