package no.cantara.accreditation.engine.mapping;

/**
 * A text embedding service supplied by the host. Calls may be slow or fail; the
 * engine bounds them with a timeout.
 */
@FunctionalInterface
public interface EmbeddingModel {

    float[] embed(String text);
}
