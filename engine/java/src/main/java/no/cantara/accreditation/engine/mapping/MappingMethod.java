package no.cantara.accreditation.engine.mapping;

public enum MappingMethod {
    KEYWORD,
    EMBEDDING,
    HYBRID
}
