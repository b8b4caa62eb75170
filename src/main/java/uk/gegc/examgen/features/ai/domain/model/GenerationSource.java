package uk.gegc.examgen.features.ai.domain.model;

/**
 * Where the raw text of a generation unit came from.
 */
public enum GenerationSource {
    MODEL,
    EXAMPLE
}
