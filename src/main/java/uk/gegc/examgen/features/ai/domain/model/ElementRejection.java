package uk.gegc.examgen.features.ai.domain.model;

/**
 * A dropped batch element, with its zero-based position in the envelope.
 */
public record ElementRejection(int index, IngestionFailure failure) {
}
