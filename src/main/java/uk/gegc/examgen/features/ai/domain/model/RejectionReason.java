package uk.gegc.examgen.features.ai.domain.model;

public enum RejectionReason {
    EMPTY_RESPONSE,
    JSON_PARSE_ERROR,
    UNKNOWN_DISCRIMINATOR,
    INVARIANT_VIOLATION,
    CROSS_REFERENCE_MISMATCH,
    COLLABORATOR_FAILURE
}
