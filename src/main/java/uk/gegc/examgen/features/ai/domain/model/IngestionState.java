package uk.gegc.examgen.features.ai.domain.model;

/**
 * States of one generation unit. {@code ACCEPTED} and {@code REJECTED} are terminal; every
 * failure branch ends in {@code REJECTED}, recording where it failed.
 */
public enum IngestionState {
    REQUESTED,
    RAW_RECEIVED,
    PARSED,
    DISCRIMINATOR_RESOLVED,
    VALIDATED,
    ACCEPTED,
    PARSE_FAILED,
    RESOLUTION_FAILED,
    VALIDATION_FAILED,
    REJECTED
}
