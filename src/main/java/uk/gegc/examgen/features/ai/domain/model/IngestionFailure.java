package uk.gegc.examgen.features.ai.domain.model;

import uk.gegc.examgen.features.content.domain.validation.InvariantViolation;

import java.util.List;

/**
 * Structured reason a generation unit was rejected.
 *
 * @param reason     taxonomy entry
 * @param failedAt   state the unit failed in ({@code REQUESTED} for collaborator failures,
 *                   {@code RAW_RECEIVED} for empty text, one of the {@code *_FAILED} states otherwise)
 * @param message    human-readable summary
 * @param violations every rule failure, for {@link RejectionReason#INVARIANT_VIOLATION}
 * @param rawText    the untouched input, kept for diagnostics; may be null
 */
public record IngestionFailure(RejectionReason reason,
                               IngestionState failedAt,
                               String message,
                               List<InvariantViolation> violations,
                               String rawText) {

    public IngestionFailure {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static IngestionFailure of(RejectionReason reason, IngestionState failedAt, String message, String rawText) {
        return new IngestionFailure(reason, failedAt, message, List.of(), rawText);
    }

    /**
     * First {@code maxLength} characters of the raw text, for logs and UI hints.
     */
    public String snippet(int maxLength) {
        if (rawText == null) {
            return "";
        }
        return rawText.length() <= maxLength ? rawText : rawText.substring(0, maxLength) + "...";
    }
}
