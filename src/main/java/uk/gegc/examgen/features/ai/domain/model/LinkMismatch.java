package uk.gegc.examgen.features.ai.domain.model;

import uk.gegc.examgen.features.content.domain.model.Question;

/**
 * A question the linker excluded, with the reference it carried.
 */
public record LinkMismatch(Question question, String referencedAssetId, String expectedAssetId, String message) {

    public IngestionFailure toFailure() {
        return IngestionFailure.of(RejectionReason.CROSS_REFERENCE_MISMATCH, IngestionState.VALIDATED, message, null);
    }
}
