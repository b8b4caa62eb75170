package uk.gegc.examgen.features.ai.domain.model;

import uk.gegc.examgen.features.content.domain.model.Question;

import java.util.List;

/**
 * Outcome of a question batch. Elements run independently; the batch is accepted when at
 * least one element survives. {@code batchFailure} is set when the envelope itself failed
 * and no element was examined.
 */
public record BatchIngestionResult(int requested,
                                   List<Question> accepted,
                                   List<ElementRejection> rejections,
                                   IngestionFailure batchFailure) {

    public BatchIngestionResult {
        accepted = List.copyOf(accepted);
        rejections = List.copyOf(rejections);
    }

    public static BatchIngestionResult failed(int requested, IngestionFailure failure) {
        return new BatchIngestionResult(requested, List.of(), List.of(), failure);
    }

    public int acceptedCount() {
        return accepted.size();
    }

    public boolean isAccepted() {
        return !accepted.isEmpty();
    }

    /**
     * True when fewer questions survived than were requested, so the caller may ask for more.
     */
    public boolean needsTopUp() {
        return accepted.size() < requested;
    }
}
