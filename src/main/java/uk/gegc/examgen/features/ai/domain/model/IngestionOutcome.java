package uk.gegc.examgen.features.ai.domain.model;

import java.util.Optional;

/**
 * Terminal result of one pipeline run: the accepted entity or the failure, never both.
 */
public final class IngestionOutcome<T> {

    private final T entity;
    private final IngestionFailure failure;

    private IngestionOutcome(T entity, IngestionFailure failure) {
        this.entity = entity;
        this.failure = failure;
    }

    public static <T> IngestionOutcome<T> accepted(T entity) {
        return new IngestionOutcome<>(entity, null);
    }

    public static <T> IngestionOutcome<T> rejected(IngestionFailure failure) {
        return new IngestionOutcome<>(null, failure);
    }

    public boolean isAccepted() {
        return failure == null;
    }

    public IngestionState state() {
        return isAccepted() ? IngestionState.ACCEPTED : IngestionState.REJECTED;
    }

    public Optional<T> entity() {
        return Optional.ofNullable(entity);
    }

    public Optional<IngestionFailure> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * @throws IllegalStateException when the outcome is a rejection
     */
    public T getEntity() {
        if (entity == null) {
            throw new IllegalStateException("Outcome was rejected: " + failure.message());
        }
        return entity;
    }

    /**
     * @throws IllegalStateException when the outcome was accepted
     */
    public IngestionFailure getFailure() {
        if (failure == null) {
            throw new IllegalStateException("Outcome was accepted");
        }
        return failure;
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted[" + entity + "]" : "Rejected[" + failure + "]";
    }
}
