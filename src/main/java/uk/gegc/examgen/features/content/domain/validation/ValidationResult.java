package uk.gegc.examgen.features.content.domain.validation;

import java.util.List;

/**
 * Outcome of validating one entity: the entity itself plus every violation found on it.
 */
public record ValidationResult<T>(T entity, List<InvariantViolation> violations) {

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public static <T> ValidationResult<T> of(T entity, List<InvariantViolation> violations) {
        return new ValidationResult<>(entity, violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
