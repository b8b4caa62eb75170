package uk.gegc.examgen.shared.exception;

import uk.gegc.examgen.features.content.domain.validation.InvariantViolation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@code requireValid} style APIs with every violation found on the entity.
 */
public class ValidationException extends RuntimeException {

    private final List<InvariantViolation> violations;

    public ValidationException(String subject, List<InvariantViolation> violations) {
        super(subject + " failed validation: " + violations.stream()
                .map(InvariantViolation::describe)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<InvariantViolation> getViolations() {
        return violations;
    }
}
