package uk.gegc.examgen.features.content.domain.validation;

/**
 * One broken rule on one field. {@code field} is a dotted path, e.g. {@code choices[1].text}.
 */
public record InvariantViolation(String field, ViolationCode code, String message) {

    public static InvariantViolation of(String field, ViolationCode code, String message) {
        return new InvariantViolation(field, code, message);
    }

    public static InvariantViolation required(String field) {
        return new InvariantViolation(field, ViolationCode.REQUIRED_FIELD, "'" + field + "' is required");
    }

    public String describe() {
        return field + " [" + code + "]: " + message;
    }
}
