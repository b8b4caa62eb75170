package uk.gegc.examgen.features.content.domain.validation;

/**
 * Which rule an {@link InvariantViolation} broke.
 */
public enum ViolationCode {
    /** A non-optional field is absent. */
    REQUIRED_FIELD,
    /** The wire value has the wrong JSON type for the field, e.g. a string where a list is required. */
    TYPE_MISMATCH,
    /** A list or string that must carry content is empty or blank. */
    NON_EMPTY,
    /** Zero or two-plus choices are flagged correct. */
    EXACTLY_ONE_CORRECT_CHOICE,
    /** Both or neither of {@code choices} and {@code acceptableAnswers} are set. */
    ANSWER_MODE_EXCLUSIVE,
    /** The answer list present does not match {@code answerInputType}. */
    ANSWER_MODE_MISMATCH,
    VALUE_OUT_OF_RANGE,
    CORRECT_WORD_NOT_IN_CHOICES,
    /** Both or neither of the word-choice and sentence spelling modes are set. */
    SPELLING_MODE_EXCLUSIVE,
    /** An enumerated field carries a value outside its closed set. */
    UNKNOWN_VALUE
}
