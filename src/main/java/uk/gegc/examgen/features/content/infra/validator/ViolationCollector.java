package uk.gegc.examgen.features.content.infra.validator;

import uk.gegc.examgen.features.content.domain.model.ChoiceDetail;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.LocalizedString;
import uk.gegc.examgen.features.content.domain.validation.InvariantViolation;
import uk.gegc.examgen.features.content.domain.validation.ViolationCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call accumulator for violations. Every check records and moves on, so one pass reports
 * everything wrong with an entity. Created fresh for each validation call.
 */
public class ViolationCollector {

    private final List<InvariantViolation> violations = new ArrayList<>();

    public void add(String field, ViolationCode code, String message) {
        violations.add(InvariantViolation.of(field, code, message));
    }

    public boolean require(String field, Object value) {
        if (value == null) {
            violations.add(InvariantViolation.required(field));
            return false;
        }
        return true;
    }

    public void requireNotEmpty(String field, String value) {
        if (require(field, value) && value.isEmpty()) {
            add(field, ViolationCode.NON_EMPTY, "'" + field + "' must not be empty");
        }
    }

    public void requireLocalized(String field, LocalizedString value) {
        if (require(field, value)) {
            checkLocalized(field, value);
        }
    }

    /**
     * Both halves of an optional localized string must be present once the string itself is.
     */
    public void checkLocalized(String field, LocalizedString value) {
        if (value == null) {
            return;
        }
        require(field + ".en", value.en());
        require(field + ".zh_tw", value.zhTw());
    }

    public void requireDifficulty(String field, DifficultyDetail difficulty) {
        if (!require(field, difficulty)) {
            return;
        }
        require(field + ".stage", difficulty.stage());
        if (difficulty.grade() < DifficultyDetail.MIN_GRADE) {
            add(field + ".grade", ViolationCode.VALUE_OUT_OF_RANGE,
                    "grade must be >= " + DifficultyDetail.MIN_GRADE + ", was " + difficulty.grade());
        }
        if (difficulty.level() < DifficultyDetail.MIN_LEVEL || difficulty.level() > DifficultyDetail.MAX_LEVEL) {
            add(field + ".level", ViolationCode.VALUE_OUT_OF_RANGE,
                    "level must be within [" + DifficultyDetail.MIN_LEVEL + ", " + DifficultyDetail.MAX_LEVEL
                            + "], was " + difficulty.level());
        }
        requireLocalized(field + ".name", difficulty.name());
    }

    /**
     * Optional list: when present, no entry may be absent.
     */
    public void checkEntries(String field, List<String> values) {
        if (values == null) {
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            require(field + "[" + i + "]", values.get(i));
        }
    }

    /**
     * Required answer list: non-empty, and every entry is a non-empty string, the same rule
     * {@link #requireChoices} applies to choice text.
     */
    public void requireAnswers(String field, List<String> values) {
        if (!require(field, values)) {
            return;
        }
        if (values.isEmpty()) {
            add(field, ViolationCode.NON_EMPTY, "'" + field + "' must contain at least one entry");
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            requireNotEmpty(field + "[" + i + "]", values.get(i));
        }
    }

    /**
     * Non-empty choice list with non-empty texts and exactly one correct entry.
     */
    public void requireChoices(String field, List<ChoiceDetail> choices) {
        if (!require(field, choices)) {
            return;
        }
        if (choices.isEmpty()) {
            add(field, ViolationCode.NON_EMPTY, "'" + field + "' must contain at least one choice");
            return;
        }
        int correct = 0;
        for (int i = 0; i < choices.size(); i++) {
            ChoiceDetail choice = choices.get(i);
            if (choice == null) {
                violations.add(InvariantViolation.required(field + "[" + i + "]"));
                continue;
            }
            requireNotEmpty(field + "[" + i + "].text", choice.text());
            if (choice.correct()) {
                correct++;
            }
        }
        if (correct != 1) {
            add(field, ViolationCode.EXACTLY_ONE_CORRECT_CHOICE,
                    "exactly one choice must be correct, found " + correct);
        }
    }

    public List<InvariantViolation> violations() {
        return List.copyOf(violations);
    }
}
