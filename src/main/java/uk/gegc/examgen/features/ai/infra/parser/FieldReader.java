package uk.gegc.examgen.features.ai.infra.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import uk.gegc.examgen.features.content.application.DifficultyCatalog;
import uk.gegc.examgen.features.content.domain.model.ChoiceDetail;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.LocalizedString;
import uk.gegc.examgen.features.content.domain.model.Stage;
import uk.gegc.examgen.features.content.domain.validation.InvariantViolation;
import uk.gegc.examgen.features.content.domain.validation.ViolationCode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Field-by-field coercion of a parsed JSON object. A value of the wrong JSON type is recorded
 * as a {@link ViolationCode#TYPE_MISMATCH} and read as absent; nothing here throws. Absent and
 * JSON {@code null} are treated alike.
 */
public class FieldReader {

    private final ObjectNode node;
    private final String prefix;
    private final List<InvariantViolation> violations;

    public FieldReader(ObjectNode node) {
        this(node, "", new ArrayList<>());
    }

    private FieldReader(ObjectNode node, String prefix, List<InvariantViolation> violations) {
        this.node = node;
        this.prefix = prefix;
        this.violations = violations;
    }

    public boolean has(String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull();
    }

    public String text(String field) {
        JsonNode value = value(field);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            mismatch(field, "string", value);
            return null;
        }
        return value.asText();
    }

    public Integer integer(String field) {
        JsonNode value = value(field);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            mismatch(field, "integer", value);
            return null;
        }
        return value.intValue();
    }

    public Double number(String field) {
        JsonNode value = value(field);
        if (value == null) {
            return null;
        }
        if (!value.isNumber()) {
            mismatch(field, "number", value);
            return null;
        }
        return value.doubleValue();
    }

    public Boolean bool(String field) {
        JsonNode value = value(field);
        if (value == null) {
            return null;
        }
        if (!value.isBoolean()) {
            mismatch(field, "boolean", value);
            return null;
        }
        return value.booleanValue();
    }

    public Instant instant(String field) {
        String value = text(field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            record(field, ViolationCode.TYPE_MISMATCH, "expected an ISO-8601 instant, got '" + value + "'");
            return null;
        }
    }

    /**
     * Reads a closed-set tag. A string outside the set is an {@link ViolationCode#UNKNOWN_VALUE}.
     */
    public <E> E enumValue(String field, Function<String, Optional<E>> lookup) {
        String tag = text(field);
        if (tag == null) {
            return null;
        }
        Optional<E> resolved = lookup.apply(tag);
        if (resolved.isEmpty()) {
            record(field, ViolationCode.UNKNOWN_VALUE, "'" + tag + "' is not a recognised value");
            return null;
        }
        return resolved.get();
    }

    public List<String> strings(String field) {
        JsonNode value = value(field);
        if (value == null) {
            return null;
        }
        if (!value.isArray()) {
            mismatch(field, "list of strings", value);
            return null;
        }
        List<String> result = new ArrayList<>();
        for (int i = 0; i < value.size(); i++) {
            JsonNode element = value.get(i);
            if (!element.isTextual()) {
                mismatch(field + "[" + i + "]", "string", element);
                continue;
            }
            result.add(element.asText());
        }
        return Collections.unmodifiableList(result);
    }

    public LocalizedString localized(String field) {
        FieldReader nested = object(field);
        if (nested == null) {
            return null;
        }
        return LocalizedString.of(nested.text("en"), nested.text("zh_tw"));
    }

    /**
     * Explanation in either wire form: an {@code explanation} object, or the flat pair
     * {@code explanation_en} / {@code explanation_zh_tw}. Half a flat pair reads as a localized
     * string with one half missing, which the validator reports.
     */
    public LocalizedString explanation() {
        if (has("explanation")) {
            return localized("explanation");
        }
        if (!has("explanation_en") && !has("explanation_zh_tw")) {
            return null;
        }
        return LocalizedString.of(text("explanation_en"), text("explanation_zh_tw"));
    }

    /**
     * Difficulty object. A missing {@code name} is derived from stage and grade.
     */
    public DifficultyDetail difficulty(String field) {
        FieldReader nested = object(field);
        if (nested == null) {
            return null;
        }
        Stage stage = nested.enumValue("stage", Stage::fromTag);
        Integer grade = nested.integer("grade");
        Integer level = nested.integer("level");
        if (grade == null && !nested.has("grade")) {
            violations.add(InvariantViolation.required(nested.path("grade")));
        }
        if (level == null && !nested.has("level")) {
            violations.add(InvariantViolation.required(nested.path("level")));
        }
        LocalizedString name = nested.has("name")
                ? nested.localized("name")
                : stage != null && grade != null ? DifficultyCatalog.nameFor(stage, grade) : null;
        return new DifficultyDetail(stage, grade == null ? 0 : grade, level == null ? 0 : level, name);
    }

    /**
     * Choice list. An element that is not an object is kept as a {@code null} entry so its index
     * still lines up with the payload.
     */
    public List<ChoiceDetail> choices(String field) {
        JsonNode value = value(field);
        if (value == null) {
            return null;
        }
        if (!value.isArray()) {
            mismatch(field, "list of choice objects", value);
            return null;
        }
        List<ChoiceDetail> result = new ArrayList<>();
        for (int i = 0; i < value.size(); i++) {
            String elementField = field + "[" + i + "]";
            JsonNode element = value.get(i);
            if (!element.isObject()) {
                mismatch(elementField, "choice object", element);
                result.add(null);
                continue;
            }
            FieldReader choice = new FieldReader((ObjectNode) element, path(elementField) + ".", violations);
            String text = choice.text("text");
            Boolean correct = choice.bool("isCorrect");
            if (correct == null && !choice.has("isCorrect")) {
                violations.add(InvariantViolation.required(choice.path("isCorrect")));
            }
            result.add(new ChoiceDetail(text, Boolean.TRUE.equals(correct)));
        }
        return Collections.unmodifiableList(result);
    }

    public List<InvariantViolation> violations() {
        return List.copyOf(violations);
    }

    private FieldReader object(String field) {
        JsonNode value = value(field);
        if (value == null) {
            return null;
        }
        if (!value.isObject()) {
            mismatch(field, "object", value);
            return null;
        }
        return new FieldReader((ObjectNode) value, path(field) + ".", violations);
    }

    private JsonNode value(String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value;
    }

    private void mismatch(String field, String expected, JsonNode actual) {
        record(field, ViolationCode.TYPE_MISMATCH,
                "expected " + expected + ", got " + actual.getNodeType().name().toLowerCase());
    }

    private void record(String field, ViolationCode code, String message) {
        violations.add(InvariantViolation.of(path(field), code, message));
    }

    private String path(String field) {
        return prefix + field;
    }
}
