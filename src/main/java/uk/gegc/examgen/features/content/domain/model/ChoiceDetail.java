package uk.gegc.examgen.features.content.domain.model;

/**
 * One answer option of a multiple-choice question. Serialized as {@code {"text": ..., "isCorrect": ...}}.
 */
public record ChoiceDetail(String text, boolean correct) {

    public static ChoiceDetail correct(String text) {
        return new ChoiceDetail(text, true);
    }

    public static ChoiceDetail wrong(String text) {
        return new ChoiceDetail(text, false);
    }
}
