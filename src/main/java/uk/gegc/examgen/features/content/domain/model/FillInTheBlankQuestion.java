package uk.gegc.examgen.features.content.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * Sentence with a blank. {@code answerInputType} decides which of {@code choices} or
 * {@code acceptableAnswers} carries the answer; exactly one of them may be set.
 */
@Getter
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class FillInTheBlankQuestion extends Question {

    private final AnswerInputType answerInputType;

    private final List<ChoiceDetail> choices;

    private final List<String> acceptableAnswers;

    public List<ChoiceDetail> getChoices() {
        return ContentLists.readOnly(choices);
    }

    public List<String> getAcceptableAnswers() {
        return ContentLists.readOnly(acceptableAnswers);
    }

    @Override
    public QuestionType getQuestionType() {
        return QuestionType.FILL_IN_THE_BLANK;
    }
}
