package uk.gegc.examgen.features.content.infra.validator;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.AnswerInputType;
import uk.gegc.examgen.features.content.domain.model.FillInTheBlankQuestion;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.validation.ViolationCode;

/**
 * Both or neither answer list is rejected regardless of {@code answerInputType}; a single list
 * must match the declared input type.
 */
@Component
public class FillInTheBlankValidator extends QuestionValidator<FillInTheBlankQuestion> {

    public FillInTheBlankValidator() {
        super(FillInTheBlankQuestion.class);
    }

    @Override
    public QuestionType supportedType() {
        return QuestionType.FILL_IN_THE_BLANK;
    }

    @Override
    protected void validateVariant(FillInTheBlankQuestion question, ViolationCollector collector) {
        collector.require("questionText", question.getQuestionText());
        AnswerInputType inputType = question.getAnswerInputType();
        collector.require("answerInputType", inputType);

        boolean hasChoices = question.getChoices() != null;
        boolean hasAnswers = question.getAcceptableAnswers() != null;
        if (hasChoices && hasAnswers) {
            collector.add("choices", ViolationCode.ANSWER_MODE_EXCLUSIVE,
                    "only one of 'choices' and 'acceptableAnswers' may be set");
            return;
        }
        if (!hasChoices && !hasAnswers) {
            collector.add("choices", ViolationCode.ANSWER_MODE_EXCLUSIVE,
                    "one of 'choices' and 'acceptableAnswers' must be set");
            return;
        }

        if (hasChoices) {
            if (inputType == AnswerInputType.TEXT_INPUT) {
                collector.add("answerInputType", ViolationCode.ANSWER_MODE_MISMATCH,
                        "TEXT_INPUT questions carry 'acceptableAnswers', not 'choices'");
            }
            collector.requireChoices("choices", question.getChoices());
        } else {
            if (inputType == AnswerInputType.MULTIPLE_CHOICE) {
                collector.add("answerInputType", ViolationCode.ANSWER_MODE_MISMATCH,
                        "MULTIPLE_CHOICE questions carry 'choices', not 'acceptableAnswers'");
            }
            collector.requireAnswers("acceptableAnswers", question.getAcceptableAnswers());
        }
    }
}
