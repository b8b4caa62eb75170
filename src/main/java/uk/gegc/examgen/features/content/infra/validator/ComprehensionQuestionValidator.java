package uk.gegc.examgen.features.content.infra.validator;

import uk.gegc.examgen.features.content.domain.model.ComprehensionQuestion;
import uk.gegc.examgen.features.content.domain.validation.ViolationCode;

/**
 * Shared rules of reading and listening comprehension: a content reference and exactly one
 * answer mode.
 */
public abstract class ComprehensionQuestionValidator<T extends ComprehensionQuestion> extends QuestionValidator<T> {

    protected ComprehensionQuestionValidator(Class<T> questionClass) {
        super(questionClass);
    }

    @Override
    protected void validateVariant(T question, ViolationCollector collector) {
        collector.require("questionText", question.getQuestionText());
        collector.require("contentAssetId", question.getContentAssetId());

        boolean hasChoices = question.getChoices() != null;
        boolean hasAnswers = question.getAcceptableAnswers() != null;
        if (hasChoices == hasAnswers) {
            collector.add("choices", ViolationCode.ANSWER_MODE_EXCLUSIVE,
                    hasChoices
                            ? "only one of 'choices' and 'acceptableAnswers' may be set"
                            : "one of 'choices' and 'acceptableAnswers' must be set");
            return;
        }
        if (hasChoices) {
            collector.requireChoices("choices", question.getChoices());
        } else {
            collector.requireAnswers("acceptableAnswers", question.getAcceptableAnswers());
        }
    }
}
