package uk.gegc.examgen.features.content.infra.validator;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.model.TranslationQuestion;

@Component
public class TranslationValidator extends QuestionValidator<TranslationQuestion> {

    public TranslationValidator() {
        super(TranslationQuestion.class);
    }

    @Override
    public QuestionType supportedType() {
        return QuestionType.TRANSLATION;
    }

    @Override
    protected void validateVariant(TranslationQuestion question, ViolationCollector collector) {
        collector.requireLocalized("sourceText", question.getSourceText());
        collector.require("targetLanguage", question.getTargetLanguage());
        collector.requireAnswers("acceptableTranslations", question.getAcceptableTranslations());
    }
}
