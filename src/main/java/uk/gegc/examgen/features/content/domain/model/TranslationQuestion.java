package uk.gegc.examgen.features.content.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Getter
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TranslationQuestion extends Question {

    private final LocalizedString sourceText;

    private final TargetLanguage targetLanguage;

    private final List<String> acceptableTranslations;

    public List<String> getAcceptableTranslations() {
        return ContentLists.readOnly(acceptableTranslations);
    }

    @Override
    public QuestionType getQuestionType() {
        return QuestionType.TRANSLATION;
    }
}
