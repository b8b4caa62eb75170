package uk.gegc.examgen.features.ai.infra.parser;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.model.TargetLanguage;
import uk.gegc.examgen.features.content.domain.model.TranslationQuestion;

import java.time.Instant;

@Component
public class TranslationParser extends QuestionNodeParser {

    @Override
    public QuestionType supportedType() {
        return QuestionType.TRANSLATION;
    }

    @Override
    public Question parse(FieldReader reader, IngestionContext context, Instant receivedAt) {
        TranslationQuestion.TranslationQuestionBuilder<?, ?> builder = TranslationQuestion.builder()
                .sourceText(reader.localized("sourceText"))
                .targetLanguage(reader.enumValue("targetLanguage", TargetLanguage::fromCode))
                .acceptableTranslations(reader.strings("acceptableTranslations"));
        readCommon(builder, reader, context, receivedAt);
        return builder.build();
    }
}
