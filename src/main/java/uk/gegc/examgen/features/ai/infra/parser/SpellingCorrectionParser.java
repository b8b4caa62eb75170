package uk.gegc.examgen.features.ai.infra.parser;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.model.SpellingCorrectionQuestion;

import java.time.Instant;

@Component
public class SpellingCorrectionParser extends QuestionNodeParser {

    @Override
    public QuestionType supportedType() {
        return QuestionType.SPELLING_CORRECTION;
    }

    @Override
    public Question parse(FieldReader reader, IngestionContext context, Instant receivedAt) {
        SpellingCorrectionQuestion.SpellingCorrectionQuestionBuilder<?, ?> builder = SpellingCorrectionQuestion.builder()
                .wordChoices(reader.strings("wordChoices"))
                .correctWord(reader.text("correctWord"))
                .sentenceWithMisspelledWord(reader.text("sentenceWithMisspelledWord"))
                .misspelledWordInSentence(reader.text("misspelledWordInSentence"));
        readCommon(builder, reader, context, receivedAt);
        return builder.build();
    }
}
