package uk.gegc.examgen.features.ai.infra.parser;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.model.ReadingComprehensionQuestion;

import java.time.Instant;

@Component
public class ReadingComprehensionParser extends QuestionNodeParser {

    @Override
    public QuestionType supportedType() {
        return QuestionType.READING_COMPREHENSION;
    }

    @Override
    public Question parse(FieldReader reader, IngestionContext context, Instant receivedAt) {
        ReadingComprehensionQuestion.ReadingComprehensionQuestionBuilder<?, ?> builder = ReadingComprehensionQuestion.builder()
                .contentAssetId(textOrDefault(reader, "contentAssetId", context.getContentAssetId()))
                .choices(reader.choices("choices"))
                .acceptableAnswers(reader.strings("acceptableAnswers"));
        readCommon(builder, reader, context, receivedAt);
        return builder.build();
    }
}
