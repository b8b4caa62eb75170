package uk.gegc.examgen.features.ai.infra.parser;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.AnswerInputType;
import uk.gegc.examgen.features.content.domain.model.FillInTheBlankQuestion;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

@Component
public class FillInTheBlankParser extends QuestionNodeParser {

    @Override
    public QuestionType supportedType() {
        return QuestionType.FILL_IN_THE_BLANK;
    }

    @Override
    public Question parse(FieldReader reader, IngestionContext context, Instant receivedAt) {
        FillInTheBlankQuestion.FillInTheBlankQuestionBuilder<?, ?> builder = FillInTheBlankQuestion.builder()
                .answerInputType(reader.enumValue("answerInputType", FillInTheBlankParser::inputType))
                .choices(reader.choices("choices"))
                .acceptableAnswers(reader.strings("acceptableAnswers"));
        readCommon(builder, reader, context, receivedAt);
        return builder.build();
    }

    private static Optional<AnswerInputType> inputType(String tag) {
        return Arrays.stream(AnswerInputType.values())
                .filter(type -> type.name().equals(tag))
                .findFirst();
    }
}
