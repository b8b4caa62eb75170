package uk.gegc.examgen.features.ai.infra.parser;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.ListeningComprehensionQuestion;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;

import java.time.Instant;

/**
 * Older listening payloads carry the reference as {@code audioAssetId}; it is read when
 * {@code contentAssetId} is absent.
 */
@Component
public class ListeningComprehensionParser extends QuestionNodeParser {

    private static final String LEGACY_REFERENCE_FIELD = "audioAssetId";

    @Override
    public QuestionType supportedType() {
        return QuestionType.LISTENING_COMPREHENSION;
    }

    @Override
    public Question parse(FieldReader reader, IngestionContext context, Instant receivedAt) {
        String contentAssetId = reader.has("contentAssetId")
                ? reader.text("contentAssetId")
                : textOrDefault(reader, LEGACY_REFERENCE_FIELD, context.getContentAssetId());
        ListeningComprehensionQuestion.ListeningComprehensionQuestionBuilder<?, ?> builder = ListeningComprehensionQuestion.builder()
                .contentAssetId(contentAssetId)
                .choices(reader.choices("choices"))
                .acceptableAnswers(reader.strings("acceptableAnswers"));
        readCommon(builder, reader, context, receivedAt);
        return builder.build();
    }
}
