package uk.gegc.examgen.features.ai.infra.parser;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.PictureDescriptionQuestion;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;

import java.time.Instant;

@Component
public class PictureDescriptionParser extends QuestionNodeParser {

    @Override
    public QuestionType supportedType() {
        return QuestionType.PICTURE_DESCRIPTION;
    }

    @Override
    public Question parse(FieldReader reader, IngestionContext context, Instant receivedAt) {
        PictureDescriptionQuestion.PictureDescriptionQuestionBuilder<?, ?> builder = PictureDescriptionQuestion.builder()
                .imageAssetId(textOrDefault(reader, "imageAssetId", context.getImageAssetId()))
                .suggestedKeywords(reader.strings("suggestedKeywords"));
        readCommon(builder, reader, context, receivedAt);
        return builder.build();
    }
}
