package uk.gegc.examgen.features.content.infra.validator;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.PictureDescriptionQuestion;
import uk.gegc.examgen.features.content.domain.model.QuestionType;

@Component
public class PictureDescriptionValidator extends QuestionValidator<PictureDescriptionQuestion> {

    public PictureDescriptionValidator() {
        super(PictureDescriptionQuestion.class);
    }

    @Override
    public QuestionType supportedType() {
        return QuestionType.PICTURE_DESCRIPTION;
    }

    @Override
    protected void validateVariant(PictureDescriptionQuestion question, ViolationCollector collector) {
        collector.require("imageAssetId", question.getImageAssetId());
        collector.checkEntries("suggestedKeywords", question.getSuggestedKeywords());
    }
}
