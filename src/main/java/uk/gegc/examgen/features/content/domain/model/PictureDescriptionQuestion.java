package uk.gegc.examgen.features.content.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;
import java.util.Optional;

@Getter
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PictureDescriptionQuestion extends Question {

    private final String imageAssetId;

    private final List<String> suggestedKeywords;

    public List<String> getSuggestedKeywords() {
        return ContentLists.readOnly(suggestedKeywords);
    }

    @Override
    public QuestionType getQuestionType() {
        return QuestionType.PICTURE_DESCRIPTION;
    }

    @Override
    public Optional<String> referencedAssetId() {
        return Optional.ofNullable(imageAssetId);
    }

    @Override
    public Optional<AssetType> referencedAssetType() {
        return Optional.of(AssetType.IMAGE);
    }
}
