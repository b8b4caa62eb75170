package uk.gegc.examgen.features.content.domain.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Optional;

@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ReadingComprehensionQuestion extends ComprehensionQuestion {

    @Override
    public QuestionType getQuestionType() {
        return QuestionType.READING_COMPREHENSION;
    }

    @Override
    public Optional<AssetType> referencedAssetType() {
        return Optional.of(AssetType.PASSAGE);
    }
}
