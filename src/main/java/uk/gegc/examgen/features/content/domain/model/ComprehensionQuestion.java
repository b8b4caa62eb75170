package uk.gegc.examgen.features.content.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;
import java.util.Optional;

/**
 * A question answered from the content of an asset, either by picking one of {@code choices}
 * or by typing one of {@code acceptableAnswers}.
 */
@Getter
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract class ComprehensionQuestion extends Question {

    private final String contentAssetId;

    private final List<ChoiceDetail> choices;

    private final List<String> acceptableAnswers;

    public List<ChoiceDetail> getChoices() {
        return ContentLists.readOnly(choices);
    }

    public List<String> getAcceptableAnswers() {
        return ContentLists.readOnly(acceptableAnswers);
    }

    @Override
    public Optional<String> referencedAssetId() {
        return Optional.ofNullable(contentAssetId);
    }
}
