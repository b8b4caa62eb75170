package uk.gegc.examgen.features.content.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Common fields of every question variant. The set of variants is closed: one subclass per
 * {@link QuestionType}. Instances are never mutated after acceptance; an update is a new
 * build-validate-replace cycle through {@code toBuilder()}.
 */
@Getter
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode
@ToString
public abstract class Question {

    private final DifficultyDetail difficulty;

    @Builder.Default
    private final List<String> learningObjectives = List.of();

    private final String questionText;

    private final LocalizedString explanation;

    private final Instant createdAt;

    private final Instant updatedAt;

    public List<String> getLearningObjectives() {
        return ContentLists.readOnly(learningObjectives);
    }

    public abstract QuestionType getQuestionType();

    /**
     * Id of the asset this question points at, for variants that reference one.
     */
    public Optional<String> referencedAssetId() {
        return Optional.empty();
    }

    /**
     * Asset type the reference must resolve to, for variants that reference one.
     */
    public Optional<AssetType> referencedAssetType() {
        return Optional.empty();
    }
}
