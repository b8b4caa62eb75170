package uk.gegc.examgen.features.content.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.List;

/**
 * Common fields of every asset variant: one subclass per {@link AssetType}.
 */
@Getter
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode
@ToString
public abstract class Asset {

    private final String assetId;

    private final LocalizedString title;

    private final LocalizedString description;

    private final DifficultyDetail difficulty;

    @Builder.Default
    private final List<String> learningObjectives = List.of();

    @Builder.Default
    private final List<String> tags = List.of();

    @Builder.Default
    private final AssetStatus status = AssetStatus.DRAFT;

    @Builder.Default
    private final Integer version = 1;

    private final String source;

    private final String createdBy;

    private final Instant createdAt;

    private final Instant updatedAt;

    public List<String> getLearningObjectives() {
        return ContentLists.readOnly(learningObjectives);
    }

    public List<String> getTags() {
        return ContentLists.readOnly(tags);
    }

    public abstract AssetType getAssetType();
}
