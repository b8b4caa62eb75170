package uk.gegc.examgen.features.ai.infra.parser;

import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AssetStatus;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Builds one asset variant from a parsed payload. Absent {@code status} and {@code version}
 * keep the builder defaults (DRAFT, 1).
 */
public abstract class AssetNodeParser {

    public abstract AssetType supportedType();

    public abstract Asset parse(FieldReader reader, IngestionContext context, Instant receivedAt);

    protected void readCommon(Asset.AssetBuilder<?, ?> builder,
                              FieldReader reader,
                              IngestionContext context,
                              Instant receivedAt) {
        String assetId = reader.has("assetId") ? reader.text("assetId") : context.getAssetId();
        DifficultyDetail difficulty = reader.has("difficulty")
                ? reader.difficulty("difficulty")
                : context.getDifficulty();
        List<String> learningObjectives = reader.has("learningObjectives")
                ? reader.strings("learningObjectives")
                : context.getLearningObjectives();
        Instant createdAt = reader.has("createdAt") ? reader.instant("createdAt") : receivedAt;
        Instant updatedAt = reader.has("updatedAt") ? reader.instant("updatedAt") : createdAt;

        builder.assetId(assetId)
                .title(reader.localized("title"))
                .description(reader.localized("description"))
                .difficulty(difficulty)
                .source(reader.text("source"))
                .createdBy(reader.text("createdBy"))
                .createdAt(createdAt)
                .updatedAt(updatedAt);
        if (learningObjectives != null) {
            builder.learningObjectives(List.copyOf(learningObjectives));
        }
        List<String> tags = reader.strings("tags");
        if (tags != null) {
            builder.tags(List.copyOf(tags));
        }
        AssetStatus status = reader.enumValue("status", AssetNodeParser::status);
        if (status != null) {
            builder.status(status);
        }
        Integer version = reader.integer("version");
        if (version != null) {
            builder.version(version);
        }
    }

    private static Optional<AssetStatus> status(String tag) {
        return Arrays.stream(AssetStatus.values())
                .filter(status -> status.name().equals(tag))
                .findFirst();
    }
}
