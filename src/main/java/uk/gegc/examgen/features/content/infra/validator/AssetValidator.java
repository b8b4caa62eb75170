package uk.gegc.examgen.features.content.infra.validator;

import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.validation.InvariantViolation;
import uk.gegc.examgen.features.content.domain.validation.ViolationCode;

import java.util.List;

public abstract class AssetValidator<T extends Asset> {

    private final Class<T> assetClass;

    protected AssetValidator(Class<T> assetClass) {
        this.assetClass = assetClass;
    }

    public abstract AssetType supportedType();

    public List<InvariantViolation> validate(Asset asset) {
        if (!assetClass.isInstance(asset)) {
            throw new IllegalArgumentException(
                    supportedType() + " validator cannot check " + asset.getClass().getSimpleName());
        }
        ViolationCollector collector = new ViolationCollector();
        collector.require("assetId", asset.getAssetId());
        collector.requireLocalized("title", asset.getTitle());
        collector.checkLocalized("description", asset.getDescription());
        collector.requireDifficulty("difficulty", asset.getDifficulty());
        if (collector.require("learningObjectives", asset.getLearningObjectives())) {
            collector.checkEntries("learningObjectives", asset.getLearningObjectives());
        }
        if (collector.require("tags", asset.getTags())) {
            collector.checkEntries("tags", asset.getTags());
        }
        collector.require("status", asset.getStatus());
        if (collector.require("version", asset.getVersion()) && asset.getVersion() < 1) {
            collector.add("version", ViolationCode.VALUE_OUT_OF_RANGE,
                    "version must be >= 1, was " + asset.getVersion());
        }
        collector.require("createdAt", asset.getCreatedAt());
        collector.require("updatedAt", asset.getUpdatedAt());
        validateVariant(assetClass.cast(asset), collector);
        return collector.violations();
    }

    protected abstract void validateVariant(T asset, ViolationCollector collector);
}
