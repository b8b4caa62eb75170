package uk.gegc.examgen.features.content.infra.validator;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.ImageAsset;

@Component
public class ImageAssetValidator extends AssetValidator<ImageAsset> {

    public ImageAssetValidator() {
        super(ImageAsset.class);
    }

    @Override
    public AssetType supportedType() {
        return AssetType.IMAGE;
    }

    @Override
    protected void validateVariant(ImageAsset asset, ViolationCollector collector) {
        collector.require("imageUrl", asset.getImageUrl());
    }
}
