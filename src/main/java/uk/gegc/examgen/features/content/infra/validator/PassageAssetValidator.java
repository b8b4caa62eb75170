package uk.gegc.examgen.features.content.infra.validator;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.PassageAsset;
import uk.gegc.examgen.features.content.domain.validation.ViolationCode;

@Component
public class PassageAssetValidator extends AssetValidator<PassageAsset> {

    public PassageAssetValidator() {
        super(PassageAsset.class);
    }

    @Override
    public AssetType supportedType() {
        return AssetType.PASSAGE;
    }

    @Override
    protected void validateVariant(PassageAsset asset, ViolationCollector collector) {
        if (collector.require("content", asset.getContent()) && asset.getContent().isBlank()) {
            collector.add("content", ViolationCode.NON_EMPTY, "passage content must not be empty");
        }
    }
}
