package uk.gegc.examgen.features.content.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ImageAsset extends Asset {

    private final String imageUrl;

    @Override
    public AssetType getAssetType() {
        return AssetType.IMAGE;
    }
}
