package uk.gegc.examgen.features.ai.infra.parser;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.ImageAsset;

import java.time.Instant;

@Component
public class ImageAssetParser extends AssetNodeParser {

    @Override
    public AssetType supportedType() {
        return AssetType.IMAGE;
    }

    @Override
    public Asset parse(FieldReader reader, IngestionContext context, Instant receivedAt) {
        ImageAsset.ImageAssetBuilder<?, ?> builder = ImageAsset.builder()
                .imageUrl(reader.text("imageUrl"));
        readCommon(builder, reader, context, receivedAt);
        return builder.build();
    }
}
