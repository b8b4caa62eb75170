package uk.gegc.examgen.features.ai.infra.parser;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.PassageAsset;

import java.time.Instant;

@Component
public class PassageAssetParser extends AssetNodeParser {

    @Override
    public AssetType supportedType() {
        return AssetType.PASSAGE;
    }

    @Override
    public Asset parse(FieldReader reader, IngestionContext context, Instant receivedAt) {
        PassageAsset.PassageAssetBuilder<?, ?> builder = PassageAsset.builder()
                .content(reader.text("content"));
        readCommon(builder, reader, context, receivedAt);
        return builder.build();
    }
}
