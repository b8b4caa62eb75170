package uk.gegc.examgen.features.ai.infra.parser;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.AudioAsset;

import java.time.Instant;

@Component
public class AudioAssetParser extends AssetNodeParser {

    @Override
    public AssetType supportedType() {
        return AssetType.AUDIO;
    }

    @Override
    public Asset parse(FieldReader reader, IngestionContext context, Instant receivedAt) {
        AudioAsset.AudioAssetBuilder<?, ?> builder = AudioAsset.builder()
                .audioUrl(reader.text("audioUrl"))
                .durationSeconds(reader.number("durationSeconds"))
                .transcript(reader.text("transcript"))
                .speakerInfo(reader.strings("speakerInfo"));
        readCommon(builder, reader, context, receivedAt);
        return builder.build();
    }
}
