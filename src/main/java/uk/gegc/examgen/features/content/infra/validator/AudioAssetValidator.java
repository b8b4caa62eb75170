package uk.gegc.examgen.features.content.infra.validator;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.AudioAsset;
import uk.gegc.examgen.features.content.domain.validation.ViolationCode;

@Component
public class AudioAssetValidator extends AssetValidator<AudioAsset> {

    public AudioAssetValidator() {
        super(AudioAsset.class);
    }

    @Override
    public AssetType supportedType() {
        return AssetType.AUDIO;
    }

    @Override
    protected void validateVariant(AudioAsset asset, ViolationCollector collector) {
        collector.require("audioUrl", asset.getAudioUrl());
        Double duration = asset.getDurationSeconds();
        if (collector.require("durationSeconds", duration) && !(duration > 0)) {
            collector.add("durationSeconds", ViolationCode.VALUE_OUT_OF_RANGE,
                    "durationSeconds must be > 0, was " + duration);
        }
        collector.checkEntries("speakerInfo", asset.getSpeakerInfo());
    }
}
