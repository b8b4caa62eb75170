package uk.gegc.examgen.features.content.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Getter
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AudioAsset extends Asset {

    private final String audioUrl;

    private final Double durationSeconds;

    private final String transcript;

    private final List<String> speakerInfo;

    public List<String> getSpeakerInfo() {
        return ContentLists.readOnly(speakerInfo);
    }

    @Override
    public AssetType getAssetType() {
        return AssetType.AUDIO;
    }
}
