package uk.gegc.examgen.features.content.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Discriminator of the asset family. Tags are matched exactly and case-sensitively.
 */
public enum AssetType {
    PASSAGE("passage_assets"),
    AUDIO("audio_assets"),
    IMAGE("image_assets");

    private final String collection;

    AssetType(String collection) {
        this.collection = collection;
    }

    public String tag() {
        return name();
    }

    /**
     * Document store collection holding assets of this type.
     */
    public String collection() {
        return collection;
    }

    public static Optional<AssetType> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(type -> type.tag().equals(tag))
                .findFirst();
    }
}
