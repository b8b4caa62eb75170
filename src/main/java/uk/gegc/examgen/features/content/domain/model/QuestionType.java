package uk.gegc.examgen.features.content.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Discriminator of the question family. Tags are matched exactly and case-sensitively.
 */
public enum QuestionType {
    FILL_IN_THE_BLANK,
    TRANSLATION,
    PICTURE_DESCRIPTION,
    READING_COMPREHENSION,
    LISTENING_COMPREHENSION,
    SPELLING_CORRECTION;

    public String tag() {
        return name();
    }

    /**
     * True for variants that point at an asset generated or stored alongside them.
     */
    public boolean referencesAsset() {
        return this == READING_COMPREHENSION || this == LISTENING_COMPREHENSION || this == PICTURE_DESCRIPTION;
    }

    public static Optional<QuestionType> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(type -> type.tag().equals(tag))
                .findFirst();
    }
}
