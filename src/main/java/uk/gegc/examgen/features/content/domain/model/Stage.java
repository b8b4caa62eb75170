package uk.gegc.examgen.features.content.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum Stage {
    ELEMENTARY("Elementary"),
    JUNIOR_HIGH("Junior High"),
    SENIOR_HIGH("Senior High");

    private final String title;

    Stage(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    public static Optional<Stage> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(stage -> stage.name().equals(tag))
                .findFirst();
    }
}
