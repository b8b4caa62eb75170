package uk.gegc.examgen.features.content.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum TargetLanguage {
    EN("en"),
    ZH_TW("zh_tw");

    private final String code;

    TargetLanguage(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<TargetLanguage> fromCode(String code) {
        return Arrays.stream(values())
                .filter(language -> language.code.equals(code))
                .findFirst();
    }
}
