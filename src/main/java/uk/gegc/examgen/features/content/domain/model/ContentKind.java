package uk.gegc.examgen.features.content.domain.model;

/**
 * Which family a raw payload is ingested as.
 */
public enum ContentKind {
    QUESTION("questionType"),
    ASSET("assetType");

    private final String discriminatorField;

    ContentKind(String discriminatorField) {
        this.discriminatorField = discriminatorField;
    }

    public String discriminatorField() {
        return discriminatorField;
    }
}
