package uk.gegc.examgen.features.content.domain.model;

public enum AssetStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED
}
