package uk.gegc.examgen.features.ai.domain.model;

public record ReadingMaterialReport(GenerationSource source, ReadingMaterialResult result) {
}
