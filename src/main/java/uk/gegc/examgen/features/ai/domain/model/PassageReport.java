package uk.gegc.examgen.features.ai.domain.model;

import uk.gegc.examgen.features.content.domain.model.Asset;

public record PassageReport(GenerationSource source, IngestionOutcome<Asset> outcome) {
}
