package uk.gegc.examgen.features.ai.domain.model;

import uk.gegc.examgen.features.content.domain.model.GeneratedReadingMaterial;
import uk.gegc.examgen.features.content.domain.model.Question;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a combined passage + questions payload.
 *
 * @param material         linked aggregate; null when the passage was rejected or no question linked
 * @param passageFailure   why the passage (or the whole payload) was rejected; null otherwise
 * @param questions        batch outcome before linking
 * @param linkMismatches   accepted questions the linker excluded
 */
public record ReadingMaterialResult(GeneratedReadingMaterial material,
                                    IngestionFailure passageFailure,
                                    BatchIngestionResult questions,
                                    List<LinkMismatch> linkMismatches) {

    public ReadingMaterialResult {
        linkMismatches = linkMismatches == null ? List.of() : List.copyOf(linkMismatches);
    }

    public boolean isAccepted() {
        return material != null;
    }

    public Optional<GeneratedReadingMaterial> materialIfAccepted() {
        return Optional.ofNullable(material);
    }

    public List<Question> linkedQuestions() {
        return material == null ? List.of() : material.questions();
    }
}
