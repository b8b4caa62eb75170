package uk.gegc.examgen.features.content.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A passage and the questions generated for it in one model call. Every question references
 * {@code passageAsset.getAssetId()}; the aggregate itself is never stored as a single document.
 */
public record GeneratedReadingMaterial(PassageAsset passageAsset, List<Question> questions) {

    public GeneratedReadingMaterial {
        Objects.requireNonNull(passageAsset, "passageAsset");
        questions = List.copyOf(questions);
        String passageId = passageAsset.getAssetId();
        for (Question question : questions) {
            String reference = question.referencedAssetId().orElse(null);
            boolean passageReference = question.referencedAssetType().orElse(null) == AssetType.PASSAGE;
            if (!passageReference || passageId == null || !passageId.equals(reference)) {
                throw new IllegalArgumentException("Question " + question.getQuestionType()
                        + " references '" + reference + "', not passage '" + passageId + "'");
            }
        }
    }
}
