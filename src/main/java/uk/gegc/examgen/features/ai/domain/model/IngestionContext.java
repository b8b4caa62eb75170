package uk.gegc.examgen.features.ai.domain.model;

import lombok.Builder;
import lombok.Value;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.QuestionType;

import java.util.List;

/**
 * What the caller asked the model for. Payload values always win; these values only fill
 * fields the payload leaves out. A payload without a discriminator resolves to the expected
 * type, and a payload whose discriminator differs from it is rejected.
 */
@Value
@Builder(toBuilder = true)
public class IngestionContext {

    QuestionType expectedQuestionType;

    AssetType expectedAssetType;

    DifficultyDetail difficulty;

    List<String> learningObjectives;

    /**
     * Default {@code assetId} for an asset payload.
     */
    String assetId;

    /**
     * Default reference of comprehension questions.
     */
    String contentAssetId;

    /**
     * Default reference of picture-description questions.
     */
    String imageAssetId;

    public static IngestionContext empty() {
        return IngestionContext.builder().build();
    }

    public static IngestionContext forQuestion(QuestionType type) {
        return IngestionContext.builder().expectedQuestionType(type).build();
    }

    public static IngestionContext forAsset(AssetType type) {
        return IngestionContext.builder().expectedAssetType(type).build();
    }
}
