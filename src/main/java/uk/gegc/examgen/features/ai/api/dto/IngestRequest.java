package uk.gegc.examgen.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.QuestionType;

import java.util.List;

/**
 * Raw model text plus the generation context it was produced for.
 */
@Schema(name = "IngestRequest", description = "Untrusted raw text to run through the ingestion pipeline")
public record IngestRequest(
        @Schema(description = "Raw reply text, expected to be exactly one JSON object")
        @NotNull(message = "Raw text is required")
        String rawText,

        @Schema(description = "Question type the text was requested as", example = "READING_COMPREHENSION")
        QuestionType expectedQuestionType,

        @Schema(description = "Asset type the text was requested as", example = "PASSAGE")
        AssetType expectedAssetType,

        @Valid
        DifficultyDto difficulty,

        List<String> learningObjectives,

        @Schema(description = "Default asset reference for comprehension questions")
        String contentAssetId,

        @Schema(description = "Default asset reference for picture-description questions")
        String imageAssetId,

        @Schema(description = "Number of questions requested in a batch", example = "3")
        @Min(value = 1, message = "At least one question must be requested")
        @Max(value = 20, message = "No more than 20 questions per batch")
        Integer requested
) {

    public IngestionContext toContext() {
        return IngestionContext.builder()
                .expectedQuestionType(expectedQuestionType)
                .expectedAssetType(expectedAssetType)
                .difficulty(difficulty != null ? difficulty.toDetail() : null)
                .learningObjectives(learningObjectives)
                .contentAssetId(contentAssetId)
                .imageAssetId(imageAssetId)
                .build();
    }

    public int requestedOrDefault(int fallback) {
        return requested != null ? requested : fallback;
    }
}
