package uk.gegc.examgen.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "GenerateReadingMaterialRequest", description = "Generate a passage and its comprehension questions")
public record GenerateReadingMaterialRequest(
        @Valid
        @NotNull(message = "Difficulty is required")
        DifficultyDto difficulty,

        @Schema(description = "Topic of the passage", example = "The deep ocean")
        @Size(max = 200, message = "Topic must not exceed 200 characters")
        String topic,

        @Schema(description = "Number of questions", example = "3")
        @Min(value = 1, message = "At least one question must be requested")
        @Max(value = 10, message = "No more than 10 questions per passage")
        Integer questionCount,

        List<String> learningObjectives
) {
}
