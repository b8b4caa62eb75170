package uk.gegc.examgen.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import uk.gegc.examgen.features.content.application.DifficultyCatalog;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.Stage;

@Schema(name = "DifficultyDto", description = "Target difficulty; the display name is derived")
public record DifficultyDto(
        @Schema(description = "Educational stage", example = "JUNIOR_HIGH")
        @NotNull(message = "Stage is required")
        Stage stage,

        @Schema(description = "Grade within the stage", example = "1")
        @Min(value = 1, message = "Grade must be at least 1")
        int grade,

        @Schema(description = "Overall difficulty on a 1-10 scale", example = "4")
        @Min(value = 1, message = "Level must be between 1 and 10")
        @Max(value = 10, message = "Level must be between 1 and 10")
        int level
) {

    public DifficultyDetail toDetail() {
        return DifficultyCatalog.detailFor(stage, grade, level);
    }
}
