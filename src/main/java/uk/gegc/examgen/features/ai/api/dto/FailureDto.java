package uk.gegc.examgen.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "FailureDto", description = "Why a generation unit or element was rejected")
public record FailureDto(
        String reason,
        String failedAt,
        String message,
        List<ViolationDto> violations,
        @Schema(description = "Start of the raw text that was rejected")
        String rawSnippet
) {
}
