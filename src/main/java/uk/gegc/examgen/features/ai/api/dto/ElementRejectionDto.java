package uk.gegc.examgen.features.ai.api.dto;

public record ElementRejectionDto(int index, FailureDto failure) {
}
