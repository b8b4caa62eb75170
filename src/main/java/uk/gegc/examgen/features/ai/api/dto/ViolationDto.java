package uk.gegc.examgen.features.ai.api.dto;

public record ViolationDto(String field, String code, String message) {
}
