package uk.gegc.examgen.features.ai.domain.model;

public record GenerationPrompt(String systemPrompt, String userPrompt) {
}
