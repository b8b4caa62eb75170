package uk.gegc.examgen.features.ai.application;

import uk.gegc.examgen.features.ai.domain.model.GenerationPrompt;
import uk.gegc.examgen.features.ai.domain.model.GenerationRequest;

public interface PromptTemplateService {

    /**
     * Prompt asking for a {@code questions_list} envelope of {@code request.questionCount} questions
     */
    GenerationPrompt buildQuestionBatchPrompt(GenerationRequest request);

    /**
     * Prompt asking for a standalone passage asset
     */
    GenerationPrompt buildPassagePrompt(GenerationRequest request);

    /**
     * Prompt asking for a passage together with its questions
     */
    GenerationPrompt buildReadingMaterialPrompt(GenerationRequest request);

    /**
     * Load a template from {@code classpath:prompts/}
     */
    String loadPromptTemplate(String templateName);

    String buildSystemPrompt();
}
