package uk.gegc.examgen.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.examgen.features.ai.application.PromptTemplateService;
import uk.gegc.examgen.features.ai.domain.model.GenerationPrompt;
import uk.gegc.examgen.features.ai.domain.model.GenerationRequest;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.TargetLanguage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds prompts from {@code classpath:prompts/} templates. Every template spells out the
 * literal field names the ingestion pipeline reads.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    static final String DEFAULT_TOPIC = "General Knowledge";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public GenerationPrompt buildQuestionBatchPrompt(GenerationRequest request) {
        requireDifficulty(request);
        if (request.getQuestionCount() < 1) {
            throw new IllegalArgumentException("Question count must be at least 1");
        }
        if (request.getQuestionType().referencesAsset() && request.getAsset() == null) {
            throw new IllegalArgumentException(request.getQuestionType() + " questions need an asset to work from");
        }
        String template = loadPromptTemplate("question-types/" + request.shape() + ".txt");
        log.debug("Building {} prompt for {} question(s)", request.shape(), request.getQuestionCount());
        return new GenerationPrompt(buildSystemPrompt(), fill(template, request));
    }

    @Override
    public GenerationPrompt buildPassagePrompt(GenerationRequest request) {
        requireDifficulty(request);
        return new GenerationPrompt(buildSystemPrompt(), fill(loadPromptTemplate("assets/passage.txt"), request));
    }

    @Override
    public GenerationPrompt buildReadingMaterialPrompt(GenerationRequest request) {
        requireDifficulty(request);
        if (request.getQuestionCount() < 1) {
            throw new IllegalArgumentException("Question count must be at least 1");
        }
        return new GenerationPrompt(buildSystemPrompt(), fill(loadPromptTemplate("assets/reading-material.txt"), request));
    }

    @Override
    public String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    @Override
    public String buildSystemPrompt() {
        return loadPromptTemplate("base/system-prompt.txt");
    }

    private String fill(String template, GenerationRequest request) {
        DifficultyDetail difficulty = request.getDifficulty();
        String topic = request.getTopic() == null || request.getTopic().isBlank() ? DEFAULT_TOPIC : request.getTopic();
        TargetLanguage targetLanguage = request.getTargetLanguage() != null ? request.getTargetLanguage() : TargetLanguage.ZH_TW;
        String assetId = request.getAsset() != null ? request.getAsset().getAssetId() : "";
        return template
                .replace("{topic}", topic)
                .replace("{questionCount}", String.valueOf(request.getQuestionCount()))
                .replace("{difficultyName}", difficulty.name() != null ? difficulty.name().en() : "")
                .replace("{stage}", String.valueOf(difficulty.stage()))
                .replace("{grade}", String.valueOf(difficulty.grade()))
                .replace("{level}", String.valueOf(difficulty.level()))
                .replace("{targetLanguage}", targetLanguage.code())
                .replace("{assetId}", assetId)
                .replace("{content}", request.assetText() == null ? "" : request.assetText());
    }

    private void requireDifficulty(GenerationRequest request) {
        if (request.getDifficulty() == null) {
            throw new IllegalArgumentException("Difficulty cannot be null");
        }
    }

    private String loadTemplateFromResources(String templateName) {
        Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new IllegalStateException("Failed to load template: " + templateName, e);
        }
    }
}
