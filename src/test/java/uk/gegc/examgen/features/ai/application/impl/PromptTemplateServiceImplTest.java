package uk.gegc.examgen.features.ai.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.core.io.DefaultResourceLoader;
import uk.gegc.examgen.features.ai.domain.model.GenerationPrompt;
import uk.gegc.examgen.features.ai.domain.model.GenerationRequest;
import uk.gegc.examgen.features.content.domain.model.AnswerInputType;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.model.TargetLanguage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.examgen.testsupport.ContentFixtures.AUDIO_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.IMAGE_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.PASSAGE_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.audio;
import static uk.gegc.examgen.testsupport.ContentFixtures.difficulty;
import static uk.gegc.examgen.testsupport.ContentFixtures.image;
import static uk.gegc.examgen.testsupport.ContentFixtures.passage;

@DisplayName("PromptTemplateServiceImpl Tests")
class PromptTemplateServiceImplTest {

    private final PromptTemplateServiceImpl service = new PromptTemplateServiceImpl(new DefaultResourceLoader());

    private GenerationRequest.GenerationRequestBuilder request(QuestionType type) {
        GenerationRequest.GenerationRequestBuilder builder = GenerationRequest.builder()
                .questionType(type)
                .difficulty(difficulty())
                .topic("Animals")
                .questionCount(3);
        switch (type) {
            case READING_COMPREHENSION -> builder.asset(passage(PASSAGE_ID));
            case LISTENING_COMPREHENSION -> builder.asset(audio(AUDIO_ID));
            case PICTURE_DESCRIPTION -> builder.asset(image(IMAGE_ID));
            default -> {
            }
        }
        return builder;
    }

    @ParameterizedTest
    @EnumSource(QuestionType.class)
    @DisplayName("buildQuestionBatchPrompt: every placeholder is filled for every question type")
    void placeholdersFilled(QuestionType type) {
        GenerationPrompt prompt = service.buildQuestionBatchPrompt(request(type).build());

        assertThat(prompt.systemPrompt()).isNotBlank();
        assertThat(prompt.userPrompt())
                .contains("questions_list")
                .contains("\"" + type.tag() + "\"")
                .contains("Junior High - Grade 1")
                .doesNotContain("{questionCount}", "{difficultyName}", "{stage}", "{grade}",
                        "{level}", "{topic}", "{assetId}", "{content}", "{targetLanguage}");
    }

    @Test
    @DisplayName("buildQuestionBatchPrompt: reading comprehension names the flat explanation keys and the passage")
    void readingComprehensionPrompt() {
        GenerationPrompt prompt = service.buildQuestionBatchPrompt(request(QuestionType.READING_COMPREHENSION).build());

        assertThat(prompt.userPrompt())
                .contains("explanation_en")
                .contains("explanation_zh_tw")
                .contains("\"contentAssetId\": \"" + PASSAGE_ID + "\"")
                .contains("went to the zoo")
                .contains("exactly 3 question(s)");
    }

    @Test
    @DisplayName("buildQuestionBatchPrompt: text-input shapes use their own template")
    void textInputShape() {
        GenerationPrompt multipleChoice = service.buildQuestionBatchPrompt(request(QuestionType.FILL_IN_THE_BLANK).build());
        GenerationPrompt textInput = service.buildQuestionBatchPrompt(request(QuestionType.FILL_IN_THE_BLANK)
                .answerInputType(AnswerInputType.TEXT_INPUT)
                .build());

        assertThat(textInput.userPrompt()).isNotEqualTo(multipleChoice.userPrompt());
        assertThat(textInput.userPrompt()).contains("acceptableAnswers");
    }

    @Test
    @DisplayName("buildQuestionBatchPrompt: translation prompt carries the target language code")
    void translationTargetLanguage() {
        GenerationPrompt prompt = service.buildQuestionBatchPrompt(request(QuestionType.TRANSLATION)
                .targetLanguage(TargetLanguage.EN)
                .build());

        assertThat(prompt.userPrompt()).contains("\"targetLanguage\": \"en\"");
    }

    @Test
    @DisplayName("buildQuestionBatchPrompt: blank topic falls back to the default topic")
    void defaultTopic() {
        GenerationPrompt prompt = service.buildQuestionBatchPrompt(request(QuestionType.TRANSLATION)
                .topic("  ")
                .build());

        assertThat(prompt.userPrompt()).contains(PromptTemplateServiceImpl.DEFAULT_TOPIC);
    }

    @Test
    @DisplayName("buildReadingMaterialPrompt: asks for a passage and its questions together")
    void readingMaterialPrompt() {
        GenerationPrompt prompt = service.buildReadingMaterialPrompt(request(QuestionType.READING_COMPREHENSION)
                .asset(null)
                .build());

        assertThat(prompt.userPrompt())
                .contains("passageAsset")
                .contains("\"assetType\": \"PASSAGE\"")
                .contains("questions_list");
    }

    @Test
    @DisplayName("buildQuestionBatchPrompt: asset-based types without an asset are refused")
    void missingAsset() {
        assertThatThrownBy(() -> service.buildQuestionBatchPrompt(request(QuestionType.PICTURE_DESCRIPTION)
                .asset(null)
                .build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("need an asset");
    }

    @Test
    @DisplayName("build*Prompt: a request without difficulty is refused")
    void missingDifficulty() {
        GenerationRequest noDifficulty = request(QuestionType.TRANSLATION).difficulty(null).build();

        assertThatThrownBy(() -> service.buildQuestionBatchPrompt(noDifficulty))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Difficulty cannot be null");
        assertThatThrownBy(() -> service.buildPassagePrompt(noDifficulty))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("loadPromptTemplate: unknown template fails with IllegalStateException")
    void unknownTemplate() {
        assertThatThrownBy(() -> service.loadPromptTemplate("question-types/missing.txt"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing.txt");
    }
}
