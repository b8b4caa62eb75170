package uk.gegc.examgen.features.ai.domain.model;

import lombok.Builder;
import lombok.Value;
import uk.gegc.examgen.features.content.domain.model.AnswerInputType;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AudioAsset;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.ImageAsset;
import uk.gegc.examgen.features.content.domain.model.PassageAsset;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.model.TargetLanguage;

import java.util.List;

/**
 * One generation request as collected by a caller (CLI, UI, REST).
 */
@Value
@Builder(toBuilder = true)
public class GenerationRequest {

    QuestionType questionType;

    /**
     * Answer mode for comprehension and fill-in-the-blank questions; multiple choice when null.
     */
    AnswerInputType answerInputType;

    /**
     * Spelling questions only: sentence mode instead of word choices.
     */
    boolean sentenceMode;

    TargetLanguage targetLanguage;

    DifficultyDetail difficulty;

    @Builder.Default
    List<String> learningObjectives = List.of();

    String topic;

    @Builder.Default
    int questionCount = 1;

    /**
     * Asset the questions are about; required for comprehension and picture questions.
     */
    Asset asset;

    /**
     * Explicit provider settings; the configured defaults apply when null.
     */
    ModelSettings modelSettings;

    /**
     * Name shared by the prompt template and the example payload of this request's shape.
     */
    public String shape() {
        if (questionType == null) {
            throw new IllegalArgumentException("Question type is required for question generation");
        }
        return switch (questionType) {
            case READING_COMPREHENSION -> answerInputType == AnswerInputType.TEXT_INPUT
                    ? "reading-comprehension-text"
                    : "reading-comprehension-mc";
            case LISTENING_COMPREHENSION -> "listening-comprehension";
            case FILL_IN_THE_BLANK -> answerInputType == AnswerInputType.TEXT_INPUT
                    ? "fill-in-the-blank-text"
                    : "fill-in-the-blank-mc";
            case SPELLING_CORRECTION -> sentenceMode ? "spelling-sentence" : "spelling-word-choices";
            case TRANSLATION -> "translation";
            case PICTURE_DESCRIPTION -> "picture-description";
        };
    }

    /**
     * Text of the referenced asset that the model works from.
     */
    public String assetText() {
        if (asset instanceof PassageAsset passage) {
            return passage.getContent();
        }
        if (asset instanceof AudioAsset audio) {
            return audio.getTranscript() != null ? audio.getTranscript() : audio.getTitle().en();
        }
        if (asset instanceof ImageAsset image) {
            return image.getDescription() != null ? image.getDescription().en() : image.getTitle().en();
        }
        return "";
    }
}
