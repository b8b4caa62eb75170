package uk.gegc.examgen.features.content.infra.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AudioAsset;
import uk.gegc.examgen.features.content.domain.model.ChoiceDetail;
import uk.gegc.examgen.features.content.domain.model.ComprehensionQuestion;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.FillInTheBlankQuestion;
import uk.gegc.examgen.features.content.domain.model.ImageAsset;
import uk.gegc.examgen.features.content.domain.model.LocalizedString;
import uk.gegc.examgen.features.content.domain.model.PassageAsset;
import uk.gegc.examgen.features.content.domain.model.PictureDescriptionQuestion;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.SpellingCorrectionQuestion;
import uk.gegc.examgen.features.content.domain.model.TranslationQuestion;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Writes entities as flat camelCase documents using the wire field names, discriminator
 * included. Absent optional fields are omitted. The output is accepted unchanged by the
 * ingestion pipeline.
 */
@Component
@RequiredArgsConstructor
public class ContentDocumentMapper {

    private final ObjectMapper objectMapper;

    public ObjectNode toNode(Question question) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("questionType", question.getQuestionType().tag());
        putDifficulty(node, question.getDifficulty());
        putStrings(node, "learningObjectives", question.getLearningObjectives());
        putText(node, "questionText", question.getQuestionText());
        putLocalized(node, "explanation", question.getExplanation());
        putInstant(node, "createdAt", question.getCreatedAt());
        putInstant(node, "updatedAt", question.getUpdatedAt());

        switch (question.getQuestionType()) {
            case FILL_IN_THE_BLANK -> {
                FillInTheBlankQuestion q = (FillInTheBlankQuestion) question;
                if (q.getAnswerInputType() != null) {
                    node.put("answerInputType", q.getAnswerInputType().name());
                }
                putChoices(node, q.getChoices());
                putStrings(node, "acceptableAnswers", q.getAcceptableAnswers());
            }
            case TRANSLATION -> {
                TranslationQuestion q = (TranslationQuestion) question;
                putLocalized(node, "sourceText", q.getSourceText());
                if (q.getTargetLanguage() != null) {
                    node.put("targetLanguage", q.getTargetLanguage().code());
                }
                putStrings(node, "acceptableTranslations", q.getAcceptableTranslations());
            }
            case PICTURE_DESCRIPTION -> {
                PictureDescriptionQuestion q = (PictureDescriptionQuestion) question;
                putText(node, "imageAssetId", q.getImageAssetId());
                putStrings(node, "suggestedKeywords", q.getSuggestedKeywords());
            }
            case READING_COMPREHENSION, LISTENING_COMPREHENSION -> {
                ComprehensionQuestion q = (ComprehensionQuestion) question;
                putText(node, "contentAssetId", q.getContentAssetId());
                putChoices(node, q.getChoices());
                putStrings(node, "acceptableAnswers", q.getAcceptableAnswers());
            }
            case SPELLING_CORRECTION -> {
                SpellingCorrectionQuestion q = (SpellingCorrectionQuestion) question;
                putStrings(node, "wordChoices", q.getWordChoices());
                putText(node, "correctWord", q.getCorrectWord());
                putText(node, "sentenceWithMisspelledWord", q.getSentenceWithMisspelledWord());
                putText(node, "misspelledWordInSentence", q.getMisspelledWordInSentence());
            }
        }
        return node;
    }

    public ObjectNode toNode(Asset asset) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("assetType", asset.getAssetType().tag());
        putText(node, "assetId", asset.getAssetId());
        putLocalized(node, "title", asset.getTitle());
        putLocalized(node, "description", asset.getDescription());
        putDifficulty(node, asset.getDifficulty());
        putStrings(node, "learningObjectives", asset.getLearningObjectives());
        putStrings(node, "tags", asset.getTags());
        if (asset.getStatus() != null) {
            node.put("status", asset.getStatus().name());
        }
        if (asset.getVersion() != null) {
            node.put("version", asset.getVersion());
        }
        putText(node, "source", asset.getSource());
        putText(node, "createdBy", asset.getCreatedBy());
        putInstant(node, "createdAt", asset.getCreatedAt());
        putInstant(node, "updatedAt", asset.getUpdatedAt());

        switch (asset.getAssetType()) {
            case PASSAGE -> putText(node, "content", ((PassageAsset) asset).getContent());
            case AUDIO -> {
                AudioAsset audio = (AudioAsset) asset;
                putText(node, "audioUrl", audio.getAudioUrl());
                if (audio.getDurationSeconds() != null) {
                    node.put("durationSeconds", audio.getDurationSeconds());
                }
                putText(node, "transcript", audio.getTranscript());
                putStrings(node, "speakerInfo", audio.getSpeakerInfo());
            }
            case IMAGE -> putText(node, "imageUrl", ((ImageAsset) asset).getImageUrl());
        }
        return node;
    }

    /**
     * Plain map form handed to the document store.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> toDocument(ObjectNode node) {
        return objectMapper.convertValue(node, Map.class);
    }

    public ObjectNode fromDocument(Map<String, Object> document) {
        return objectMapper.valueToTree(document);
    }

    private void putDifficulty(ObjectNode node, DifficultyDetail difficulty) {
        if (difficulty == null) {
            return;
        }
        ObjectNode difficultyNode = node.putObject("difficulty");
        if (difficulty.stage() != null) {
            difficultyNode.put("stage", difficulty.stage().name());
        }
        difficultyNode.put("grade", difficulty.grade());
        difficultyNode.put("level", difficulty.level());
        putLocalized(difficultyNode, "name", difficulty.name());
    }

    private void putLocalized(ObjectNode node, String field, LocalizedString value) {
        if (value == null) {
            return;
        }
        ObjectNode localized = node.putObject(field);
        putText(localized, "en", value.en());
        putText(localized, "zh_tw", value.zhTw());
    }

    private void putChoices(ObjectNode node, List<ChoiceDetail> choices) {
        if (choices == null) {
            return;
        }
        ArrayNode array = node.putArray("choices");
        for (ChoiceDetail choice : choices) {
            ObjectNode choiceNode = array.addObject();
            putText(choiceNode, "text", choice.text());
            choiceNode.put("isCorrect", choice.correct());
        }
    }

    private void putStrings(ObjectNode node, String field, List<String> values) {
        if (values == null) {
            return;
        }
        ArrayNode array = node.putArray(field);
        values.forEach(array::add);
    }

    private void putText(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private void putInstant(ObjectNode node, String field, Instant value) {
        if (value != null) {
            node.put(field, value.toString());
        }
    }
}
