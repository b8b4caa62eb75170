package uk.gegc.examgen.features.content.infra.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import uk.gegc.examgen.features.ai.application.impl.ContentIngestionServiceImpl;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.ai.domain.model.IngestionOutcome;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.Question;

import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.examgen.testsupport.ContentFixtures.AUDIO_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.IMAGE_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.PASSAGE_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.audio;
import static uk.gegc.examgen.testsupport.ContentFixtures.contentValidator;
import static uk.gegc.examgen.testsupport.ContentFixtures.fillInTheBlankMultipleChoice;
import static uk.gegc.examgen.testsupport.ContentFixtures.fillInTheBlankTextInput;
import static uk.gegc.examgen.testsupport.ContentFixtures.image;
import static uk.gegc.examgen.testsupport.ContentFixtures.ingestionService;
import static uk.gegc.examgen.testsupport.ContentFixtures.listening;
import static uk.gegc.examgen.testsupport.ContentFixtures.passage;
import static uk.gegc.examgen.testsupport.ContentFixtures.pictureDescription;
import static uk.gegc.examgen.testsupport.ContentFixtures.readingMultipleChoice;
import static uk.gegc.examgen.testsupport.ContentFixtures.readingTextInput;
import static uk.gegc.examgen.testsupport.ContentFixtures.spellingSentence;
import static uk.gegc.examgen.testsupport.ContentFixtures.spellingWordChoices;
import static uk.gegc.examgen.testsupport.ContentFixtures.translation;

class ContentDocumentMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ContentDocumentMapper mapper = new ContentDocumentMapper(objectMapper);
    private final ContentIngestionServiceImpl ingestion = ingestionService(objectMapper);

    static Stream<Question> questions() {
        return Stream.of(
                readingMultipleChoice(PASSAGE_ID),
                readingTextInput(PASSAGE_ID),
                listening(AUDIO_ID),
                fillInTheBlankMultipleChoice(),
                fillInTheBlankTextInput(),
                translation(),
                pictureDescription(IMAGE_ID),
                spellingWordChoices(),
                spellingSentence());
    }

    static Stream<Asset> assets() {
        return Stream.of(passage(PASSAGE_ID), audio(AUDIO_ID), image(IMAGE_ID));
    }

    @ParameterizedTest(name = "{index}: {0}")
    @MethodSource("questions")
    @DisplayName("a stored question reads back equal to the original")
    void questionSurvivesStorage(Question original) {
        Map<String, Object> document = mapper.toDocument(mapper.toNode(original));

        IngestionOutcome<Question> outcome = ingestion.ingestQuestionNode(mapper.fromDocument(document), IngestionContext.empty());

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.getEntity()).isEqualTo(original);
        assertThat(contentValidator().validate(outcome.getEntity()).isValid()).isTrue();
    }

    @ParameterizedTest(name = "{index}: {0}")
    @MethodSource("assets")
    @DisplayName("a stored asset reads back equal to the original")
    void assetSurvivesStorage(Asset original) {
        Map<String, Object> document = mapper.toDocument(mapper.toNode(original));

        IngestionOutcome<Asset> outcome = ingestion.ingestAssetNode(mapper.fromDocument(document), IngestionContext.empty());

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.getEntity()).isEqualTo(original);
    }

    @Test
    @DisplayName("documents use the camelCase wire names and the discriminator")
    void wireNames() {
        ObjectNode node = mapper.toNode(readingMultipleChoice(PASSAGE_ID));

        assertThat(node.get("questionType").asText()).isEqualTo("READING_COMPREHENSION");
        assertThat(node.get("contentAssetId").asText()).isEqualTo(PASSAGE_ID);
        assertThat(node.get("choices").get(1).get("isCorrect").asBoolean()).isTrue();
        assertThat(node.get("explanation").has("zh_tw")).isTrue();
        assertThat(node.get("createdAt").asText()).isEqualTo("2025-03-01T09:30:00Z");
        assertThat(node.has("acceptableAnswers")).isFalse();
    }

    @Test
    @DisplayName("asset documents carry status and version")
    void assetMetadata() {
        Map<String, Object> document = mapper.toDocument(mapper.toNode(passage(PASSAGE_ID)));

        assertThat(document)
                .containsEntry("assetType", "PASSAGE")
                .containsEntry("assetId", PASSAGE_ID)
                .containsEntry("status", "DRAFT")
                .containsEntry("version", 1)
                .doesNotContainKey("source");
    }
}
