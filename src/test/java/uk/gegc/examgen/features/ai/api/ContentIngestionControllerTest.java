package uk.gegc.examgen.features.ai.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.examgen.features.ai.application.ContentIngestionService;
import uk.gegc.examgen.features.ai.application.ExamGenerationService;
import uk.gegc.examgen.features.ai.domain.model.BatchIngestionResult;
import uk.gegc.examgen.features.ai.domain.model.ElementRejection;
import uk.gegc.examgen.features.ai.domain.model.GenerationRequest;
import uk.gegc.examgen.features.ai.domain.model.GenerationSource;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.ai.domain.model.IngestionFailure;
import uk.gegc.examgen.features.ai.domain.model.IngestionOutcome;
import uk.gegc.examgen.features.ai.domain.model.IngestionState;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialReport;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialResult;
import uk.gegc.examgen.features.ai.domain.model.RejectionReason;
import uk.gegc.examgen.features.ai.infra.mapping.IngestionResponseMapper;
import uk.gegc.examgen.features.content.domain.model.GeneratedReadingMaterial;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.model.Stage;
import uk.gegc.examgen.features.content.domain.validation.InvariantViolation;
import uk.gegc.examgen.features.content.domain.validation.ViolationCode;
import uk.gegc.examgen.features.content.infra.mapping.ContentDocumentMapper;
import uk.gegc.examgen.shared.api.problem.ErrorTypes;
import uk.gegc.examgen.shared.config.GenerationProperties;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static uk.gegc.examgen.testsupport.ContentFixtures.PASSAGE_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.passage;
import static uk.gegc.examgen.testsupport.ContentFixtures.readingMultipleChoice;
import static uk.gegc.examgen.testsupport.ContentFixtures.translation;

@WebMvcTest(ContentIngestionController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import({IngestionResponseMapper.class, ContentDocumentMapper.class, GenerationProperties.class})
@DisplayName("ContentIngestionController")
class ContentIngestionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ContentIngestionService contentIngestionService;

    @MockitoBean
    private ExamGenerationService examGenerationService;

    private String body(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    @Nested
    @DisplayName("POST /api/v1/content/ingest/question")
    class IngestQuestion {

        @Test
        @DisplayName("accepted question returns 200 with the entity document")
        void accepted() throws Exception {
            when(contentIngestionService.ingestQuestion(anyString(), any(IngestionContext.class)))
                    .thenReturn(IngestionOutcome.accepted(translation()));

            mockMvc.perform(post("/api/v1/content/ingest/question")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(Map.of("rawText", "{}", "expectedQuestionType", "TRANSLATION"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.state").value("ACCEPTED"))
                    .andExpect(jsonPath("$.entity.questionType").value("TRANSLATION"))
                    .andExpect(jsonPath("$.entity.targetLanguage").value("zh_tw"))
                    .andExpect(jsonPath("$.failure").doesNotExist());
        }

        @Test
        @DisplayName("rejected question returns 422 with every violation")
        void rejected() throws Exception {
            IngestionFailure failure = new IngestionFailure(RejectionReason.INVARIANT_VIOLATION,
                    IngestionState.VALIDATION_FAILED, "TRANSLATION question failed validation with 1 violation(s)",
                    List.of(InvariantViolation.of("acceptableTranslations", ViolationCode.NON_EMPTY, "must not be empty")),
                    "{\"questionType\":\"TRANSLATION\"}");
            when(contentIngestionService.ingestQuestion(anyString(), any(IngestionContext.class)))
                    .thenReturn(IngestionOutcome.rejected(failure));

            mockMvc.perform(post("/api/v1/content/ingest/question")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(Map.of("rawText", "{\"questionType\":\"TRANSLATION\"}"))))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.state").value("REJECTED"))
                    .andExpect(jsonPath("$.entity").doesNotExist())
                    .andExpect(jsonPath("$.failure.reason").value("INVARIANT_VIOLATION"))
                    .andExpect(jsonPath("$.failure.failedAt").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.failure.violations", hasSize(1)))
                    .andExpect(jsonPath("$.failure.violations[0].field").value("acceptableTranslations"))
                    .andExpect(jsonPath("$.failure.violations[0].code").value("NON_EMPTY"))
                    .andExpect(jsonPath("$.failure.rawSnippet").value("{\"questionType\":\"TRANSLATION\"}"));
        }

        @Test
        @DisplayName("request context is handed to the pipeline")
        void contextPassedThrough() throws Exception {
            when(contentIngestionService.ingestQuestion(anyString(), any(IngestionContext.class)))
                    .thenReturn(IngestionOutcome.accepted(readingMultipleChoice(PASSAGE_ID)));

            mockMvc.perform(post("/api/v1/content/ingest/question")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(Map.of(
                                    "rawText", "{}",
                                    "expectedQuestionType", "READING_COMPREHENSION",
                                    "contentAssetId", PASSAGE_ID,
                                    "difficulty", Map.of("stage", "JUNIOR_HIGH", "grade", 1, "level", 4)))))
                    .andExpect(status().isOk());

            ArgumentCaptor<IngestionContext> captor = ArgumentCaptor.forClass(IngestionContext.class);
            verify(contentIngestionService).ingestQuestion(eq("{}"), captor.capture());
            IngestionContext context = captor.getValue();
            assertThat(context.getExpectedQuestionType()).isEqualTo(QuestionType.READING_COMPREHENSION);
            assertThat(context.getContentAssetId()).isEqualTo(PASSAGE_ID);
            assertThat(context.getDifficulty().stage()).isEqualTo(Stage.JUNIOR_HIGH);
            assertThat(context.getDifficulty().name().en()).isEqualTo("Junior High - Grade 1");
        }

        @Test
        @DisplayName("missing rawText is a 400 problem document")
        void missingRawText() throws Exception {
            mockMvc.perform(post("/api/v1/content/ingest/question")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(Map.of("expectedQuestionType", "TRANSLATION"))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Validation Failed"))
                    .andExpect(jsonPath("$.fieldErrors[0].field").value("rawText"));

            verifyNoInteractions(contentIngestionService);
        }

        @Test
        @DisplayName("unreadable request body is a 400 problem document")
        void malformedBody() throws Exception {
            mockMvc.perform(post("/api/v1/content/ingest/question")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Malformed JSON"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/content/ingest/asset")
    class IngestAsset {

        @Test
        @DisplayName("accepted asset returns 200 with status and version")
        void accepted() throws Exception {
            when(contentIngestionService.ingestAsset(anyString(), any(IngestionContext.class)))
                    .thenReturn(IngestionOutcome.accepted(passage(PASSAGE_ID)));

            mockMvc.perform(post("/api/v1/content/ingest/asset")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(Map.of("rawText", "{}", "expectedAssetType", "PASSAGE"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.entity.assetType").value("PASSAGE"))
                    .andExpect(jsonPath("$.entity.assetId").value(PASSAGE_ID))
                    .andExpect(jsonPath("$.entity.status").value("DRAFT"))
                    .andExpect(jsonPath("$.entity.version").value(1));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/content/ingest/question-batch")
    class IngestBatch {

        @Test
        @DisplayName("partial batch returns 200 with the dropped element indices")
        void partialBatch() throws Exception {
            IngestionFailure failure = IngestionFailure.of(RejectionReason.JSON_PARSE_ERROR,
                    IngestionState.PARSE_FAILED, "expected a JSON object, got number", "42");
            BatchIngestionResult result = new BatchIngestionResult(3,
                    List.of(translation(), translation()),
                    List.of(new ElementRejection(1, failure)),
                    null);
            when(contentIngestionService.ingestQuestionBatch(anyString(), anyInt(), any(IngestionContext.class)))
                    .thenReturn(result);

            mockMvc.perform(post("/api/v1/content/ingest/question-batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(Map.of("rawText", "{}"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.requested").value(3))
                    .andExpect(jsonPath("$.accepted").value(2))
                    .andExpect(jsonPath("$.needsTopUp").value(true))
                    .andExpect(jsonPath("$.questions", hasSize(2)))
                    .andExpect(jsonPath("$.rejections[0].index").value(1))
                    .andExpect(jsonPath("$.rejections[0].failure.reason").value("JSON_PARSE_ERROR"));

            verify(contentIngestionService).ingestQuestionBatch(eq("{}"), eq(3), any(IngestionContext.class));
        }

        @Test
        @DisplayName("batch with no survivor returns 422")
        void emptyBatch() throws Exception {
            IngestionFailure failure = IngestionFailure.of(RejectionReason.EMPTY_RESPONSE,
                    IngestionState.RAW_RECEIVED, "model returned no text", "");
            when(contentIngestionService.ingestQuestionBatch(anyString(), anyInt(), any(IngestionContext.class)))
                    .thenReturn(BatchIngestionResult.failed(5, failure));

            mockMvc.perform(post("/api/v1/content/ingest/question-batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(Map.of("rawText", "", "requested", 5))))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.accepted").value(0))
                    .andExpect(jsonPath("$.batchFailure.reason").value("EMPTY_RESPONSE"));
        }

        @Test
        @DisplayName("requested above the batch limit is refused")
        void requestedTooLarge() throws Exception {
            mockMvc.perform(post("/api/v1/content/ingest/question-batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(Map.of("rawText", "{}", "requested", 21))))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(contentIngestionService);
        }
    }

    @Nested
    @DisplayName("POST /api/v1/content/generate/reading-material")
    class GenerateReadingMaterial {

        private final Map<String, Object> request = Map.of(
                "difficulty", Map.of("stage", "ELEMENTARY", "grade", 5, "level", 3),
                "topic", "Night markets",
                "questionCount", 2);

        @Test
        @DisplayName("generated material returns 200 with the passage and its questions")
        void generated() throws Exception {
            GeneratedReadingMaterial material = new GeneratedReadingMaterial(
                    passage(PASSAGE_ID), List.of(readingMultipleChoice(PASSAGE_ID)));
            ReadingMaterialResult result = new ReadingMaterialResult(material, null,
                    new BatchIngestionResult(2, material.questions(), List.of(), null), List.of());
            when(examGenerationService.generateReadingMaterial(any(GenerationRequest.class)))
                    .thenReturn(new ReadingMaterialReport(GenerationSource.EXAMPLE, result));

            mockMvc.perform(post("/api/v1/content/generate/reading-material")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(request)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.source").value("EXAMPLE"))
                    .andExpect(jsonPath("$.state").value("ACCEPTED"))
                    .andExpect(jsonPath("$.passage.assetId").value(PASSAGE_ID))
                    .andExpect(jsonPath("$.questions", hasSize(1)))
                    .andExpect(jsonPath("$.questions[0].contentAssetId").value(PASSAGE_ID));

            ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
            verify(examGenerationService).generateReadingMaterial(captor.capture());
            GenerationRequest sent = captor.getValue();
            assertThat(sent.getQuestionType()).isEqualTo(QuestionType.READING_COMPREHENSION);
            assertThat(sent.getQuestionCount()).isEqualTo(2);
            assertThat(sent.getTopic()).isEqualTo("Night markets");
            assertThat(sent.getDifficulty().name().zhTw()).isEqualTo("國小五年級");
        }

        @Test
        @DisplayName("model failure returns 503 with the collaborator failure")
        void modelUnavailable() throws Exception {
            IngestionFailure failure = IngestionFailure.of(RejectionReason.COLLABORATOR_FAILURE,
                    IngestionState.REQUESTED, "Failed to get AI response after 5 attempts", null);
            ReadingMaterialResult result = new ReadingMaterialResult(null, failure,
                    BatchIngestionResult.failed(2, failure), List.of());
            when(examGenerationService.generateReadingMaterial(any(GenerationRequest.class)))
                    .thenReturn(new ReadingMaterialReport(GenerationSource.MODEL, result));

            mockMvc.perform(post("/api/v1/content/generate/reading-material")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(request)))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.state").value("REJECTED"))
                    .andExpect(jsonPath("$.passageFailure.reason").value("COLLABORATOR_FAILURE"))
                    .andExpect(jsonPath("$.passageFailure.rawSnippet").doesNotExist());
        }

        @Test
        @DisplayName("an argument the service refuses is a 400 invalid-argument problem")
        void refusedArgument() throws Exception {
            when(examGenerationService.generateReadingMaterial(any(GenerationRequest.class)))
                    .thenThrow(new IllegalArgumentException("questionCount must be positive"));

            mockMvc.perform(post("/api/v1/content/generate/reading-material")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(request)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.type").value(ErrorTypes.INVALID_ARGUMENT.toString()))
                    .andExpect(jsonPath("$.title").value("Invalid Argument"))
                    .andExpect(jsonPath("$.detail").value("questionCount must be positive"));
        }

        @Test
        @DisplayName("an unexpected failure is a 500 problem without internal detail")
        void unexpectedFailure() throws Exception {
            when(examGenerationService.generateReadingMaterial(any(GenerationRequest.class)))
                    .thenThrow(new IllegalStateException("template cache corrupted"));

            mockMvc.perform(post("/api/v1/content/generate/reading-material")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(request)))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.type").value(ErrorTypes.INTERNAL_SERVER_ERROR.toString()))
                    .andExpect(jsonPath("$.detail").value("An unexpected error occurred"));
        }

        @Test
        @DisplayName("difficulty level outside 1-10 is refused")
        void levelOutOfRange() throws Exception {
            mockMvc.perform(post("/api/v1/content/generate/reading-material")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(Map.of("difficulty", Map.of("stage", "ELEMENTARY", "grade", 5, "level", 11)))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.fieldErrors[0].field").value("difficulty.level"));

            verifyNoInteractions(examGenerationService);
        }
    }
}
