package uk.gegc.examgen.features.ai.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.examgen.features.ai.api.dto.BatchIngestionResponse;
import uk.gegc.examgen.features.ai.api.dto.GenerateReadingMaterialRequest;
import uk.gegc.examgen.features.ai.api.dto.IngestRequest;
import uk.gegc.examgen.features.ai.api.dto.IngestionResponse;
import uk.gegc.examgen.features.ai.api.dto.ReadingMaterialResponse;
import uk.gegc.examgen.features.ai.application.ContentIngestionService;
import uk.gegc.examgen.features.ai.application.ExamGenerationService;
import uk.gegc.examgen.features.ai.domain.model.BatchIngestionResult;
import uk.gegc.examgen.features.ai.domain.model.GenerationRequest;
import uk.gegc.examgen.features.ai.domain.model.IngestionFailure;
import uk.gegc.examgen.features.ai.domain.model.IngestionOutcome;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialReport;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialResult;
import uk.gegc.examgen.features.ai.domain.model.RejectionReason;
import uk.gegc.examgen.features.ai.infra.mapping.IngestionResponseMapper;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.shared.config.GenerationProperties;

import java.util.List;

/**
 * Runs untrusted model output through the ingestion pipeline. A rejection is a normal result:
 * it comes back as 422 with the structured failure rather than as a problem document.
 */
@RestController
@RequestMapping("/api/v1/content")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Content Ingestion", description = "Validate model output and generate reading material")
public class ContentIngestionController {

    private final ContentIngestionService contentIngestionService;
    private final ExamGenerationService examGenerationService;
    private final IngestionResponseMapper responseMapper;
    private final GenerationProperties generationProperties;

    @Operation(
            summary = "Ingest one question",
            description = "Parses, resolves and validates a single question payload"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Question accepted",
                    content = @Content(schema = @Schema(implementation = IngestionResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "422", description = "Question rejected")
    })
    @PostMapping("/ingest/question")
    public ResponseEntity<IngestionResponse> ingestQuestion(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Raw question text and context",
                    required = true
            )
            @Valid @RequestBody IngestRequest request) {
        log.info("Question ingestion requested (expected type {})", request.expectedQuestionType());

        IngestionOutcome<Question> outcome = contentIngestionService.ingestQuestion(request.rawText(), request.toContext());
        return withStatus(outcome.isAccepted(), responseMapper.toQuestionResponse(outcome));
    }

    @Operation(
            summary = "Ingest one asset",
            description = "Parses, resolves and validates a single passage, audio or image payload"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Asset accepted",
                    content = @Content(schema = @Schema(implementation = IngestionResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "422", description = "Asset rejected")
    })
    @PostMapping("/ingest/asset")
    public ResponseEntity<IngestionResponse> ingestAsset(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Raw asset text and context",
                    required = true
            )
            @Valid @RequestBody IngestRequest request) {
        log.info("Asset ingestion requested (expected type {})", request.expectedAssetType());

        IngestionOutcome<Asset> outcome = contentIngestionService.ingestAsset(request.rawText(), request.toContext());
        return withStatus(outcome.isAccepted(), responseMapper.toAssetResponse(outcome));
    }

    @Operation(
            summary = "Ingest a question batch",
            description = "Ingests a questions_list envelope; each element is accepted or dropped independently"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "At least one question accepted",
                    content = @Content(schema = @Schema(implementation = BatchIngestionResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "422", description = "No question accepted")
    })
    @PostMapping("/ingest/question-batch")
    public ResponseEntity<BatchIngestionResponse> ingestQuestionBatch(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Raw batch text and context",
                    required = true
            )
            @Valid @RequestBody IngestRequest request) {
        int requested = request.requestedOrDefault(generationProperties.getQuestionsPerBatch());
        log.info("Batch ingestion requested: {} question(s) of type {}", requested, request.expectedQuestionType());

        BatchIngestionResult result = contentIngestionService.ingestQuestionBatch(
                request.rawText(), requested, request.toContext());
        return withStatus(result.isAccepted(), responseMapper.toBatchResponse(result));
    }

    @Operation(
            summary = "Ingest reading material",
            description = "Ingests a passage with its comprehension questions and links them"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Passage accepted with at least one linked question",
                    content = @Content(schema = @Schema(implementation = ReadingMaterialResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "422", description = "Reading material rejected")
    })
    @PostMapping("/ingest/reading-material")
    public ResponseEntity<ReadingMaterialResponse> ingestReadingMaterial(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Raw reading-material text and context",
                    required = true
            )
            @Valid @RequestBody IngestRequest request) {
        int requested = request.requestedOrDefault(generationProperties.getQuestionsPerBatch());
        log.info("Reading material ingestion requested with {} question(s)", requested);

        ReadingMaterialResult result = contentIngestionService.ingestReadingMaterial(
                request.rawText(), requested, request.toContext());
        return withStatus(result.isAccepted(), responseMapper.toReadingMaterialResponse(result, null));
    }

    @Operation(
            summary = "Generate reading material",
            description = "Generates a passage and its comprehension questions in one model call"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Reading material generated",
                    content = @Content(schema = @Schema(implementation = ReadingMaterialResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "422", description = "Model output rejected"),
            @ApiResponse(responseCode = "503", description = "AI service unavailable")
    })
    @PostMapping("/generate/reading-material")
    public ResponseEntity<ReadingMaterialResponse> generateReadingMaterial(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Difficulty, topic and question count",
                    required = true
            )
            @Valid @RequestBody GenerateReadingMaterialRequest request) {
        int questionCount = request.questionCount() != null
                ? request.questionCount()
                : generationProperties.getQuestionsPerBatch();
        log.info("Reading material generation requested: topic '{}', {} question(s)", request.topic(), questionCount);

        GenerationRequest generationRequest = GenerationRequest.builder()
                .questionType(QuestionType.READING_COMPREHENSION)
                .difficulty(request.difficulty().toDetail())
                .topic(request.topic())
                .questionCount(questionCount)
                .learningObjectives(request.learningObjectives() != null ? request.learningObjectives() : List.of())
                .build();
        ReadingMaterialReport report = examGenerationService.generateReadingMaterial(generationRequest);
        ReadingMaterialResponse body = responseMapper.toReadingMaterialResponse(report.result(), report.source());

        IngestionFailure failure = report.result().passageFailure();
        if (failure != null && failure.reason() == RejectionReason.COLLABORATOR_FAILURE) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return withStatus(report.result().isAccepted(), body);
    }

    private static <T> ResponseEntity<T> withStatus(boolean accepted, T body) {
        return accepted
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }
}
