package uk.gegc.examgen.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.examgen.features.ai.application.ContentIngestionService;
import uk.gegc.examgen.features.ai.application.ExamGenerationService;
import uk.gegc.examgen.features.ai.application.ExamplePayloadCatalog;
import uk.gegc.examgen.features.ai.application.ModelCallClient;
import uk.gegc.examgen.features.ai.application.PromptTemplateService;
import uk.gegc.examgen.features.ai.domain.model.BatchIngestionResult;
import uk.gegc.examgen.features.ai.domain.model.GenerationPrompt;
import uk.gegc.examgen.features.ai.domain.model.GenerationRequest;
import uk.gegc.examgen.features.ai.domain.model.GenerationSource;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.ai.domain.model.IngestionFailure;
import uk.gegc.examgen.features.ai.domain.model.IngestionOutcome;
import uk.gegc.examgen.features.ai.domain.model.IngestionState;
import uk.gegc.examgen.features.ai.domain.model.LinkMismatch;
import uk.gegc.examgen.features.ai.domain.model.LinkResult;
import uk.gegc.examgen.features.ai.domain.model.ModelSettings;
import uk.gegc.examgen.features.ai.domain.model.PassageReport;
import uk.gegc.examgen.features.ai.domain.model.QuestionBatchReport;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialReport;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialResult;
import uk.gegc.examgen.features.ai.domain.model.RejectionReason;
import uk.gegc.examgen.features.ai.infra.linker.CrossReferenceLinker;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.ImageAsset;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.shared.config.GenerationProperties;
import uk.gegc.examgen.shared.exception.AiServiceException;
import uk.gegc.examgen.shared.util.IdGenerator;

import java.util.List;
import java.util.function.Supplier;

/**
 * A collaborator failure is not retried here; it comes back as a
 * {@link RejectionReason#COLLABORATOR_FAILURE} rejection so the caller can offer "regenerate".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExamGenerationServiceImpl implements ExamGenerationService {

    private final PromptTemplateService promptTemplateService;
    private final ModelCallClient modelCallClient;
    private final ExamplePayloadCatalog examplePayloadCatalog;
    private final ContentIngestionService contentIngestionService;
    private final CrossReferenceLinker crossReferenceLinker;
    private final GenerationProperties generationProperties;

    @Override
    public QuestionBatchReport generateQuestion(GenerationRequest request) {
        return generateQuestions(request.toBuilder().questionCount(1).build());
    }

    @Override
    public QuestionBatchReport generateQuestions(GenerationRequest request) {
        String shape = request.shape();
        if (request.getQuestionType().referencesAsset() && request.getAsset() == null) {
            throw new IllegalArgumentException(request.getQuestionType() + " questions need an asset to work from");
        }
        int requested = request.getQuestionCount();
        GenerationSource source = sourceFor();
        RawReply reply = obtain(source, shape, () -> promptTemplateService.buildQuestionBatchPrompt(request), request);
        if (reply.failure() != null) {
            return new QuestionBatchReport(source, BatchIngestionResult.failed(requested, reply.failure()), List.of(), List.of());
        }

        IngestionContext context = questionContext(request);
        BatchIngestionResult batch = contentIngestionService.ingestQuestionBatch(reply.text(), requested, context);

        List<Question> questions = batch.accepted();
        List<LinkMismatch> mismatches = List.of();
        Asset asset = request.getAsset();
        if (asset != null && request.getQuestionType().referencesAsset()) {
            LinkResult linkResult = crossReferenceLinker.link(asset, batch.accepted());
            questions = linkResult.linked();
            mismatches = linkResult.mismatches();
        }

        log.info("Generated {} of {} requested {} question(s) from {}",
                questions.size(), requested, request.getQuestionType(), source);
        return new QuestionBatchReport(source, batch, questions, mismatches);
    }

    @Override
    public PassageReport generatePassage(GenerationRequest request) {
        GenerationSource source = sourceFor();
        RawReply reply = obtain(source, ExamplePayloadCatalog.PASSAGE, () -> promptTemplateService.buildPassagePrompt(request), request);
        if (reply.failure() != null) {
            return new PassageReport(source, IngestionOutcome.rejected(reply.failure()));
        }

        IngestionContext context = IngestionContext.builder()
                .expectedAssetType(AssetType.PASSAGE)
                .assetId(IdGenerator.newId())
                .difficulty(request.getDifficulty())
                .learningObjectives(request.getLearningObjectives())
                .build();
        IngestionOutcome<Asset> outcome = contentIngestionService.ingestAsset(reply.text(), context);
        log.info("Passage generation from {} ended {}", source, outcome.state());
        return new PassageReport(source, outcome);
    }

    @Override
    public ReadingMaterialReport generateReadingMaterial(GenerationRequest request) {
        int requested = request.getQuestionCount();
        GenerationSource source = sourceFor();
        RawReply reply = obtain(source, ExamplePayloadCatalog.READING_MATERIAL,
                () -> promptTemplateService.buildReadingMaterialPrompt(request), request);
        if (reply.failure() != null) {
            return new ReadingMaterialReport(source, new ReadingMaterialResult(
                    null, reply.failure(), BatchIngestionResult.failed(requested, reply.failure()), List.of()));
        }

        IngestionContext context = IngestionContext.builder()
                .difficulty(request.getDifficulty())
                .learningObjectives(request.getLearningObjectives())
                .build();
        ReadingMaterialResult result = contentIngestionService.ingestReadingMaterial(reply.text(), requested, context);
        log.info("Reading material generation from {} ended {} with {} linked question(s)",
                source, result.isAccepted() ? "ACCEPTED" : "REJECTED", result.linkedQuestions().size());
        return new ReadingMaterialReport(source, result);
    }

    private GenerationSource sourceFor() {
        return generationProperties.isOffline() ? GenerationSource.EXAMPLE : GenerationSource.MODEL;
    }

    private RawReply obtain(GenerationSource source,
                            String shape,
                            Supplier<GenerationPrompt> promptSupplier,
                            GenerationRequest request) {
        if (source == GenerationSource.EXAMPLE) {
            return examplePayloadCatalog.find(shape)
                    .map(RawReply::of)
                    .orElseGet(() -> RawReply.failed(collaboratorFailure(
                            "offline mode has no example payload for " + shape)));
        }

        GenerationPrompt prompt = promptSupplier.get();
        ModelSettings settings = request.getModelSettings() != null
                ? request.getModelSettings()
                : ModelSettings.of(generationProperties.getModel(), generationProperties.getTemperature());
        try {
            return RawReply.of(modelCallClient.call(prompt.systemPrompt(), prompt.userPrompt(), true, settings));
        } catch (AiServiceException e) {
            return RawReply.failed(collaboratorFailure(e.getMessage()));
        }
    }

    private IngestionContext questionContext(GenerationRequest request) {
        IngestionContext.IngestionContextBuilder builder = IngestionContext.builder()
                .expectedQuestionType(request.getQuestionType())
                .difficulty(request.getDifficulty())
                .learningObjectives(request.getLearningObjectives());
        Asset asset = request.getAsset();
        if (asset != null) {
            if (asset instanceof ImageAsset) {
                builder.imageAssetId(asset.getAssetId());
            } else {
                builder.contentAssetId(asset.getAssetId());
            }
        }
        return builder.build();
    }

    private IngestionFailure collaboratorFailure(String message) {
        log.warn("Model call failed: {}", message);
        return IngestionFailure.of(RejectionReason.COLLABORATOR_FAILURE, IngestionState.REQUESTED, message, null);
    }

    private record RawReply(String text, IngestionFailure failure) {

        static RawReply of(String text) {
            return new RawReply(text, null);
        }

        static RawReply failed(IngestionFailure failure) {
            return new RawReply(null, failure);
        }
    }
}
