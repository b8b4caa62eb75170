package uk.gegc.examgen.features.ai.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.api.dto.BatchIngestionResponse;
import uk.gegc.examgen.features.ai.api.dto.ElementRejectionDto;
import uk.gegc.examgen.features.ai.api.dto.FailureDto;
import uk.gegc.examgen.features.ai.api.dto.IngestionResponse;
import uk.gegc.examgen.features.ai.api.dto.ReadingMaterialResponse;
import uk.gegc.examgen.features.ai.api.dto.ViolationDto;
import uk.gegc.examgen.features.ai.domain.model.BatchIngestionResult;
import uk.gegc.examgen.features.ai.domain.model.GenerationSource;
import uk.gegc.examgen.features.ai.domain.model.IngestionFailure;
import uk.gegc.examgen.features.ai.domain.model.IngestionOutcome;
import uk.gegc.examgen.features.ai.domain.model.IngestionState;
import uk.gegc.examgen.features.ai.domain.model.LinkMismatch;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialResult;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.infra.mapping.ContentDocumentMapper;
import uk.gegc.examgen.shared.config.GenerationProperties;

import java.util.List;

@Component
@RequiredArgsConstructor
public class IngestionResponseMapper {

    private final ContentDocumentMapper documentMapper;
    private final GenerationProperties generationProperties;

    public IngestionResponse toQuestionResponse(IngestionOutcome<Question> outcome) {
        return new IngestionResponse(
                outcome.state().name(),
                outcome.entity().map(documentMapper::toNode).orElse(null),
                outcome.failure().map(this::toFailureDto).orElse(null)
        );
    }

    public IngestionResponse toAssetResponse(IngestionOutcome<Asset> outcome) {
        return new IngestionResponse(
                outcome.state().name(),
                outcome.entity().map(documentMapper::toNode).orElse(null),
                outcome.failure().map(this::toFailureDto).orElse(null)
        );
    }

    public BatchIngestionResponse toBatchResponse(BatchIngestionResult result) {
        return new BatchIngestionResponse(
                result.requested(),
                result.acceptedCount(),
                result.needsTopUp(),
                toQuestionNodes(result.accepted()),
                result.rejections().stream()
                        .map(rejection -> new ElementRejectionDto(rejection.index(), toFailureDto(rejection.failure())))
                        .toList(),
                result.batchFailure() != null ? toFailureDto(result.batchFailure()) : null
        );
    }

    public ReadingMaterialResponse toReadingMaterialResponse(ReadingMaterialResult result, GenerationSource source) {
        JsonNode passage = result.materialIfAccepted()
                .map(material -> (JsonNode) documentMapper.toNode(material.passageAsset()))
                .orElse(null);
        return new ReadingMaterialResponse(
                source != null ? source.name() : null,
                result.isAccepted() ? IngestionState.ACCEPTED.name() : IngestionState.REJECTED.name(),
                passage,
                toQuestionNodes(result.linkedQuestions()),
                result.passageFailure() != null ? toFailureDto(result.passageFailure()) : null,
                result.questions() != null ? toBatchResponse(result.questions()) : null,
                result.linkMismatches().stream().map(LinkMismatch::message).toList()
        );
    }

    public FailureDto toFailureDto(IngestionFailure failure) {
        return new FailureDto(
                failure.reason().name(),
                failure.failedAt().name(),
                failure.message(),
                failure.violations().stream()
                        .map(v -> new ViolationDto(v.field(), v.code().name(), v.message()))
                        .toList(),
                failure.rawText() != null ? failure.snippet(generationProperties.getRawSnippetLength()) : null
        );
    }

    private List<JsonNode> toQuestionNodes(List<Question> questions) {
        return questions.stream()
                .map(question -> (JsonNode) documentMapper.toNode(question))
                .toList();
    }
}
