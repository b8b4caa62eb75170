package uk.gegc.examgen.features.ai.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "BatchIngestionResponse", description = "Accepted questions of a batch and why the others were dropped")
public record BatchIngestionResponse(
        int requested,
        int accepted,
        boolean needsTopUp,
        List<JsonNode> questions,
        List<ElementRejectionDto> rejections,
        FailureDto batchFailure
) {
}
