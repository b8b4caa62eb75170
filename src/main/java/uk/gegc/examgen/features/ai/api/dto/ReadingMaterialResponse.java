package uk.gegc.examgen.features.ai.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "ReadingMaterialResponse", description = "A linked passage with its questions, or why it was rejected")
public record ReadingMaterialResponse(
        @Schema(description = "MODEL or EXAMPLE for generated material; absent for ingested text")
        String source,
        String state,
        JsonNode passage,
        List<JsonNode> questions,
        FailureDto passageFailure,
        BatchIngestionResponse batch,
        @Schema(description = "Accepted questions excluded because they reference another asset")
        List<String> linkMismatches
) {
}
