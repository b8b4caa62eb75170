package uk.gegc.examgen.features.ai.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "IngestionResponse", description = "Terminal state of one ingested payload")
public record IngestionResponse(
        @Schema(description = "ACCEPTED or REJECTED")
        String state,
        @Schema(description = "Accepted entity in wire form")
        JsonNode entity,
        FailureDto failure
) {
}
