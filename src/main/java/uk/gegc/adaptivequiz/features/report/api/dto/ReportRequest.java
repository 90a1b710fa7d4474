package uk.gegc.adaptivequiz.features.report.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "ReportRequest", description = "Request for the report of a finished session")
public record ReportRequest(
        @Schema(description = "Session id", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Session ID required")
        @JsonProperty("session_id") String sessionId
) {
}
