package uk.gegc.adaptivequiz.features.session.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "SessionRequest", description = "Request identifying a quiz session")
public record SessionRequest(
        @Schema(description = "Session id", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Session ID required")
        @JsonProperty("session_id") String sessionId
) {
}
