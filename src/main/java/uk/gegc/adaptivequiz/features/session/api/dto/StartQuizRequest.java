package uk.gegc.adaptivequiz.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "StartQuizRequest", description = "Payload for starting a new quiz session")
public record StartQuizRequest(
        @Schema(description = "Name shown on the report", requiredMode = Schema.RequiredMode.REQUIRED, example = "Ann")
        @NotBlank(message = "Username is required")
        @Size(max = 100, message = "Username must be at most 100 characters")
        String username,

        @Schema(description = "Quiz topic", requiredMode = Schema.RequiredMode.REQUIRED, example = "Algebra",
                allowableValues = {"Algebra", "Calculus", "Geometry", "Statistics", "Basic Arithmetic"})
        @NotBlank(message = "Topic is required")
        String topic
) {
}
