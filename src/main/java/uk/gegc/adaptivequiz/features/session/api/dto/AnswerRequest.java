package uk.gegc.adaptivequiz.features.session.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "AnswerRequest", description = "Answer to the session's active question")
public record AnswerRequest(
        @Schema(description = "Session id", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Session ID required")
        @JsonProperty("session_id") String sessionId,

        @Schema(description = "The question being answered, as served", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Question is required")
        @JsonProperty("question") String question,

        @Schema(description = "The correct answer, as served", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Correct answer is required")
        @JsonProperty("correct_answer") String correctAnswer,

        @Schema(description = "The user's answer", requiredMode = Schema.RequiredMode.REQUIRED, example = "2")
        @NotBlank(message = "Answer must not be empty")
        @JsonProperty("user_answer") String userAnswer,

        @Schema(description = "Skill of the question, as served")
        @JsonProperty("skill") String skill
) {
}
