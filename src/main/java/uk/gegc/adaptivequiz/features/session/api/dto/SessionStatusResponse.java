package uk.gegc.adaptivequiz.features.session.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivequiz.features.session.domain.model.Topic;

@Schema(name = "SessionStatusResponse", description = "Read-only snapshot of a quiz session")
public record SessionStatusResponse(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("status") SessionStatus status,
        @JsonProperty("progress") int progress,
        @JsonProperty("total_questions") int totalQuestions,
        @JsonProperty("score") int score,
        @JsonProperty("level") int level,
        @JsonProperty("username") String username,
        @JsonProperty("topic") Topic topic,
        @Schema(description = "Correct answers as a percentage of answered questions", example = "70.0")
        @JsonProperty("percentage_score") double percentageScore
) {
}
