package uk.gegc.adaptivequiz.features.session.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "StartQuizResponse", description = "New session id and its first question")
public record StartQuizResponse(
        @Schema(description = "Session id to send with every later request", example = "3fa85f64-5717-4562-b3fc-2c963f66afa6")
        @JsonProperty("session_id") String sessionId,

        @Schema(description = "First question", example = "Solve 2x + 3 = 7")
        @JsonProperty("question") String question,

        @Schema(description = "Correct answer, echoed back with the submission", example = "x = 2")
        @JsonProperty("correct_answer") String correctAnswer,

        @Schema(description = "Skill the question exercises", example = "Solving Linear Equations")
        @JsonProperty("skill") String skill,

        @Schema(description = "Difficulty level 1-5", example = "1")
        @JsonProperty("difficulty") int difficulty,

        @Schema(description = "Number of questions in the quiz", example = "10")
        @JsonProperty("total_questions") int totalQuestions
) {
}
