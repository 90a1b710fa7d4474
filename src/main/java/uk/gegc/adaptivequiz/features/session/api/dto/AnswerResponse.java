package uk.gegc.adaptivequiz.features.session.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "AnswerResponse", description = "Judgment of the submitted answer and, unless the quiz is complete, the next question")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerResponse(
        @JsonProperty("is_correct") boolean correct,

        @Schema(description = "Short verdict", example = "Correct (Solution is equivalent to x=2)")
        @JsonProperty("judgment_text") String judgmentText,

        @Schema(description = "Step-by-step explanation")
        @JsonProperty("explanation_text") String explanationText,

        @Schema(description = "Score after this answer", example = "3")
        @JsonProperty("score") int score,

        @Schema(description = "Difficulty level for the next question", example = "2")
        @JsonProperty("level") int level,

        @Schema(description = "Questions answered so far", example = "4")
        @JsonProperty("progress") int progress,

        @JsonProperty("quiz_complete") boolean quizComplete,

        @Schema(description = "Next question (absent once the quiz is complete)")
        @JsonProperty("question") String question,

        @Schema(description = "Correct answer of the next question (absent once the quiz is complete)")
        @JsonProperty("correct_answer") String correctAnswer,

        @Schema(description = "Skill of the next question (absent once the quiz is complete)")
        @JsonProperty("skill") String skill
) {
}
