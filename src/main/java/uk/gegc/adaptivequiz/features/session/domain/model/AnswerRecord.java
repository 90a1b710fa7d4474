package uk.gegc.adaptivequiz.features.session.domain.model;

import java.time.Instant;

/**
 * One answered question in a session's history.
 *
 * @param levelAtTime difficulty level the question was asked at
 */
public record AnswerRecord(
        String question,
        String userAnswer,
        String correctAnswer,
        String skill,
        boolean correct,
        int levelAtTime,
        String judgmentText,
        String explanationText,
        Instant answeredAt
) {
}
