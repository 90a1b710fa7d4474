package uk.gegc.adaptivequiz.features.oracle.domain.model;

public record GeneratedQuestion(
        String question,
        String correctAnswer,
        String explanation,
        String skill,
        int difficulty
) {
}
