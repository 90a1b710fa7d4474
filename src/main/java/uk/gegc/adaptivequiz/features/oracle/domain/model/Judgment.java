package uk.gegc.adaptivequiz.features.oracle.domain.model;

/**
 * Outcome of judging a user's answer against the stored correct answer.
 */
public record Judgment(boolean correct, String judgmentText, String explanationText) {
}
