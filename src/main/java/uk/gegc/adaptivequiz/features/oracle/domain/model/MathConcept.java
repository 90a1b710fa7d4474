package uk.gegc.adaptivequiz.features.oracle.domain.model;

/**
 * A concept within a topic that questions can be targeted at.
 *
 * @param baseDifficulty 1 (easiest) to 5 (hardest)
 */
public record MathConcept(String name, String description, int baseDifficulty) {
}
