package uk.gegc.adaptivequiz.features.session.application;

/**
 * Decides the difficulty level of the next question from the current level
 * and whether the last answer was correct.
 */
public interface DifficultyPolicy {

    int MIN_LEVEL = 1;
    int MAX_LEVEL = 5;

    /**
     * @throws IllegalArgumentException if {@code currentLevel} is outside [1, 5]
     */
    int nextLevel(int currentLevel, boolean correct);
}
