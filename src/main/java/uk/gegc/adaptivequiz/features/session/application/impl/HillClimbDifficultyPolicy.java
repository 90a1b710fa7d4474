package uk.gegc.adaptivequiz.features.session.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.adaptivequiz.features.session.application.DifficultyPolicy;

/**
 * One level up after a correct answer, one level down after a wrong one,
 * clamped to [1, 5].
 */
@Component
public class HillClimbDifficultyPolicy implements DifficultyPolicy {

    @Override
    public int nextLevel(int currentLevel, boolean correct) {
        if (currentLevel < MIN_LEVEL || currentLevel > MAX_LEVEL) {
            throw new IllegalArgumentException(
                    "Difficulty level must be between " + MIN_LEVEL + " and " + MAX_LEVEL + ", got " + currentLevel);
        }
        return correct
                ? Math.min(MAX_LEVEL, currentLevel + 1)
                : Math.max(MIN_LEVEL, currentLevel - 1);
    }
}
