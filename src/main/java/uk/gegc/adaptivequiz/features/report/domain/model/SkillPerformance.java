package uk.gegc.adaptivequiz.features.report.domain.model;

/**
 * Correct/total tally for one skill.
 */
public record SkillPerformance(String skill, int correct, int total) {

    public int incorrect() {
        return total - correct;
    }

    public double percentage() {
        return total == 0 ? 0.0 : correct * 100.0 / total;
    }
}
