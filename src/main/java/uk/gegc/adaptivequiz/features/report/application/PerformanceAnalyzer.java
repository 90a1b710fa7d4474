package uk.gegc.adaptivequiz.features.report.application;

import org.springframework.stereotype.Component;
import uk.gegc.adaptivequiz.features.report.domain.model.SkillPerformance;
import uk.gegc.adaptivequiz.features.session.domain.model.AnswerRecord;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates a session history into per-skill results.
 */
@Component
public class PerformanceAnalyzer {

    static final String UNKNOWN_SKILL = "General";

    /**
     * Per-skill tallies, weakest skill first. Ties keep alphabetical order.
     */
    public List<SkillPerformance> skillBreakdown(List<AnswerRecord> history) {
        Map<String, int[]> tallies = new LinkedHashMap<>();
        for (AnswerRecord record : history) {
            String skill = record.skill() == null || record.skill().isBlank() ? UNKNOWN_SKILL : record.skill();
            int[] tally = tallies.computeIfAbsent(skill, k -> new int[2]);
            if (record.correct()) {
                tally[0]++;
            }
            tally[1]++;
        }

        return tallies.entrySet().stream()
                .map(e -> new SkillPerformance(e.getKey(), e.getValue()[0], e.getValue()[1]))
                .sorted(Comparator.comparingDouble(SkillPerformance::percentage)
                        .thenComparing(SkillPerformance::skill))
                .toList();
    }
}
