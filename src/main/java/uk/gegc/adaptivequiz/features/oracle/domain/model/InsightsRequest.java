package uk.gegc.adaptivequiz.features.oracle.domain.model;

import uk.gegc.adaptivequiz.features.report.domain.model.SkillPerformance;
import uk.gegc.adaptivequiz.features.session.domain.model.Topic;

import java.util.List;

public record InsightsRequest(
        String username,
        Topic topic,
        double percentageScore,
        List<SkillPerformance> skills
) {
    public InsightsRequest {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
