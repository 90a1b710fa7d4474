package uk.gegc.adaptivequiz.features.report.domain.model;

import lombok.Builder;
import uk.gegc.adaptivequiz.features.session.domain.model.AnswerRecord;
import uk.gegc.adaptivequiz.features.session.domain.model.Topic;

import java.time.Instant;
import java.util.List;

/**
 * Everything the report renderer needs for one finished session.
 */
@Builder
public record SessionReport(
        String sessionId,
        String username,
        Topic topic,
        int totalAnswered,
        int correct,
        int incorrect,
        int score,
        int finalLevel,
        double percentageScore,
        List<SkillPerformance> skills,
        List<AnswerRecord> history,
        String aiSummary,
        String aiRecommendations,
        Instant generatedAt
) {
}
