package uk.gegc.adaptivequiz.features.report.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.adaptivequiz.features.oracle.application.ContentOracle;
import uk.gegc.adaptivequiz.features.oracle.application.OracleCallGuard;
import uk.gegc.adaptivequiz.features.oracle.domain.model.InsightsRequest;
import uk.gegc.adaptivequiz.features.oracle.domain.model.PerformanceInsights;
import uk.gegc.adaptivequiz.features.report.api.dto.ReportResponse;
import uk.gegc.adaptivequiz.features.report.application.PerformanceAnalyzer;
import uk.gegc.adaptivequiz.features.report.application.QuizReportService;
import uk.gegc.adaptivequiz.features.report.application.ReportRenderer;
import uk.gegc.adaptivequiz.features.report.config.ReportProperties;
import uk.gegc.adaptivequiz.features.report.domain.model.ReportArtifact;
import uk.gegc.adaptivequiz.features.report.domain.model.SessionReport;
import uk.gegc.adaptivequiz.features.report.domain.model.SkillPerformance;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionSnapshot;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivequiz.features.session.domain.repository.SessionStore;
import uk.gegc.adaptivequiz.shared.exception.OracleUnavailableException;
import uk.gegc.adaptivequiz.shared.exception.SessionNotCompletedException;
import uk.gegc.adaptivequiz.shared.exception.SessionNotFoundException;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuizReportServiceImpl implements QuizReportService {

    public static final String SUMMARY_UNAVAILABLE = "AI summary unavailable.";
    public static final String RECOMMENDATIONS_UNAVAILABLE = "AI recommendations unavailable.";

    private final SessionStore sessionStore;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final ContentOracle contentOracle;
    private final OracleCallGuard oracleCallGuard;
    private final ReportRenderer reportRenderer;
    private final ReportProperties reportProperties;
    private final Clock clock;

    @Override
    public ReportResponse generateReport(String sessionId) {
        SessionSnapshot session = sessionStore.find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (session.status() == SessionStatus.ACTIVE) {
            throw new SessionNotCompletedException(sessionId);
        }

        List<SkillPerformance> skills = performanceAnalyzer.skillBreakdown(session.history());
        double percentageScore = session.percentageScore();
        PerformanceInsights insights = insightsFor(session, skills, percentageScore);

        int correct = (int) session.correctCount();
        SessionReport report = SessionReport.builder()
                .sessionId(session.sessionId())
                .username(session.username())
                .topic(session.topic())
                .totalAnswered(session.answeredCount())
                .correct(correct)
                .incorrect(session.answeredCount() - correct)
                .score(session.score())
                .finalLevel(session.difficultyLevel())
                .percentageScore(percentageScore)
                .skills(skills)
                .history(session.history())
                .aiSummary(insights.summary())
                .aiRecommendations(insights.recommendations())
                .generatedAt(clock.instant())
                .build();

        ReportArtifact artifact = reportRenderer.render(report);
        log.info("Report for session {} ({} on {}) written to {}",
                sessionId, session.username(), session.topic(), artifact.location());

        return new ReportResponse(
                reportProperties.getPublicPathPrefix() + artifact.filename(),
                insights.summary(),
                insights.recommendations()
        );
    }

    private PerformanceInsights insightsFor(SessionSnapshot session, List<SkillPerformance> skills, double percentageScore) {
        InsightsRequest request = new InsightsRequest(session.username(), session.topic(), percentageScore, skills);
        try {
            return oracleCallGuard.call("generate insights", () -> contentOracle.generateInsights(request));
        } catch (OracleUnavailableException e) {
            log.warn("Insights unavailable for session {}: {}", session.sessionId(), e.getMessage());
            return new PerformanceInsights(SUMMARY_UNAVAILABLE, RECOMMENDATIONS_UNAVAILABLE);
        }
    }
}
