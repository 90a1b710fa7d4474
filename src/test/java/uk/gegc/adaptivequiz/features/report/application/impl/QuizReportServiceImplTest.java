package uk.gegc.adaptivequiz.features.report.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.adaptivequiz.features.oracle.application.ContentOracle;
import uk.gegc.adaptivequiz.features.oracle.application.OracleCallGuard;
import uk.gegc.adaptivequiz.features.oracle.config.OracleProperties;
import uk.gegc.adaptivequiz.features.oracle.domain.model.InsightsRequest;
import uk.gegc.adaptivequiz.features.oracle.domain.model.PerformanceInsights;
import uk.gegc.adaptivequiz.features.report.api.dto.ReportResponse;
import uk.gegc.adaptivequiz.features.report.application.PerformanceAnalyzer;
import uk.gegc.adaptivequiz.features.report.application.ReportRenderer;
import uk.gegc.adaptivequiz.features.report.config.ReportProperties;
import uk.gegc.adaptivequiz.features.report.domain.model.ReportArtifact;
import uk.gegc.adaptivequiz.features.report.domain.model.SessionReport;
import uk.gegc.adaptivequiz.features.session.domain.model.AnswerRecord;
import uk.gegc.adaptivequiz.features.session.domain.model.QuizSession;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionSnapshot;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivequiz.features.session.domain.repository.SessionStore;
import uk.gegc.adaptivequiz.shared.exception.SessionNotCompletedException;
import uk.gegc.adaptivequiz.shared.exception.SessionNotFoundException;
import uk.gegc.adaptivequiz.testsupport.MutableClock;
import uk.gegc.adaptivequiz.testsupport.TestSessions;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("QuizReportServiceImpl")
class QuizReportServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-01-01T10:30:00Z");

    @Mock
    private SessionStore sessionStore;
    @Mock
    private ContentOracle contentOracle;
    @Mock
    private ReportRenderer reportRenderer;

    private QuizReportServiceImpl service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        OracleCallGuard guard = new OracleCallGuard(Runnable::run, new OracleProperties());
        service = new QuizReportServiceImpl(sessionStore, new PerformanceAnalyzer(), contentOracle, guard,
                reportRenderer, new ReportProperties(), clock);
    }

    private SessionSnapshot finishedSession(SessionStatus status) {
        QuizSession session = TestSessions.activeSession(NOW.minusSeconds(600));
        session.getHistory().add(new AnswerRecord("Solve 2x + 3 = 7", "x = 2", "x = 2", "Solving Linear Equations",
                true, 1, "Correct (matches)", "Subtract 3 then divide by 2.", NOW.minusSeconds(300)));
        session.getHistory().add(new AnswerRecord("Factor x^2 - 9", "(x-3)^2", "(x-3)(x+3)", "Factoring Simple Polynomials",
                false, 2, "Incorrect (wrong factors)", "Difference of squares.", NOW.minusSeconds(200)));
        session.setAnsweredCount(2);
        session.setScore(1);
        session.setDifficultyLevel(1);
        session.setStatus(status);
        session.setEndedAt(NOW.minusSeconds(100));
        session.clearCurrentQuestion();
        return SessionSnapshot.of(session);
    }

    @Test
    @DisplayName("generateReport: builds report from history and returns the public path")
    void generateReport_completed_thenRendered() {
        SessionSnapshot session = finishedSession(SessionStatus.COMPLETED);
        when(sessionStore.find(session.sessionId())).thenReturn(Optional.of(session));
        when(contentOracle.generateInsights(any())).thenReturn(
                new PerformanceInsights("Solid start.", "Practise factoring."));
        when(reportRenderer.render(any())).thenReturn(
                new ReportArtifact("Ann_quiz_report_20250101_103000.pdf", Path.of("/tmp/Ann_quiz_report_20250101_103000.pdf")));

        ReportResponse response = service.generateReport(session.sessionId());

        assertThat(response.reportPath()).isEqualTo("/reports/Ann_quiz_report_20250101_103000.pdf");
        assertThat(response.aiSummary()).isEqualTo("Solid start.");
        assertThat(response.aiRecommendations()).isEqualTo("Practise factoring.");

        ArgumentCaptor<SessionReport> reportCaptor = ArgumentCaptor.forClass(SessionReport.class);
        verify(reportRenderer).render(reportCaptor.capture());
        SessionReport report = reportCaptor.getValue();
        assertThat(report.totalAnswered()).isEqualTo(2);
        assertThat(report.correct()).isEqualTo(1);
        assertThat(report.incorrect()).isEqualTo(1);
        assertThat(report.percentageScore()).isEqualTo(50.0);
        assertThat(report.skills().get(0).skill()).isEqualTo("Factoring Simple Polynomials");
        assertThat(report.generatedAt()).isEqualTo(NOW);

        ArgumentCaptor<InsightsRequest> insightsCaptor = ArgumentCaptor.forClass(InsightsRequest.class);
        verify(contentOracle).generateInsights(insightsCaptor.capture());
        assertThat(insightsCaptor.getValue().username()).isEqualTo("Ann");
        assertThat(insightsCaptor.getValue().skills()).hasSize(2);
    }

    @Test
    @DisplayName("generateReport: when insights fail then the report still renders with unavailable markers")
    void generateReport_insightsFail_thenMarkers() {
        SessionSnapshot session = finishedSession(SessionStatus.EXPIRED);
        when(sessionStore.find(session.sessionId())).thenReturn(Optional.of(session));
        when(contentOracle.generateInsights(any())).thenThrow(new IllegalStateException("model down"));
        when(reportRenderer.render(any())).thenReturn(new ReportArtifact("Ann.pdf", Path.of("/tmp/Ann.pdf")));

        ReportResponse response = service.generateReport(session.sessionId());

        assertThat(response.aiSummary()).isEqualTo(QuizReportServiceImpl.SUMMARY_UNAVAILABLE);
        assertThat(response.aiRecommendations()).isEqualTo(QuizReportServiceImpl.RECOMMENDATIONS_UNAVAILABLE);
        verify(contentOracle, times(2)).generateInsights(any());
        verify(reportRenderer).render(argThat(r -> QuizReportServiceImpl.SUMMARY_UNAVAILABLE.equals(r.aiSummary())));
    }

    @Test
    @DisplayName("generateReport: when the session is still active then throws SessionNotCompletedException")
    void generateReport_active_thenThrows() {
        SessionSnapshot session = SessionSnapshot.of(TestSessions.activeSession(NOW));
        when(sessionStore.find(session.sessionId())).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> service.generateReport(session.sessionId()))
                .isInstanceOf(SessionNotCompletedException.class);
        verifyNoInteractions(contentOracle, reportRenderer);
    }

    @Test
    @DisplayName("generateReport: when the session is unknown then throws SessionNotFoundException")
    void generateReport_unknown_thenThrows() {
        when(sessionStore.find("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.generateReport("missing"))
                .isInstanceOf(SessionNotFoundException.class);
    }
}
