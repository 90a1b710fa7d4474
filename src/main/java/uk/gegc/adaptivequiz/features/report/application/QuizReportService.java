package uk.gegc.adaptivequiz.features.report.application;

import uk.gegc.adaptivequiz.features.report.api.dto.ReportResponse;

public interface QuizReportService {

    /**
     * Build, render and describe the report of a completed or expired session.
     */
    ReportResponse generateReport(String sessionId);
}
