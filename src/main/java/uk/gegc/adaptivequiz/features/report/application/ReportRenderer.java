package uk.gegc.adaptivequiz.features.report.application;

import uk.gegc.adaptivequiz.features.report.domain.model.ReportArtifact;
import uk.gegc.adaptivequiz.features.report.domain.model.SessionReport;

public interface ReportRenderer {

    /**
     * Render the report to a file in the reports directory.
     *
     * @throws uk.gegc.adaptivequiz.shared.exception.ReportGenerationException if the file cannot be produced
     */
    ReportArtifact render(SessionReport report);
}
