package uk.gegc.adaptivequiz.features.report.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ReportResponse", description = "Location of the rendered PDF report and the AI insights it contains")
public record ReportResponse(
        @Schema(description = "URL path of the PDF report", example = "/reports/Ann_quiz_report_20250520_143500_3f2b8c1e-9a4d-4e1b-8f3a-2c6d7e8f9a0b.pdf")
        @JsonProperty("report_path") String reportPath,

        @Schema(description = "Summary of strengths and weaknesses")
        @JsonProperty("ai_summary") String aiSummary,

        @Schema(description = "Study recommendations")
        @JsonProperty("ai_recommendations") String aiRecommendations
) {
}
