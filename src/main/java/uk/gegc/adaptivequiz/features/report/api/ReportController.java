package uk.gegc.adaptivequiz.features.report.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.adaptivequiz.features.report.api.dto.ReportRequest;
import uk.gegc.adaptivequiz.features.report.api.dto.ReportResponse;
import uk.gegc.adaptivequiz.features.report.application.QuizReportService;
import uk.gegc.adaptivequiz.shared.rate_limit.RateLimitProperties;
import uk.gegc.adaptivequiz.shared.rate_limit.RateLimitService;

@Tag(name = "Reports", description = "PDF performance reports for finished quiz sessions")
@RestController
@RequiredArgsConstructor
public class ReportController {

    private final QuizReportService quizReportService;
    private final RateLimitService rateLimitService;
    private final RateLimitProperties rateLimitProperties;

    @Operation(
            summary = "Generate a report",
            description = "Renders a PDF report with per-skill results and AI insights for a completed or expired session."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report generated",
                    content = @Content(schema = @Schema(implementation = ReportResponse.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session is still in progress",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many report requests",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Report rendering failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/report")
    public ResponseEntity<ReportResponse> generateReport(
            @RequestBody @Valid ReportRequest request,
            HttpServletRequest httpRequest
    ) {
        rateLimitService.checkRateLimit("report", httpRequest.getRemoteAddr(), rateLimitProperties.getDefaultPerMinute());
        return ResponseEntity.ok(quizReportService.generateReport(request.sessionId()));
    }
}
