package uk.gegc.adaptivequiz.features.session.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
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
import uk.gegc.adaptivequiz.features.session.api.dto.*;
import uk.gegc.adaptivequiz.features.session.application.QuizSessionService;
import uk.gegc.adaptivequiz.shared.rate_limit.RateLimitProperties;
import uk.gegc.adaptivequiz.shared.rate_limit.RateLimitService;

@Tag(name = "Quiz Sessions", description = "Start an adaptive quiz, answer questions and keep the session alive")
@RestController
@RequiredArgsConstructor
public class QuizSessionController {

    private final QuizSessionService quizSessionService;
    private final RateLimitService rateLimitService;
    private final RateLimitProperties rateLimitProperties;

    @Operation(
            summary = "Start a quiz",
            description = "Creates a new session on the given topic and returns its first question at difficulty 1."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session started",
                    content = @Content(schema = @Schema(implementation = StartQuizResponse.class),
                            examples = @ExampleObject(name = "success", value = """
                                    {
                                      "session_id":"3fa85f64-5717-4562-b3fc-2c963f66afa6",
                                      "question":"Solve 2x + 3 = 7",
                                      "correct_answer":"x = 2",
                                      "skill":"Solving Linear Equations",
                                      "difficulty":1,
                                      "total_questions":10
                                    }
                                    """))),
            @ApiResponse(responseCode = "400", description = "Missing username or unsupported topic",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many quiz starts",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Question generation unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/start")
    public ResponseEntity<StartQuizResponse> startQuiz(
            @RequestBody @Valid StartQuizRequest request,
            HttpServletRequest httpRequest
    ) {
        rateLimitService.checkRateLimit("start", httpRequest.getRemoteAddr(), rateLimitProperties.getStartPerMinute());
        return ResponseEntity.ok(quizSessionService.startQuiz(request.username(), request.topic()));
    }

    @Operation(
            summary = "Submit an answer",
            description = "Judges the answer to the session's active question, adapts the difficulty and returns the next question. "
                    + "After the tenth answer quiz_complete is true and no question is returned."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer judged",
                    content = @Content(schema = @Schema(implementation = AnswerResponse.class))),
            @ApiResponse(responseCode = "400", description = "Empty answer or stale question",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session completed, expired or busy",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Judging or question generation unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/answer")
    public ResponseEntity<AnswerResponse> submitAnswer(
            @RequestBody @Valid AnswerRequest request,
            HttpServletRequest httpRequest
    ) {
        rateLimitService.checkRateLimit("answer", httpRequest.getRemoteAddr(), rateLimitProperties.getAnswerPerMinute());
        return ResponseEntity.ok(quizSessionService.submitAnswer(request));
    }

    @Operation(summary = "Session heartbeat", description = "Marks the session as active so it is not expired.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session is active",
                    content = @Content(schema = @Schema(implementation = HeartbeatResponse.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session completed or expired",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many heartbeats",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/session/heartbeat")
    public ResponseEntity<HeartbeatResponse> heartbeat(
            @RequestBody @Valid SessionRequest request,
            HttpServletRequest httpRequest
    ) {
        rateLimitService.checkRateLimit("heartbeat", httpRequest.getRemoteAddr(), rateLimitProperties.getDefaultPerMinute());
        return ResponseEntity.ok(quizSessionService.heartbeat(request.sessionId()));
    }

    @Operation(summary = "Recover session state", description = "Returns progress, score and level of a session without extending it.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session snapshot",
                    content = @Content(schema = @Schema(implementation = SessionStatusResponse.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many requests",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/session/recover")
    public ResponseEntity<SessionStatusResponse> recover(
            @RequestBody @Valid SessionRequest request,
            HttpServletRequest httpRequest
    ) {
        rateLimitService.checkRateLimit("recover", httpRequest.getRemoteAddr(), rateLimitProperties.getDefaultPerMinute());
        return ResponseEntity.ok(quizSessionService.getStatus(request.sessionId()));
    }
}
