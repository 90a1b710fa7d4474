package uk.gegc.adaptivequiz.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.adaptivequiz.features.oracle.application.ContentOracle;
import uk.gegc.adaptivequiz.features.oracle.application.OracleCallGuard;
import uk.gegc.adaptivequiz.features.oracle.config.OracleProperties;
import uk.gegc.adaptivequiz.features.oracle.domain.model.GeneratedQuestion;
import uk.gegc.adaptivequiz.features.oracle.domain.model.Judgment;
import uk.gegc.adaptivequiz.features.oracle.domain.model.MathConcept;
import uk.gegc.adaptivequiz.features.oracle.domain.model.QuestionRequest;
import uk.gegc.adaptivequiz.features.oracle.infra.catalog.TopicConceptCatalog;
import uk.gegc.adaptivequiz.features.session.api.dto.*;
import uk.gegc.adaptivequiz.features.session.application.DifficultyPolicy;
import uk.gegc.adaptivequiz.features.session.application.QuizSessionService;
import uk.gegc.adaptivequiz.features.session.config.QuizSessionProperties;
import uk.gegc.adaptivequiz.features.session.domain.model.*;
import uk.gegc.adaptivequiz.features.session.domain.repository.SessionStore;
import uk.gegc.adaptivequiz.shared.exception.InvalidRequestException;
import uk.gegc.adaptivequiz.shared.exception.OracleUnavailableException;
import uk.gegc.adaptivequiz.shared.exception.SessionBusyException;
import uk.gegc.adaptivequiz.shared.exception.SessionNotFoundException;
import uk.gegc.adaptivequiz.shared.exception.SessionTerminalException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuizSessionServiceImpl implements QuizSessionService {

    static final int MAX_USERNAME_LENGTH = 100;

    private final SessionStore sessionStore;
    private final ContentOracle contentOracle;
    private final OracleCallGuard oracleCallGuard;
    private final DifficultyPolicy difficultyPolicy;
    private final TopicConceptCatalog conceptCatalog;
    private final QuizSessionProperties sessionProperties;
    private final OracleProperties oracleProperties;
    private final Clock clock;

    @Override
    public StartQuizResponse startQuiz(String username, String topicName) {
        String trimmedUsername = username == null ? "" : username.trim();
        if (trimmedUsername.isEmpty()) {
            throw new InvalidRequestException("Username is required");
        }
        if (trimmedUsername.length() > MAX_USERNAME_LENGTH) {
            throw new InvalidRequestException("Username must be at most " + MAX_USERNAME_LENGTH + " characters");
        }
        Topic topic = Topic.fromDisplayName(topicName)
                .orElseThrow(() -> new InvalidRequestException("Unsupported topic: " + topicName
                        + ". Supported topics: " + Arrays.stream(Topic.values())
                        .map(Topic::getDisplayName)
                        .collect(Collectors.joining(", "))));

        List<MathConcept> conceptPlan = planConcepts(topic);

        // No skill hint for the opening question: the oracle picks one suited to level 1
        QuestionRequest firstRequest = new QuestionRequest(topic, QuizSession.STARTING_LEVEL, null, List.of());
        GeneratedQuestion first = oracleCallGuard.call("generate question",
                () -> contentOracle.generateQuestion(firstRequest));

        Instant now = clock.instant();
        QuizSession session = new QuizSession();
        session.setSessionId(UUID.randomUUID().toString());
        session.setUsername(trimmedUsername);
        session.setTopic(topic);
        session.setConceptPlan(new ArrayList<>(conceptPlan));
        session.setCurrentQuestion(first.question());
        session.setCurrentCorrectAnswer(first.correctAnswer());
        session.setCurrentSkill(first.skill());
        session.getAskedQuestions().add(first.question());
        session.setCreatedAt(now);
        session.setLastActivityAt(now);

        String sessionId = sessionStore.create(session);
        log.info("New session started: {} for {} on {}. Concepts: {}", sessionId, trimmedUsername, topic,
                conceptPlan.stream().map(MathConcept::name).collect(Collectors.toList()));

        return new StartQuizResponse(
                sessionId,
                first.question(),
                first.correctAnswer(),
                first.skill(),
                QuizSession.STARTING_LEVEL,
                QuizSession.TOTAL_QUESTIONS
        );
    }

    /**
     * Judges the answer and fetches the next question without holding the
     * session lock, so heartbeats are never blocked by slow oracle calls.
     * The session is claimed first and the result committed afterwards; any
     * failure in between releases the claim and leaves the session as it was.
     */
    @Override
    public AnswerResponse submitAnswer(AnswerRequest request) {
        if (request.userAnswer() == null || request.userAnswer().isBlank()) {
            throw new InvalidRequestException("Answer must not be empty");
        }
        String sessionId = request.sessionId();

        SessionSnapshot claimed = sessionStore.update(sessionId, session -> {
            if (session.getStatus().isTerminal()) {
                throw new SessionTerminalException(sessionId, session.getStatus());
            }
            if (session.isAnswerInFlight()) {
                throw new SessionBusyException(sessionId);
            }
            if (!Objects.equals(request.question(), session.getCurrentQuestion())
                    || !Objects.equals(request.correctAnswer(), session.getCurrentCorrectAnswer())) {
                throw new InvalidRequestException("Submitted question does not match the session's active question");
            }
            session.setAnswerInFlight(true);
            return SessionSnapshot.of(session);
        });

        boolean committed = false;
        try {
            Judgment judgment = oracleCallGuard.call("judge answer", () -> contentOracle.judge(
                    claimed.currentQuestion(), claimed.currentCorrectAnswer(), request.userAnswer()));

            int levelAtTime = claimed.difficultyLevel();
            int newScore = claimed.score() + (judgment.correct() ? sessionProperties.getPointsPerCorrect() : 0);
            int newLevel = difficultyPolicy.nextLevel(levelAtTime, judgment.correct());
            int newAnsweredCount = claimed.answeredCount() + 1;
            boolean complete = newAnsweredCount >= QuizSession.TOTAL_QUESTIONS;
            GeneratedQuestion next = complete ? null : nextQuestion(claimed, newLevel, newAnsweredCount);

            AnswerResponse response = sessionStore.update(sessionId, session -> {
                session.setAnswerInFlight(false);
                if (session.getStatus().isTerminal()) {
                    throw new SessionTerminalException(sessionId, session.getStatus());
                }
                if (session.getAnsweredCount() != claimed.answeredCount()
                        || !Objects.equals(session.getCurrentQuestion(), claimed.currentQuestion())) {
                    throw new IllegalStateException("Session " + sessionId + " changed while an answer was in flight");
                }
                return commit(session, request, judgment, levelAtTime, newScore, newLevel, newAnsweredCount, next);
            });
            committed = true;
            return response;
        } finally {
            if (!committed) {
                releaseClaim(sessionId);
            }
        }
    }

    private AnswerResponse commit(QuizSession session, AnswerRequest request, Judgment judgment, int levelAtTime,
                                  int newScore, int newLevel, int newAnsweredCount, GeneratedQuestion next) {
        String sessionId = session.getSessionId();
        Instant now = clock.instant();
        String skill = session.getCurrentSkill() != null ? session.getCurrentSkill() : request.skill();
        session.getHistory().add(new AnswerRecord(
                session.getCurrentQuestion(),
                request.userAnswer(),
                session.getCurrentCorrectAnswer(),
                skill,
                judgment.correct(),
                levelAtTime,
                judgment.judgmentText(),
                judgment.explanationText(),
                now
        ));
        session.setScore(newScore);
        session.setDifficultyLevel(newLevel);
        session.setAnsweredCount(newAnsweredCount);
        session.setLastActivityAt(now);

        log.info("Session {}: answer {} submitted, correct: {}, level: {} -> {}, score: {}, skill: {}",
                sessionId, newAnsweredCount, judgment.correct(), levelAtTime, newLevel, newScore, skill);

        if (next == null) {
            session.setStatus(SessionStatus.COMPLETED);
            session.setEndedAt(now);
            session.clearCurrentQuestion();
            log.info("Session {}: quiz completed with score {}", sessionId, newScore);
            return new AnswerResponse(judgment.correct(), judgment.judgmentText(), judgment.explanationText(),
                    newScore, newLevel, newAnsweredCount, true, null, null, null);
        }

        session.setCurrentQuestion(next.question());
        session.setCurrentCorrectAnswer(next.correctAnswer());
        session.setCurrentSkill(next.skill());
        session.getAskedQuestions().add(next.question());

        return new AnswerResponse(judgment.correct(), judgment.judgmentText(), judgment.explanationText(),
                newScore, newLevel, newAnsweredCount, false,
                next.question(), next.correctAnswer(), next.skill());
    }

    private void releaseClaim(String sessionId) {
        try {
            sessionStore.update(sessionId, session -> {
                session.setAnswerInFlight(false);
                return null;
            });
        } catch (SessionNotFoundException e) {
            log.debug("Session {} was evicted before its answer claim was released", sessionId);
        } catch (RuntimeException e) {
            log.error("Failed to release answer claim on session {}", sessionId, e);
        }
    }

    @Override
    public HeartbeatResponse heartbeat(String sessionId) {
        sessionStore.touch(sessionId);
        log.debug("Heartbeat received for session {}", sessionId);
        return HeartbeatResponse.active();
    }

    @Override
    public SessionStatusResponse getStatus(String sessionId) {
        SessionSnapshot snapshot = sessionStore.find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return new SessionStatusResponse(
                snapshot.sessionId(),
                snapshot.status(),
                snapshot.answeredCount(),
                QuizSession.TOTAL_QUESTIONS,
                snapshot.score(),
                snapshot.difficultyLevel(),
                snapshot.username(),
                snapshot.topic(),
                snapshot.percentageScore()
        );
    }

    private List<MathConcept> planConcepts(Topic topic) {
        try {
            List<MathConcept> planned = oracleCallGuard.call("plan concepts", () -> contentOracle.planConcepts(topic));
            if (!planned.isEmpty()) {
                return planned;
            }
            log.warn("Oracle returned an empty concept plan for {}", topic);
        } catch (OracleUnavailableException e) {
            log.warn("Concept planning unavailable for {}: {}", topic, e.getMessage());
        }
        log.warn("Using fallback concepts for topic: {}", topic);
        return conceptCatalog.conceptsFor(topic);
    }

    /**
     * Rotates through the concept plan and re-requests questions the session
     * has already served, up to the configured retry count.
     */
    private GeneratedQuestion nextQuestion(SessionSnapshot session, int level, int answeredCount) {
        List<MathConcept> plan = session.conceptPlan();
        String skillHint = plan.isEmpty() ? null : plan.get(answeredCount % plan.size()).name();
        QuestionRequest questionRequest = new QuestionRequest(
                session.topic(), level, skillHint, recentQuestions(session));

        int retries = Math.max(0, oracleProperties.getDuplicateQuestionRetries());
        GeneratedQuestion generated = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            generated = oracleCallGuard.call("generate question",
                    () -> contentOracle.generateQuestion(questionRequest));
            if (!session.askedQuestions().contains(generated.question())) {
                return generated;
            }
            log.warn("Session {}: duplicate question generated: {}", session.sessionId(), generated.question());
        }
        log.warn("Session {}: accepting repeated question after {} retries", session.sessionId(), retries);
        return generated;
    }

    private List<String> recentQuestions(SessionSnapshot session) {
        List<String> asked = new ArrayList<>(session.askedQuestions());
        int limit = Math.max(0, oracleProperties.getRecentQuestionsInPrompt());
        return asked.subList(Math.max(0, asked.size() - limit), asked.size());
    }
}
