package uk.gegc.adaptivequiz.features.session.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.adaptivequiz.features.oracle.application.ContentOracle;
import uk.gegc.adaptivequiz.features.oracle.application.OracleCallGuard;
import uk.gegc.adaptivequiz.features.oracle.config.OracleProperties;
import uk.gegc.adaptivequiz.features.oracle.domain.model.GeneratedQuestion;
import uk.gegc.adaptivequiz.features.oracle.domain.model.Judgment;
import uk.gegc.adaptivequiz.features.oracle.domain.model.QuestionRequest;
import uk.gegc.adaptivequiz.features.oracle.infra.catalog.TopicConceptCatalog;
import uk.gegc.adaptivequiz.features.session.api.dto.*;
import uk.gegc.adaptivequiz.features.session.config.QuizSessionProperties;
import uk.gegc.adaptivequiz.features.session.domain.model.AnswerRecord;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionSnapshot;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivequiz.features.session.domain.model.Topic;
import uk.gegc.adaptivequiz.features.session.infra.InMemorySessionStore;
import uk.gegc.adaptivequiz.shared.exception.*;
import uk.gegc.adaptivequiz.testsupport.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("QuizSessionServiceImpl")
class QuizSessionServiceImplTest {

    private static final Instant START = Instant.parse("2025-01-01T10:00:00Z");

    @Mock
    private ContentOracle contentOracle;

    private final TopicConceptCatalog catalog = new TopicConceptCatalog();
    private final AtomicInteger questionCounter = new AtomicInteger();
    private final List<QuestionRequest> questionRequests = new ArrayList<>();

    private MutableClock clock;
    private InMemorySessionStore store;
    private QuizSessionServiceImpl service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        QuizSessionProperties sessionProperties = new QuizSessionProperties();
        sessionProperties.setLockTimeout(Duration.ofMillis(200));
        OracleProperties oracleProperties = new OracleProperties();
        store = new InMemorySessionStore(clock, sessionProperties);
        OracleCallGuard guard = new OracleCallGuard(Runnable::run, oracleProperties);
        service = new QuizSessionServiceImpl(store, contentOracle, guard, new HillClimbDifficultyPolicy(),
                catalog, sessionProperties, oracleProperties, clock);
    }

    private void stubPlanAndQuestions() {
        when(contentOracle.planConcepts(Topic.ALGEBRA)).thenReturn(catalog.conceptsFor(Topic.ALGEBRA));
        when(contentOracle.generateQuestion(any())).thenAnswer(inv -> {
            QuestionRequest request = inv.getArgument(0);
            questionRequests.add(request);
            int n = questionCounter.incrementAndGet();
            String skill = request.skillHint() != null ? request.skillHint() : "Basic Operations";
            return new GeneratedQuestion("Q" + n, "A" + n, "Explanation " + n, skill, request.difficulty());
        });
    }

    private void stubExactMatchJudge() {
        when(contentOracle.judge(anyString(), anyString(), anyString())).thenAnswer(inv -> {
            String correct = inv.getArgument(1);
            String user = inv.getArgument(2);
            boolean ok = correct.equals(user);
            return new Judgment(ok, ok ? "Correct (match)" : "Incorrect (mismatch)",
                    "A full step-by-step explanation of the solution.");
        });
    }

    private AnswerResponse answer(String sessionId, String question, String correctAnswer, String userAnswer) {
        return service.submitAnswer(new AnswerRequest(sessionId, question, correctAnswer, userAnswer, null));
    }

    @Test
    @DisplayName("startQuiz: then creates an active level-1 session with the first question")
    void startQuiz_thenCreatesSession() {
        stubPlanAndQuestions();

        StartQuizResponse response = service.startQuiz("  Ann ", "algebra");

        assertThat(response.sessionId()).isNotBlank();
        assertThat(response.question()).isEqualTo("Q1");
        assertThat(response.correctAnswer()).isEqualTo("A1");
        assertThat(response.difficulty()).isEqualTo(1);
        assertThat(response.totalQuestions()).isEqualTo(10);
        assertThat(questionRequests.get(0).skillHint()).isNull();
        assertThat(questionRequests.get(0).difficulty()).isEqualTo(1);

        SessionSnapshot snapshot = store.find(response.sessionId()).orElseThrow();
        assertThat(snapshot.username()).isEqualTo("Ann");
        assertThat(snapshot.topic()).isEqualTo(Topic.ALGEBRA);
        assertThat(snapshot.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(snapshot.answeredCount()).isZero();
        assertThat(snapshot.score()).isZero();
        assertThat(snapshot.history()).isEmpty();
        assertThat(snapshot.lastActivityAt()).isEqualTo(START);
        assertThat(snapshot.askedQuestions()).containsExactly("Q1");
    }

    @Test
    @DisplayName("startQuiz: when topic unsupported then throws InvalidRequestException without calling the oracle")
    void startQuiz_unsupportedTopic_thenInvalidRequest() {
        assertThatThrownBy(() -> service.startQuiz("Ann", "Astrology"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("Unsupported topic");
        verifyNoInteractions(contentOracle);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("startQuiz: when username blank or too long then throws InvalidRequestException")
    void startQuiz_badUsername_thenInvalidRequest() {
        assertThatThrownBy(() -> service.startQuiz("   ", "Algebra"))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.startQuiz("x".repeat(101), "Algebra"))
                .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(contentOracle);
    }

    @Test
    @DisplayName("startQuiz: when concept planning fails then falls back to the built-in catalog")
    void startQuiz_planningFails_thenUsesCatalog() {
        when(contentOracle.planConcepts(Topic.GEOMETRY)).thenThrow(new AIResponseParseException("bad json"));
        when(contentOracle.generateQuestion(any()))
                .thenReturn(new GeneratedQuestion("Area?", "12", "w*h", "Basic Shapes & Area", 1));

        StartQuizResponse response = service.startQuiz("Ann", "Geometry");

        SessionSnapshot snapshot = store.find(response.sessionId()).orElseThrow();
        assertThat(snapshot.conceptPlan()).isEqualTo(catalog.conceptsFor(Topic.GEOMETRY));
        verify(contentOracle, times(2)).planConcepts(Topic.GEOMETRY);
    }

    @Test
    @DisplayName("startQuiz: when first question cannot be generated then throws OracleUnavailable and stores nothing")
    void startQuiz_questionFails_thenNoSession() {
        when(contentOracle.planConcepts(Topic.ALGEBRA)).thenReturn(catalog.conceptsFor(Topic.ALGEBRA));
        when(contentOracle.generateQuestion(any())).thenThrow(new RuntimeException("model down"));

        assertThatThrownBy(() -> service.startQuiz("Ann", "Algebra"))
                .isInstanceOf(OracleUnavailableException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Ann on Algebra: ten answers adapt the level and complete the quiz")
    void fullQuiz_adaptsLevelAndCompletes() {
        stubPlanAndQuestions();
        stubExactMatchJudge();
        boolean[] outcomes = {true, true, false, true, true, true, true, false, false, true};
        int[] expectedLevels = {2, 3, 2, 3, 4, 5, 5, 4, 3, 4};

        StartQuizResponse start = service.startQuiz("Ann", "Algebra");
        String sessionId = start.sessionId();
        String question = start.question();
        String correctAnswer = start.correctAnswer();

        AnswerResponse response = null;
        for (int i = 0; i < outcomes.length; i++) {
            String userAnswer = outcomes[i] ? correctAnswer : "wrong";
            response = answer(sessionId, question, correctAnswer, userAnswer);

            assertThat(response.correct()).isEqualTo(outcomes[i]);
            assertThat(response.level()).isEqualTo(expectedLevels[i]);
            assertThat(response.progress()).isEqualTo(i + 1);
            SessionSnapshot snapshot = store.find(sessionId).orElseThrow();
            assertThat(snapshot.history()).hasSize(snapshot.answeredCount());

            if (i < outcomes.length - 1) {
                assertThat(response.quizComplete()).isFalse();
                assertThat(response.question()).isNotNull();
                question = response.question();
                correctAnswer = response.correctAnswer();
            }
        }

        assertThat(response.quizComplete()).isTrue();
        assertThat(response.question()).isNull();
        assertThat(response.correctAnswer()).isNull();
        assertThat(response.skill()).isNull();
        assertThat(response.score()).isEqualTo(7);

        SessionSnapshot finished = store.find(sessionId).orElseThrow();
        assertThat(finished.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(finished.endedAt()).isNotNull();
        assertThat(finished.history()).extracting(AnswerRecord::levelAtTime)
                .containsExactly(1, 2, 3, 2, 3, 4, 5, 5, 4, 3);
        assertThat(finished.percentageScore()).isEqualTo(70.0);
        // nine follow-up questions after the opening one
        assertThat(questionCounter.get()).isEqualTo(10);
    }

    @Test
    @DisplayName("submitAnswer: next questions rotate through the concept plan")
    void submitAnswer_rotatesConcepts() {
        stubPlanAndQuestions();
        stubExactMatchJudge();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");

        AnswerResponse first = answer(start.sessionId(), start.question(), start.correctAnswer(), "A1");
        AnswerResponse second = answer(start.sessionId(), first.question(), first.correctAnswer(), "A2");

        assertThat(first.skill()).isEqualTo("Solving Linear Equations");
        assertThat(second.skill()).isEqualTo("Factoring Simple Polynomials");
        assertThat(questionRequests.get(1).recentQuestions()).containsExactly("Q1");
        assertThat(questionRequests.get(2).recentQuestions()).containsExactly("Q1", "Q2");
    }

    @Test
    @DisplayName("submitAnswer: when next question fails then the session is left untouched")
    void submitAnswer_oracleFailure_thenNoMutation() {
        stubPlanAndQuestions();
        stubExactMatchJudge();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");
        SessionSnapshot before = store.find(start.sessionId()).orElseThrow();
        clock.advance(Duration.ofSeconds(10));

        doThrow(new RuntimeException("timeout")).when(contentOracle).generateQuestion(any());

        assertThatThrownBy(() -> answer(start.sessionId(), start.question(), start.correctAnswer(), "A1"))
                .isInstanceOf(OracleUnavailableException.class);

        SessionSnapshot after = store.find(start.sessionId()).orElseThrow();
        assertThat(after).isEqualTo(before);
    }

    @Test
    @DisplayName("submitAnswer: when judging fails then the session is left untouched")
    void submitAnswer_judgeFailure_thenNoMutation() {
        stubPlanAndQuestions();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");
        SessionSnapshot before = store.find(start.sessionId()).orElseThrow();
        when(contentOracle.judge(anyString(), anyString(), anyString())).thenThrow(new RuntimeException("boom"));

        assertThatThrownBy(() -> answer(start.sessionId(), start.question(), start.correctAnswer(), "A1"))
                .isInstanceOf(OracleUnavailableException.class);

        assertThat(store.find(start.sessionId()).orElseThrow()).isEqualTo(before);
        verify(contentOracle, times(2)).judge(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("submitAnswer: when session expired then throws SessionTerminalException and nothing changes")
    void submitAnswer_terminal_thenRejected() {
        stubPlanAndQuestions();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");
        store.expire(start.sessionId());
        SessionSnapshot before = store.find(start.sessionId()).orElseThrow();

        assertThatThrownBy(() -> answer(start.sessionId(), start.question(), start.correctAnswer(), "A1"))
                .isInstanceOf(SessionTerminalException.class);

        assertThat(store.find(start.sessionId()).orElseThrow()).isEqualTo(before);
        verify(contentOracle, never()).judge(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("submitAnswer: when question does not match the active one then throws InvalidRequestException")
    void submitAnswer_staleQuestion_thenInvalidRequest() {
        stubPlanAndQuestions();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");

        assertThatThrownBy(() -> answer(start.sessionId(), "Some other question", start.correctAnswer(), "A1"))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> answer(start.sessionId(), start.question(), start.correctAnswer(), "  "))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(store.find(start.sessionId()).orElseThrow().answeredCount()).isZero();
    }

    @Test
    @DisplayName("submitAnswer: while judging is slow, heartbeats succeed and a second answer is rejected as busy")
    void submitAnswer_slowJudge_thenHeartbeatNotBlocked() throws Exception {
        stubPlanAndQuestions();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");
        CountDownLatch judging = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(contentOracle.judge(anyString(), anyString(), anyString())).thenAnswer(inv -> {
            judging.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new Judgment(true, "Correct", "Explanation");
        });
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<AnswerResponse> pending = pool.submit(
                    () -> answer(start.sessionId(), start.question(), start.correctAnswer(), "A1"));
            assertThat(judging.await(5, TimeUnit.SECONDS)).isTrue();

            clock.advance(Duration.ofSeconds(20));
            long begin = System.nanoTime();
            assertThat(service.heartbeat(start.sessionId()).status()).isEqualTo("active");
            assertThat(Duration.ofNanos(System.nanoTime() - begin)).isLessThan(Duration.ofMillis(200));
            assertThat(service.getStatus(start.sessionId()).progress()).isZero();

            assertThatThrownBy(() -> answer(start.sessionId(), start.question(), start.correctAnswer(), "A1"))
                    .isInstanceOf(SessionBusyException.class);

            release.countDown();
            AnswerResponse response = pending.get(5, TimeUnit.SECONDS);
            assertThat(response.correct()).isTrue();
            assertThat(response.progress()).isEqualTo(1);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }

        SessionSnapshot after = store.find(start.sessionId()).orElseThrow();
        assertThat(after.answeredCount()).isEqualTo(1);
        assertThat(after.history()).hasSize(1);
        verify(contentOracle, times(1)).judge(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("submitAnswer: after a failed answer the session accepts the next attempt")
    void submitAnswer_afterFailure_thenClaimReleased() {
        stubPlanAndQuestions();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");
        when(contentOracle.judge(anyString(), anyString(), anyString()))
                .thenThrow(new RuntimeException("boom"), new RuntimeException("boom"))
                .thenReturn(new Judgment(false, "Incorrect", "Explanation"));

        assertThatThrownBy(() -> answer(start.sessionId(), start.question(), start.correctAnswer(), "A1"))
                .isInstanceOf(OracleUnavailableException.class);

        AnswerResponse response = answer(start.sessionId(), start.question(), start.correctAnswer(), "A1");
        assertThat(response.correct()).isFalse();
        assertThat(response.progress()).isEqualTo(1);
    }

    @Test
    @DisplayName("submitAnswer: when session unknown then throws SessionNotFoundException")
    void submitAnswer_unknown_thenNotFound() {
        assertThatThrownBy(() -> answer("missing", "q", "a", "b"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    @DisplayName("submitAnswer: when the oracle repeats an asked question then it is re-requested")
    void submitAnswer_duplicateQuestion_thenReRequested() {
        when(contentOracle.planConcepts(Topic.ALGEBRA)).thenReturn(catalog.conceptsFor(Topic.ALGEBRA));
        GeneratedQuestion first = new GeneratedQuestion("Q1", "A1", "e", "Basic Operations", 1);
        GeneratedQuestion fresh = new GeneratedQuestion("Q2", "A2", "e", "Solving Linear Equations", 2);
        when(contentOracle.generateQuestion(any())).thenReturn(first, first, fresh);
        stubExactMatchJudge();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");

        AnswerResponse response = answer(start.sessionId(), "Q1", "A1", "A1");

        assertThat(response.question()).isEqualTo("Q2");
        verify(contentOracle, times(3)).generateQuestion(any());
    }

    @Test
    @DisplayName("heartbeat: extends last activity without changing score, level, history or status")
    void heartbeat_onlyExtendsActivity() {
        stubPlanAndQuestions();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");
        SessionSnapshot before = store.find(start.sessionId()).orElseThrow();
        clock.advance(Duration.ofSeconds(30));

        HeartbeatResponse response = service.heartbeat(start.sessionId());

        SessionSnapshot after = store.find(start.sessionId()).orElseThrow();
        assertThat(response.status()).isEqualTo("active");
        assertThat(after.lastActivityAt()).isEqualTo(START.plusSeconds(30));
        assertThat(after.score()).isEqualTo(before.score());
        assertThat(after.difficultyLevel()).isEqualTo(before.difficultyLevel());
        assertThat(after.history()).isEqualTo(before.history());
        assertThat(after.status()).isEqualTo(before.status());
    }

    @Test
    @DisplayName("heartbeat: when session unknown or ended then rejected")
    void heartbeat_unknownOrEnded_thenRejected() {
        stubPlanAndQuestions();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");
        store.expire(start.sessionId());

        assertThatThrownBy(() -> service.heartbeat("missing")).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> service.heartbeat(start.sessionId())).isInstanceOf(SessionTerminalException.class);
    }

    @Test
    @DisplayName("getStatus: returns progress without counting as activity")
    void getStatus_returnsSnapshotWithoutTouching() {
        stubPlanAndQuestions();
        stubExactMatchJudge();
        StartQuizResponse start = service.startQuiz("Ann", "Algebra");
        answer(start.sessionId(), start.question(), start.correctAnswer(), "A1");
        Instant lastActivity = store.find(start.sessionId()).orElseThrow().lastActivityAt();
        clock.advance(Duration.ofMinutes(5));

        SessionStatusResponse status = service.getStatus(start.sessionId());

        assertThat(status.progress()).isEqualTo(1);
        assertThat(status.score()).isEqualTo(1);
        assertThat(status.level()).isEqualTo(2);
        assertThat(status.totalQuestions()).isEqualTo(10);
        assertThat(status.percentageScore()).isEqualTo(100.0);
        assertThat(status.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(store.find(start.sessionId()).orElseThrow().lastActivityAt()).isEqualTo(lastActivity);
        assertThatThrownBy(() -> service.getStatus("missing")).isInstanceOf(SessionNotFoundException.class);
    }
}
