package uk.gegc.adaptivequiz.features.session.domain.model;

import uk.gegc.adaptivequiz.features.oracle.domain.model.MathConcept;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.Collections;

/**
 * Immutable copy of a {@link QuizSession}, taken under the session lock.
 */
public record SessionSnapshot(
        String sessionId,
        String username,
        Topic topic,
        SessionStatus status,
        int difficultyLevel,
        int answeredCount,
        int score,
        String currentQuestion,
        String currentCorrectAnswer,
        String currentSkill,
        List<AnswerRecord> history,
        List<MathConcept> conceptPlan,
        Set<String> askedQuestions,
        Instant createdAt,
        Instant lastActivityAt,
        Instant endedAt
) {

    public static SessionSnapshot of(QuizSession session) {
        return new SessionSnapshot(
                session.getSessionId(),
                session.getUsername(),
                session.getTopic(),
                session.getStatus(),
                session.getDifficultyLevel(),
                session.getAnsweredCount(),
                session.getScore(),
                session.getCurrentQuestion(),
                session.getCurrentCorrectAnswer(),
                session.getCurrentSkill(),
                List.copyOf(session.getHistory()),
                List.copyOf(session.getConceptPlan()),
                Collections.unmodifiableSet(new LinkedHashSet<>(session.getAskedQuestions())),
                session.getCreatedAt(),
                session.getLastActivityAt(),
                session.getEndedAt()
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public long correctCount() {
        return history.stream().filter(AnswerRecord::correct).count();
    }

    /**
     * Share of answered questions judged correct, 0 when nothing was answered.
     */
    public double percentageScore() {
        if (answeredCount == 0) {
            return 0.0;
        }
        return correctCount() * 100.0 / answeredCount;
    }
}
