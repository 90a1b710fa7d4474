package uk.gegc.adaptivequiz.features.session.domain.model;

import lombok.Getter;
import lombok.Setter;
import uk.gegc.adaptivequiz.features.oracle.domain.model.MathConcept;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one quiz run. Instances live inside the session store and
 * are only modified while holding that session's lock.
 */
@Getter
@Setter
public class QuizSession {

    public static final int TOTAL_QUESTIONS = 10;
    public static final int STARTING_LEVEL = 1;

    private String sessionId;
    private String username;
    private Topic topic;

    private SessionStatus status = SessionStatus.ACTIVE;
    private int difficultyLevel = STARTING_LEVEL;
    private int answeredCount;
    private int score;

    private String currentQuestion;
    private String currentCorrectAnswer;
    private String currentSkill;

    private List<AnswerRecord> history = new ArrayList<>();
    private List<MathConcept> conceptPlan = new ArrayList<>();
    private Set<String> askedQuestions = new LinkedHashSet<>();

    /**
     * Set while an answer is being judged outside the session lock; a second
     * answer for the same session is rejected until it clears.
     */
    private boolean answerInFlight;

    private Instant createdAt;
    private Instant lastActivityAt;
    private Instant endedAt;

    public boolean isComplete() {
        return answeredCount >= TOTAL_QUESTIONS;
    }

    public void clearCurrentQuestion() {
        this.currentQuestion = null;
        this.currentCorrectAnswer = null;
        this.currentSkill = null;
    }
}
