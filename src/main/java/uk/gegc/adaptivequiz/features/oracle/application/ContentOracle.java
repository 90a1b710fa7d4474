package uk.gegc.adaptivequiz.features.oracle.application;

import uk.gegc.adaptivequiz.features.oracle.domain.model.*;
import uk.gegc.adaptivequiz.features.session.domain.model.Topic;

import java.util.List;

/**
 * Source of quiz content: concept plans, questions, answer judgments and
 * end-of-quiz insights. Implementations may be slow or fail; callers go
 * through {@link OracleCallGuard}.
 */
public interface ContentOracle {

    /**
     * Plan the concepts a quiz on the topic rotates through, easiest first.
     */
    List<MathConcept> planConcepts(Topic topic);

    /**
     * Generate one question. When the request carries a skill hint, the
     * returned question's skill equals that hint.
     */
    GeneratedQuestion generateQuestion(QuestionRequest request);

    /**
     * Decide whether the user's answer is mathematically equivalent to the
     * stored correct answer.
     */
    Judgment judge(String question, String correctAnswer, String userAnswer);

    PerformanceInsights generateInsights(InsightsRequest request);
}
