package uk.gegc.adaptivequiz.features.oracle.domain.model;

import uk.gegc.adaptivequiz.features.session.domain.model.Topic;

import java.util.List;

/**
 * Input for generating one question.
 *
 * @param skillHint       concept the question should exercise, or {@code null} to let the oracle choose
 * @param recentQuestions questions already served in this session, most recent last
 */
public record QuestionRequest(
        Topic topic,
        int difficulty,
        String skillHint,
        List<String> recentQuestions
) {
    public QuestionRequest {
        recentQuestions = recentQuestions == null ? List.of() : List.copyOf(recentQuestions);
    }
}
