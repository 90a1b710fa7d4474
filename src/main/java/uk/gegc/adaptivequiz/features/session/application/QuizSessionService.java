package uk.gegc.adaptivequiz.features.session.application;

import uk.gegc.adaptivequiz.features.session.api.dto.AnswerRequest;
import uk.gegc.adaptivequiz.features.session.api.dto.AnswerResponse;
import uk.gegc.adaptivequiz.features.session.api.dto.HeartbeatResponse;
import uk.gegc.adaptivequiz.features.session.api.dto.SessionStatusResponse;
import uk.gegc.adaptivequiz.features.session.api.dto.StartQuizResponse;

public interface QuizSessionService {

    /**
     * Plan the topic's concepts, fetch the first question and open a new session at level 1.
     */
    StartQuizResponse startQuiz(String username, String topic);

    /**
     * Judge the answer to the active question, advance score and level and
     * serve the next question. Either every change is applied or none is.
     */
    AnswerResponse submitAnswer(AnswerRequest request);

    /**
     * Record client liveness. Never changes anything but the activity time.
     */
    HeartbeatResponse heartbeat(String sessionId);

    /**
     * Read-only view of the session; does not count as activity.
     */
    SessionStatusResponse getStatus(String sessionId);
}
