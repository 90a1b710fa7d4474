package uk.gegc.adaptivequiz.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when a report is requested for a session that is still in progress.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class SessionNotCompletedException extends RuntimeException {

    private final String sessionId;

    public SessionNotCompletedException(String sessionId) {
        super("Session " + sessionId + " is still in progress. Reports are only available once the quiz has ended.");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
