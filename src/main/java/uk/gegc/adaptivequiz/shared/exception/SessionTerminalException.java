package uk.gegc.adaptivequiz.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionStatus;

/**
 * Exception thrown when a mutating action targets a session that is already
 * completed or expired.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class SessionTerminalException extends RuntimeException {

    private final String sessionId;
    private final SessionStatus status;

    public SessionTerminalException(String sessionId, SessionStatus status) {
        super(status == SessionStatus.EXPIRED
                ? "Session " + sessionId + " has expired. Please restart the quiz."
                : "Session " + sessionId + " is already completed.");
        this.sessionId = sessionId;
        this.status = status;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
