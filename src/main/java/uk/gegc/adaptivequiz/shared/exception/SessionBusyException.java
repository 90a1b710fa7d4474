package uk.gegc.adaptivequiz.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class SessionBusyException extends RuntimeException {

    public SessionBusyException(String sessionId) {
        super("Session " + sessionId + " is busy processing another request. Please retry.");
    }
}
