package uk.gegc.adaptivequiz.shared.exception;

/**
 * Exception thrown when the content oracle (question generation, judging or
 * insights) times out or fails after its retry budget is spent.
 */
public class OracleUnavailableException extends RuntimeException {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
