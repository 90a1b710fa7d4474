package uk.gegc.adaptivequiz.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://adaptivequiz.gegc.uk/docs/errors";

    // ==================== Request Errors ====================
    public static final URI INVALID_REQUEST = URI.create(BASE_URL + "/invalid-request");
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Session Errors ====================
    public static final URI SESSION_NOT_FOUND = URI.create(BASE_URL + "/session-not-found");
    public static final URI SESSION_TERMINAL = URI.create(BASE_URL + "/session-terminal");
    public static final URI SESSION_NOT_COMPLETED = URI.create(BASE_URL + "/session-not-completed");
    public static final URI SESSION_BUSY = URI.create(BASE_URL + "/session-busy");

    // ==================== Rate Limiting ====================
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");

    // ==================== Oracle / Report Errors ====================
    public static final URI ORACLE_UNAVAILABLE = URI.create(BASE_URL + "/oracle-unavailable");
    public static final URI REPORT_GENERATION_FAILED = URI.create(BASE_URL + "/report-generation-failed");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
