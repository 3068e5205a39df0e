package front.migrator.app.service;

/**
 * A Gmail call failed for a reason other than authentication, once retries (if applicable) ran out.
 */
public class GmailApiException extends RuntimeException {
    private final int statusCode;
    private final String reason;

    public GmailApiException(String message, int statusCode, String reason, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.reason = reason;
    }

    /**
     * @return the HTTP status, or 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the first error reason reported by Gmail (e.g. rateLimitExceeded), or null
     */
    public String getReason() {
        return reason;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }
}
