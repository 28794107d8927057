package io.gtask.core.error;

/**
 * Base exception for scheduler domain errors.
 * Carries a stable error code that the HTTP surface reports back to callers.
 */
public class GtaskException extends RuntimeException {

    private final String errorCode;

    public GtaskException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GtaskException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
