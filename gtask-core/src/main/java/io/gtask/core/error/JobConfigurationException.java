package io.gtask.core.error;

/**
 * Thrown when a job definition is rejected at registration time.
 */
public class JobConfigurationException extends GtaskException {

    private static final String ERROR_CODE = "INVALID_JOB";

    public JobConfigurationException(String message) {
        super(ERROR_CODE, message);
    }

    public JobConfigurationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    protected JobConfigurationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
