package io.gtask.core.error;

/**
 * Thrown when no execution record carries the requested uid.
 */
public class ExecutionNotFoundException extends GtaskException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public ExecutionNotFoundException(String uid) {
        super(ERROR_CODE, "No execution found for task uid: " + uid);
    }
}
