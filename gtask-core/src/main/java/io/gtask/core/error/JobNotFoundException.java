package io.gtask.core.error;

/**
 * Thrown when a job id does not refer to any definition.
 */
public class JobNotFoundException extends GtaskException {

    private static final String ERROR_CODE = "JOB_NOT_FOUND";

    public JobNotFoundException(long id) {
        super(ERROR_CODE, "Job not found: " + id);
    }
}
