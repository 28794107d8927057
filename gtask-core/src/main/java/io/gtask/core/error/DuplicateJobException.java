package io.gtask.core.error;

/**
 * Thrown when a job name is already taken.
 */
public class DuplicateJobException extends JobConfigurationException {

    private static final String ERROR_CODE = "DUPLICATE_JOB";

    public DuplicateJobException(String name) {
        super(ERROR_CODE, "Job name already exists: " + name);
    }
}
