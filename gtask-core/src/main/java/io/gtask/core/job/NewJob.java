package io.gtask.core.job;

/**
 * Registration request for a job; the store assigns the id and timestamps.
 *
 * @param timeoutSeconds execution deadline, {@code 0} to use the scheduler default
 */
public record NewJob(
    String name,
    String schedule,
    String command,
    String description,
    long timeoutSeconds
) {
    public NewJob(String name, String schedule, String command) {
        this(name, schedule, command, "", 0);
    }
}
