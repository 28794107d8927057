package io.gtask.core.job;

import java.util.List;

/**
 * Outcome of importing a job file into the registry.
 *
 * @param alreadyRegistered entries skipped because an identical line was imported before
 * @param rejected one message per entry that failed validation
 */
public record CronTabImport(
    List<JobDefinition> registered,
    int alreadyRegistered,
    List<String> rejected
) {
    public CronTabImport {
        registered = List.copyOf(registered);
        rejected = List.copyOf(rejected);
    }
}
