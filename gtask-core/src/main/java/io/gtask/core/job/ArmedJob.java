package io.gtask.core.job;

import io.gtask.core.schedule.CronExpression;
import java.time.Duration;

/**
 * Immutable dispatch-table entry consulted by the trigger clock on every tick.
 *
 * @param timeout per-job deadline, {@link Duration#ZERO} when the job has none of its own
 */
public record ArmedJob(
    long id,
    String name,
    CronExpression schedule,
    String command,
    Duration timeout
) {
    static ArmedJob of(JobDefinition definition, CronExpression schedule) {
        return new ArmedJob(
            definition.id(),
            definition.name(),
            schedule,
            definition.command(),
            Duration.ofSeconds(definition.timeoutSeconds())
        );
    }
}
