package io.gtask.core.job;

import java.time.Instant;

/**
 * A named, schedulable shell command. Definitions are never deleted; {@code active=false}
 * keeps a job out of scheduling while retaining it for audit.
 */
public record JobDefinition(
    long id,
    String name,
    String schedule,
    String command,
    String description,
    boolean active,
    long timeoutSeconds,
    Instant createdAt,
    Instant updatedAt
) {
    public JobDefinition {
        name = name == null ? "" : name.trim();
        schedule = schedule == null ? "" : schedule.trim();
        command = command == null ? "" : command;
        description = description == null ? "" : description.trim();
        timeoutSeconds = Math.max(0, timeoutSeconds);
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public JobDefinition withActive(boolean value, Instant at) {
        return new JobDefinition(id, name, schedule, command, description, value, timeoutSeconds, createdAt, at);
    }
}
