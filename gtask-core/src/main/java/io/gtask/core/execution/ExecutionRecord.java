package io.gtask.core.execution;

import java.time.Instant;

/**
 * The outcome of one job firing. Immutable; the store assigns {@code sequenceId} on insert
 * ({@code 0} until then).
 *
 * @param uid globally unique handle used for log retrieval
 * @param timestamp completion time
 * @param output combined stdout and stderr
 * @param exitCode process exit status, {@code -1} when the process could not be started or was
 *     killed at its deadline
 */
public record ExecutionRecord(
    String uid,
    long sequenceId,
    String command,
    Instant timestamp,
    ExecutionStatus status,
    String output,
    int exitCode,
    long durationMs
) {
    public ExecutionRecord {
        if (uid == null || uid.isBlank()) {
            throw new IllegalArgumentException("uid is required");
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        command = command == null ? "" : command;
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        output = output == null ? "" : output;
        durationMs = Math.max(0, durationMs);
    }

    public boolean succeeded() {
        return status == ExecutionStatus.SUCCESS;
    }

    public ExecutionRecord withSequenceId(long value) {
        return new ExecutionRecord(uid, value, command, timestamp, status, output, exitCode, durationMs);
    }
}
