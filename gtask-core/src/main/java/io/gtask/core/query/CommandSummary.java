package io.gtask.core.query;

import java.time.Instant;

/**
 * Aggregated history of one distinct command. The {@code last*} fields describe its most
 * recently recorded run.
 */
public record CommandSummary(
    String command,
    String lastTaskId,
    Instant lastRunAt,
    int successCount,
    int failureCount,
    String lastOutput
) {
    public int totalRuns() {
        return successCount + failureCount;
    }
}
