package io.gtask.cli;

import io.gtask.core.job.JobRegistry;
import io.gtask.core.query.StatusQueryService;
import java.time.ZoneId;

public record CliContext(
    JobRegistry registry,
    StatusQueryService queries,
    ZoneId zone,
    ServeRunner serveRunner
) {
    public CliContext(JobRegistry registry, StatusQueryService queries, ZoneId zone) {
        this(registry, queries, zone, (cronFile, importCronFile) -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}
