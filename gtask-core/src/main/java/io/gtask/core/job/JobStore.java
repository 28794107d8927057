package io.gtask.core.job;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

public interface JobStore {
    List<JobDefinition> loadAll() throws IOException;

    JobDefinition insert(NewJob job, Instant createdAt) throws IOException;

    void updateActive(long id, boolean active, Instant updatedAt) throws IOException;
}
