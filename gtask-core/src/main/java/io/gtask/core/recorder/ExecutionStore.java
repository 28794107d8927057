package io.gtask.core.recorder;

import io.gtask.core.execution.ExecutionRecord;
import io.gtask.core.query.CommandSummary;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only execution history.
 */
public interface ExecutionStore {

    /**
     * Appends one record and returns it with the store-assigned sequence id.
     */
    ExecutionRecord append(ExecutionRecord record) throws IOException;

    Optional<ExecutionRecord> findByUid(String uid) throws IOException;

    /**
     * One entry per distinct command, most recently run first.
     */
    List<CommandSummary> summarize() throws IOException;

    List<ExecutionRecord> recent(int limit) throws IOException;
}
