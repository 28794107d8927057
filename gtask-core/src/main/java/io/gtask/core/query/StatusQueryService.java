package io.gtask.core.query;

import io.gtask.core.error.ExecutionNotFoundException;
import io.gtask.core.execution.ExecutionRecord;
import io.gtask.core.recorder.ExecutionStore;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Read-only views over the execution history.
 */
public final class StatusQueryService {
    private static final int MAX_RECENT = 500;

    private final ExecutionStore store;

    public StatusQueryService(ExecutionStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * One row per distinct command, the most recently run command first.
     */
    public List<CommandSummary> summarize() throws IOException {
        return store.summarize();
    }

    /**
     * @throws ExecutionNotFoundException if no execution carries {@code uid}
     */
    public ExecutionRecord fetch(String uid) throws IOException {
        if (uid == null || uid.isBlank()) {
            throw new ExecutionNotFoundException(uid == null ? "" : uid);
        }
        return store.findByUid(uid.trim()).orElseThrow(() -> new ExecutionNotFoundException(uid.trim()));
    }

    public List<ExecutionRecord> recent(int limit) throws IOException {
        int bounded = Math.max(1, Math.min(MAX_RECENT, limit));
        return store.recent(bounded);
    }
}
