package io.gtask.core.recorder;

import io.gtask.core.execution.ExecutionRecord;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists execution records to the database (authoritative) and then to the execution log
 * (mirror), both under the context's write lock. A failing sink is logged and does not undo
 * the other one.
 */
public final class StatusRecorder {
    private static final Logger LOG = LoggerFactory.getLogger(StatusRecorder.class);

    private final RecorderContext context;

    public StatusRecorder(RecorderContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * @return the record as stored, carrying its sequence id, or the input record unchanged if the
     *     database write failed
     */
    public ExecutionRecord record(ExecutionRecord record) {
        Lock lock = context.writeLock();
        lock.lock();
        try {
            ExecutionRecord stored = record;
            try {
                stored = context.executionStore().append(record);
            } catch (IOException e) {
                LOG.error("Failed to store execution {} of '{}' in the database", record.uid(), record.command(), e);
            }
            try {
                context.executionLog().appendRecord(stored);
            } catch (IOException e) {
                LOG.error("Failed to write execution {} to {}", record.uid(), context.executionLog().path(), e);
            }
            if (stored.succeeded()) {
                LOG.info("Job {} succeeded: {}", stored.uid(), stored.command());
            } else {
                LOG.warn("Job {} failed with exit code {}: {}", stored.uid(), stored.exitCode(), stored.command());
            }
            return stored;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a free-form scheduler line (startup, job scheduling results) to the execution log.
     */
    public void note(String line) {
        Lock lock = context.writeLock();
        lock.lock();
        try {
            context.executionLog().append(line);
        } catch (IOException e) {
            LOG.error("Failed to write to {}: {}", context.executionLog().path(), line, e);
        } finally {
            lock.unlock();
        }
        LOG.info("{}", line);
    }
}
