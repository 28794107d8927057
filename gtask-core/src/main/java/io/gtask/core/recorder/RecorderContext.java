package io.gtask.core.recorder;

import io.gtask.core.job.JobStore;
import io.gtask.core.job.SqliteJobStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the durable sinks (job store, execution store, execution log) and the single lock that
 * serializes every write to them. Opened once at startup and closed on shutdown.
 */
public final class RecorderContext implements AutoCloseable {
    private final JobStore jobStore;
    private final ExecutionStore executionStore;
    private final ExecutionLog executionLog;
    private final ReentrantLock writeLock = new ReentrantLock();

    public RecorderContext(JobStore jobStore, ExecutionStore executionStore, ExecutionLog executionLog) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executionStore = Objects.requireNonNull(executionStore, "executionStore must not be null");
        this.executionLog = Objects.requireNonNull(executionLog, "executionLog must not be null");
    }

    public static RecorderContext open(Path databaseFile, Path logFile, Path runsDir, ZoneId zone) throws IOException {
        SqliteDatabase database = new SqliteDatabase(databaseFile);
        return new RecorderContext(
            new SqliteJobStore(database),
            new SqliteExecutionStore(database),
            new ExecutionLog(logFile, runsDir, zone)
        );
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public ExecutionStore executionStore() {
        return executionStore;
    }

    public ExecutionLog executionLog() {
        return executionLog;
    }

    public Lock writeLock() {
        return writeLock;
    }

    /**
     * Runs {@code write} while holding the write lock.
     */
    public <T> T exclusive(LockedWrite<T> write) throws IOException {
        writeLock.lock();
        try {
            return write.run();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() throws IOException {
        writeLock.lock();
        try {
            executionLog.close();
        } finally {
            writeLock.unlock();
        }
    }

    @FunctionalInterface
    public interface LockedWrite<T> {
        T run() throws IOException;
    }
}
