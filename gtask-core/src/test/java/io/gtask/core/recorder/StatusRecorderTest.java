package io.gtask.core.recorder;

import static org.assertj.core.api.Assertions.assertThat;

import io.gtask.core.execution.ExecutionRecord;
import io.gtask.core.execution.ExecutionStatus;
import io.gtask.core.query.CommandSummary;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatusRecorderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteDatabaseRowAndLogLines() throws Exception {
        Path logFile = tempDir.resolve("logs").resolve("scheduler.log");
        Path runsDir = tempDir.resolve("logs").resolve("runs");
        try (RecorderContext context = RecorderContext.open(tempDir.resolve("jobs.db"), logFile, runsDir, ZoneOffset.UTC)) {
            StatusRecorder recorder = new StatusRecorder(context);

            ExecutionRecord ok = recorder.record(record("uid-ok", "echo ok", ExecutionStatus.SUCCESS, "ok\n"));
            recorder.record(record("uid-fail", "exit 1", ExecutionStatus.FAILURE, "bad things"));

            assertThat(ok.sequenceId()).isPositive();
            assertThat(context.executionStore().findByUid("uid-fail")).isPresent();
        }

        List<String> lines = Files.readAllLines(logFile);
        assertThat(lines).containsExactly(
            "[10-03-2024 02:30:00] Status: Success, Job UID: uid-ok, Command: echo ok",
            "[10-03-2024 02:30:00] Status: Failure, Job UID: uid-fail, Command: exit 1",
            "[10-03-2024 02:30:00] Error Occurred Status: Failure, Job UID: uid-fail",
            "Command: exit 1, Output: bad things"
        );
        assertThat(Files.readString(runsDir.resolve("uid-ok.log")))
            .isEqualTo("[10-03-2024 02:30:00] Status: Success, Job UID: uid-ok, Command: echo ok\n");
    }

    @Test
    void shouldNeverInterleaveConcurrentRecords() throws Exception {
        Path logFile = tempDir.resolve("scheduler.log");
        int writers = 16;
        try (RecorderContext context = RecorderContext.open(tempDir.resolve("jobs.db"), logFile, null, ZoneOffset.UTC)) {
            StatusRecorder recorder = new StatusRecorder(context);
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<ExecutionRecord>> futures = new ArrayList<>();
                for (int i = 0; i < writers; i++) {
                    String uid = "uid-" + i;
                    futures.add(pool.submit(() -> {
                        start.await();
                        return recorder.record(record(uid, "exit 1", ExecutionStatus.FAILURE, "line one\nline two"));
                    }));
                }
                start.countDown();
                for (Future<ExecutionRecord> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
            assertThat(context.executionStore().recent(100)).hasSize(writers);
        }

        List<String> lines = Files.readAllLines(logFile);
        assertThat(lines).hasSize(writers * 4);
        for (int block = 0; block < writers; block++) {
            int offset = block * 4;
            String uid = lines.get(offset).replaceAll(".*Job UID: (uid-\\d+),.*", "$1");
            assertThat(lines.get(offset)).startsWith("[10-03-2024 02:30:00] Status: Failure");
            assertThat(lines.get(offset + 1)).contains("Error Occurred").endsWith("Job UID: " + uid);
            assertThat(lines.get(offset + 2)).isEqualTo("Command: exit 1, Output: line one");
            assertThat(lines.get(offset + 3)).isEqualTo("line two");
        }
    }

    @Test
    void shouldStillWriteLogWhenDatabaseWriteFails() throws Exception {
        Path logFile = tempDir.resolve("scheduler.log");
        Path runsDir = tempDir.resolve("runs");
        ExecutionRecord input = record("uid-1", "echo ok", ExecutionStatus.SUCCESS, "ok\n");
        try (RecorderContext database = RecorderContext.open(tempDir.resolve("jobs.db"), tempDir.resolve("unused.log"), null, ZoneOffset.UTC);
             RecorderContext context = new RecorderContext(
                 database.jobStore(),
                 new UnavailableExecutionStore(),
                 new ExecutionLog(logFile, runsDir, ZoneOffset.UTC)
             )) {
            ExecutionRecord stored = new StatusRecorder(context).record(input);

            assertThat(stored).isEqualTo(input);
        }

        assertThat(Files.readAllLines(logFile))
            .containsExactly("[10-03-2024 02:30:00] Status: Success, Job UID: uid-1, Command: echo ok");
        assertThat(runsDir.resolve("uid-1.log")).exists();
    }

    @Test
    void shouldStillWriteDatabaseRowWhenLogIsUnavailable() throws Exception {
        try (RecorderContext context = RecorderContext.open(tempDir.resolve("jobs.db"), tempDir.resolve("scheduler.log"), null, ZoneOffset.UTC)) {
            context.executionLog().close();
            StatusRecorder recorder = new StatusRecorder(context);

            ExecutionRecord stored = recorder.record(record("uid-1", "exit 1", ExecutionStatus.FAILURE, "boom"));
            recorder.note("still running");

            assertThat(stored.sequenceId()).isPositive();
            assertThat(context.executionStore().findByUid("uid-1"))
                .hasValueSatisfying(found -> assertThat(found.output()).isEqualTo("boom"));
        }
    }

    @Test
    void shouldAppendNotes() throws Exception {
        Path logFile = tempDir.resolve("scheduler.log");
        try (RecorderContext context = RecorderContext.open(tempDir.resolve("jobs.db"), logFile, null, ZoneOffset.UTC)) {
            new StatusRecorder(context).note("[10-03-2024 02:30:00] Scheduler has started");
        }

        assertThat(Files.readAllLines(logFile)).containsExactly("[10-03-2024 02:30:00] Scheduler has started");
    }

    private static ExecutionRecord record(String uid, String command, ExecutionStatus status, String output) {
        return new ExecutionRecord(
            uid, 0, command, Instant.parse("2024-03-10T02:30:00Z"), status, output,
            status == ExecutionStatus.SUCCESS ? 0 : 1, 5
        );
    }

    private static final class UnavailableExecutionStore implements ExecutionStore {
        @Override
        public ExecutionRecord append(ExecutionRecord record) throws IOException {
            throw new IOException("database is locked");
        }

        @Override
        public Optional<ExecutionRecord> findByUid(String uid) {
            return Optional.empty();
        }

        @Override
        public List<CommandSummary> summarize() {
            return List.of();
        }

        @Override
        public List<ExecutionRecord> recent(int limit) {
            return List.of();
        }
    }
}
