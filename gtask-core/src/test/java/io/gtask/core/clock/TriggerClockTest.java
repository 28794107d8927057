package io.gtask.core.clock;

import static org.assertj.core.api.Assertions.assertThat;

import io.gtask.core.execution.CommandExecutor;
import io.gtask.core.execution.ExecutionRecord;
import io.gtask.core.execution.ExecutionStatus;
import io.gtask.core.execution.ShellCommandExecutor;
import io.gtask.core.job.JobDefinition;
import io.gtask.core.job.JobRegistry;
import io.gtask.core.job.NewJob;
import io.gtask.core.query.CommandSummary;
import io.gtask.core.query.StatusQueryService;
import io.gtask.core.recorder.RecorderContext;
import io.gtask.core.recorder.StatusRecorder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TriggerClockTest {
    private static final ZonedDateTime MINUTE = ZonedDateTime.of(2024, 3, 10, 2, 30, 0, 0, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(MINUTE.toInstant(), ZoneOffset.UTC);
    private RecorderContext context;
    private JobRegistry registry;
    private StatusRecorder recorder;
    private StatusQueryService queries;
    private ShellCommandExecutor shell;

    @BeforeEach
    void setUp() throws Exception {
        context = RecorderContext.open(
            tempDir.resolve("jobs.db"),
            tempDir.resolve("scheduler.log"),
            tempDir.resolve("runs"),
            ZoneOffset.UTC
        );
        registry = new JobRegistry(context, clock);
        registry.reload();
        recorder = new StatusRecorder(context);
        queries = new StatusQueryService(context.executionStore());
        shell = new ShellCommandExecutor("bash", clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        shell.close();
        context.close();
    }

    @Test
    void shouldRunMatchingJobAndRecordSuccess() throws Exception {
        registry.register(new NewJob("ping", "* * * * *", "echo ok"));

        try (TriggerClock trigger = newClock(shell, OverlapPolicy.ALLOW)) {
            List<ExecutionRecord> records = await(trigger.tick(MINUTE));

            assertThat(records).hasSize(1);
            List<CommandSummary> summaries = queries.summarize();
            assertThat(summaries).hasSize(1);
            assertThat(summaries.get(0).command()).isEqualTo("echo ok");
            assertThat(summaries.get(0).successCount()).isEqualTo(1);
            assertThat(summaries.get(0).failureCount()).isZero();
            assertThat(queries.fetch(records.get(0).uid()).output()).contains("ok");
        }
    }

    @Test
    void shouldRecordFailureForNonZeroExit() throws Exception {
        registry.register(new NewJob("broken", "* * * * *", "exit 1"));

        try (TriggerClock trigger = newClock(shell, OverlapPolicy.ALLOW)) {
            ExecutionRecord record = await(trigger.tick(MINUTE)).get(0);

            assertThat(record.status()).isEqualTo(ExecutionStatus.FAILURE);
            assertThat(queries.fetch(record.uid()).status()).isEqualTo(ExecutionStatus.FAILURE);
        }
    }

    @Test
    void shouldFireEveryJobSharingASchedule() throws Exception {
        registry.register(new NewJob("first", "30 2 * * *", "echo first"));
        registry.register(new NewJob("second", "30 2 * * *", "echo second"));
        registry.register(new NewJob("later", "31 2 * * *", "echo later"));

        try (TriggerClock trigger = newClock(shell, OverlapPolicy.ALLOW)) {
            List<ExecutionRecord> records = await(trigger.tick(MINUTE));

            assertThat(records).extracting(ExecutionRecord::command).containsExactlyInAnyOrder("echo first", "echo second");
            assertThat(records.get(0).uid()).isNotEqualTo(records.get(1).uid());
        }

        List<String> lines = Files.readAllLines(tempDir.resolve("scheduler.log"));
        assertThat(lines).hasSize(2);
        assertThat(lines).allMatch(line -> line.startsWith("[10-03-2024 02:30:00] Status: Success, Job UID: "));
    }

    @Test
    void shouldEvaluateEachMinuteOnce() throws Exception {
        registry.register(new NewJob("ping", "* * * * *", "echo ok"));

        try (TriggerClock trigger = newClock(shell, OverlapPolicy.ALLOW)) {
            assertThat(await(trigger.tick(MINUTE.plusSeconds(1)))).hasSize(1);
            assertThat(trigger.tick(MINUTE.plusSeconds(59))).isEmpty();
            assertThat(trigger.tick(MINUTE.minusMinutes(1))).isEmpty();
            assertThat(await(trigger.tick(MINUTE.plusMinutes(1)))).hasSize(1);
        }
    }

    @Test
    void shouldNotFireDisabledJob() throws Exception {
        JobDefinition job = registry.register(new NewJob("ping", "* * * * *", "echo ok"));
        registry.disable(job.id());

        try (TriggerClock trigger = newClock(shell, OverlapPolicy.ALLOW)) {
            assertThat(trigger.tick(MINUTE)).isEmpty();
        }
        assertThat(queries.summarize()).isEmpty();
    }

    @Test
    void shouldKeepHistoryOfJobAfterDisablingIt() throws Exception {
        JobDefinition job = registry.register(new NewJob("ping", "* * * * *", "echo ok"));

        try (TriggerClock trigger = newClock(shell, OverlapPolicy.ALLOW)) {
            ExecutionRecord ran = await(trigger.tick(MINUTE)).get(0);
            ExecutionRecord before = queries.fetch(ran.uid());
            List<CommandSummary> summaryBefore = queries.summarize();

            registry.disable(job.id());

            assertThat(queries.fetch(ran.uid())).isEqualTo(before);
            assertThat(queries.summarize()).isEqualTo(summaryBefore);
            assertThat(trigger.tick(MINUTE.plusMinutes(1))).isEmpty();
        }
        assertThat(queries.recent(10)).hasSize(1);
    }

    @Test
    void shouldSkipJobStillRunningWhenConfigured() throws Exception {
        registry.register(new NewJob("slow", "* * * * *", "sleep 120"));
        BlockingExecutor blocking = new BlockingExecutor();

        try (TriggerClock trigger = newClock(blocking, OverlapPolicy.SKIP_IF_RUNNING)) {
            List<CompletableFuture<ExecutionRecord>> first = trigger.tick(MINUTE);
            assertThat(blocking.started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(trigger.tick(MINUTE.plusMinutes(1))).isEmpty();

            blocking.release.countDown();
            assertThat(await(first)).hasSize(1);
            assertThat(await(trigger.tick(MINUTE.plusMinutes(2)))).hasSize(1);
        }
    }

    @Test
    void shouldAllowOverlappingRunsByDefault() throws Exception {
        registry.register(new NewJob("slow", "* * * * *", "sleep 120"));
        BlockingExecutor blocking = new BlockingExecutor();

        try (TriggerClock trigger = newClock(blocking, OverlapPolicy.ALLOW)) {
            List<CompletableFuture<ExecutionRecord>> first = trigger.tick(MINUTE);
            List<CompletableFuture<ExecutionRecord>> second = trigger.tick(MINUTE.plusMinutes(1));

            assertThat(second).hasSize(1);
            assertThat(trigger.inFlight()).isEqualTo(2);
            blocking.release.countDown();
            await(first);
            await(second);
        }
    }

    @Test
    void shouldFallBackToDefaultTimeout() throws Exception {
        registry.register(new NewJob("default", "* * * * *", "true"));
        registry.register(new NewJob("own", "* * * * *", "true", "", 5));
        List<Duration> timeouts = new CopyOnWriteArrayList<>();
        CommandExecutor capturing = (command, timeout) -> {
            timeouts.add(timeout);
            return success(command);
        };

        try (TriggerClock trigger = new TriggerClock(registry, capturing, recorder, clock, OverlapPolicy.ALLOW, Duration.ofSeconds(30))) {
            await(trigger.tick(MINUTE));
        }

        assertThat(timeouts).containsExactlyInAnyOrder(Duration.ofSeconds(30), Duration.ofSeconds(5));
    }

    @Test
    void shouldAnnounceStartAndStopTicking() throws Exception {
        registry.register(new NewJob("ping", "* * * * *", "echo ok"));

        try (TriggerClock trigger = newClock(shell, OverlapPolicy.ALLOW)) {
            trigger.start();
            trigger.stop();

            assertThat(trigger.state()).isEqualTo(ClockState.STOPPED);
            assertThat(trigger.tick(MINUTE)).isEmpty();
        }

        assertThat(Files.readAllLines(tempDir.resolve("scheduler.log")))
            .containsExactly("[10-03-2024 02:30:00] Scheduler has started");
    }

    private TriggerClock newClock(CommandExecutor executor, OverlapPolicy policy) {
        return new TriggerClock(registry, executor, recorder, clock, policy, Duration.ZERO);
    }

    private static List<ExecutionRecord> await(List<CompletableFuture<ExecutionRecord>> futures) throws Exception {
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(30, TimeUnit.SECONDS);
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private static ExecutionRecord success(String command) {
        return new ExecutionRecord(UUID.randomUUID().toString(), 0, command, Instant.parse("2024-03-10T02:30:00Z"),
            ExecutionStatus.SUCCESS, "", 0, 0);
    }

    private static final class BlockingExecutor implements CommandExecutor {
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public ExecutionRecord run(String command, Duration timeout) {
            started.countDown();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return success(command);
        }
    }
}
