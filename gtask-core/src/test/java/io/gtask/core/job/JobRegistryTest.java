package io.gtask.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gtask.core.error.DuplicateJobException;
import io.gtask.core.error.JobConfigurationException;
import io.gtask.core.error.JobNotFoundException;
import io.gtask.core.recorder.RecorderContext;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobRegistryTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-10T02:30:00Z"), ZoneOffset.UTC);
    private RecorderContext context;
    private JobRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        context = openContext();
        registry = new JobRegistry(context, clock);
        registry.reload();
    }

    @AfterEach
    void tearDown() throws Exception {
        context.close();
    }

    @Test
    void shouldRegisterAndArmJob() throws Exception {
        JobDefinition job = registry.register(new NewJob("ping", "* * * * *", "echo ok"));

        assertThat(job.id()).isPositive();
        assertThat(job.active()).isTrue();
        assertThat(job.createdAt()).isEqualTo(clock.instant());
        assertThat(registry.snapshot()).containsKey(job.id());
        assertThat(registry.snapshot().get(job.id()).command()).isEqualTo("echo ok");
        assertThat(registry.findByName("ping")).contains(job);
    }

    @Test
    void shouldRejectDuplicateNameWithoutChangingJobCount() throws Exception {
        registry.register(new NewJob("ping", "* * * * *", "echo ok"));

        assertThatThrownBy(() -> registry.register(new NewJob("ping", "0 * * * *", "echo other")))
            .isInstanceOf(DuplicateJobException.class)
            .hasMessageContaining("ping");
        assertThat(registry.list()).hasSize(1);
        assertThat(context.jobStore().loadAll()).hasSize(1);
    }

    @Test
    void shouldRejectInvalidDefinitionsWithoutArmingThem() {
        assertThatThrownBy(() -> registry.register(new NewJob("bad", "61 * * * *", "echo")))
            .isInstanceOf(JobConfigurationException.class)
            .hasMessageContaining("Invalid cron expression");
        assertThatThrownBy(() -> registry.register(new NewJob(" ", "* * * * *", "echo")))
            .isInstanceOf(JobConfigurationException.class)
            .hasMessageContaining("name");
        assertThatThrownBy(() -> registry.register(new NewJob("empty", "* * * * *", "  ")))
            .isInstanceOf(JobConfigurationException.class)
            .hasMessageContaining("command");
        assertThatThrownBy(() -> registry.register(new NewJob("slow", "* * * * *", "sleep 1", "", -5)))
            .isInstanceOf(JobConfigurationException.class)
            .hasMessageContaining("timeoutSeconds");
        assertThatThrownBy(() -> registry.register(new NewJob("huge", "* * * * *", "echo ok", "", Long.MAX_VALUE)))
            .isInstanceOf(JobConfigurationException.class)
            .hasMessageContaining("timeoutSeconds");
        assertThatThrownBy(() -> registry.register(new NewJob("steps", "5/2147483647 * * * *", "echo")))
            .isInstanceOf(JobConfigurationException.class)
            .hasMessageContaining("Invalid cron expression");

        assertThat(registry.snapshot()).isEmpty();
        assertThat(registry.list()).isEmpty();
    }

    @Test
    void shouldDisableIdempotentlyAndKeepDefinition() throws Exception {
        JobDefinition job = registry.register(new NewJob("ping", "* * * * *", "echo ok"));

        JobDefinition disabled = registry.disable(job.id());
        JobDefinition again = registry.disable(job.id());

        assertThat(disabled.active()).isFalse();
        assertThat(again).isEqualTo(disabled);
        assertThat(registry.snapshot()).doesNotContainKey(job.id());
        assertThat(registry.find(job.id())).hasValueSatisfying(found -> assertThat(found.active()).isFalse());

        registry.enable(job.id());
        assertThat(registry.snapshot()).containsKey(job.id());
    }

    @Test
    void shouldFailToDisableUnknownJob() {
        assertThatThrownBy(() -> registry.disable(42))
            .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void shouldSeeChangesMadeByAnotherRegistryAfterReload() throws Exception {
        JobRegistry other = new JobRegistry(context, clock);
        other.reload();
        JobDefinition job = other.register(new NewJob("ping", "* * * * *", "echo ok"));

        assertThat(registry.snapshot()).isEmpty();
        registry.reload();
        assertThat(registry.snapshot()).containsKey(job.id());

        other.disable(job.id());
        registry.reload();
        assertThat(registry.snapshot()).isEmpty();
        assertThat(registry.list()).hasSize(1);
    }

    @Test
    void shouldRejectNameTakenByAnotherRegistryBeforeReload() throws Exception {
        JobRegistry other = new JobRegistry(context, clock);
        other.register(new NewJob("ping", "* * * * *", "echo ok"));

        assertThatThrownBy(() -> registry.register(new NewJob("ping", "0 * * * *", "echo later")))
            .isInstanceOf(DuplicateJobException.class);
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    void shouldImportJobFileOnce() throws Exception {
        Path file = tempDir.resolve("cron_jobs.txt");
        Files.writeString(file, """
            * * * * * echo ok
            0 3 * * * /usr/local/bin/backup.sh
            99 * * * * echo broken
            """);

        CronTabImport first = registry.importCronTab(file);
        CronTabImport second = registry.importCronTab(file);

        assertThat(first.registered()).hasSize(2);
        assertThat(first.rejected()).hasSize(1);
        assertThat(first.rejected().get(0)).startsWith("line 3");
        assertThat(second.registered()).isEmpty();
        assertThat(second.alreadyRegistered()).isEqualTo(2);
        assertThat(registry.list()).hasSize(2);
        assertThat(registry.list().get(0).description()).isEqualTo("Imported from cron_jobs.txt line 1");
    }

    @Test
    void shouldAcceptLongestAllowedTimeout() throws Exception {
        JobDefinition job = registry.register(
            new NewJob("monthly", "0 0 1 * *", "echo ok", "", JobRegistry.MAX_TIMEOUT_SECONDS)
        );

        assertThat(job.timeoutSeconds()).isEqualTo(JobRegistry.MAX_TIMEOUT_SECONDS);
    }

    @Test
    void shouldKeepImportingAfterMalformedLine() throws Exception {
        Path file = tempDir.resolve("cron_jobs.txt");
        Files.writeString(file, """
            5/2147483647 * * * * echo bad
            * * * * * echo good
            """);

        CronTabImport imported = registry.importCronTab(file);

        assertThat(imported.rejected()).singleElement().asString().startsWith("line 1");
        assertThat(imported.registered()).extracting(JobDefinition::command).containsExactly("echo good");
        assertThat(registry.snapshot().values()).extracting(ArmedJob::command).containsExactly("echo good");
    }

    @Test
    void shouldImportLinesWhoseStringHashesCollide() throws Exception {
        assertThat("* * * * * echo Aa".hashCode()).isEqualTo("* * * * * echo BB".hashCode());
        Path file = tempDir.resolve("cron_jobs.txt");
        Files.writeString(file, "* * * * * echo Aa\n* * * * * echo BB\n");

        CronTabImport imported = registry.importCronTab(file);

        assertThat(imported.registered()).hasSize(2);
        assertThat(imported.alreadyRegistered()).isZero();
        assertThat(registry.snapshot().values()).extracting(ArmedJob::command)
            .containsExactlyInAnyOrder("echo Aa", "echo BB");
    }

    @Test
    void shouldRejectImportedLineWhoseNameBelongsToDifferentJob() throws Exception {
        CronTabEntry entry = new CronTabEntry(1, "* * * * *", "echo ok");
        registry.register(new NewJob(JobRegistry.cronTabName(entry), "0 * * * *", "echo other"));
        Path file = tempDir.resolve("cron_jobs.txt");
        Files.writeString(file, "* * * * * echo ok\n");

        CronTabImport imported = registry.importCronTab(file);

        assertThat(imported.registered()).isEmpty();
        assertThat(imported.alreadyRegistered()).isZero();
        assertThat(imported.rejected()).singleElement().asString().contains("already used");
    }

    @Test
    void shouldKeepImportedJobDisabledOnReimport() throws Exception {
        Path file = tempDir.resolve("cron_jobs.txt");
        Files.writeString(file, "* * * * * echo ok\n");
        JobDefinition imported = registry.importCronTab(file).registered().get(0);
        registry.disable(imported.id());

        registry.importCronTab(file);

        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    void shouldPublishWholeMutationsToConcurrentReaders() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<JobDefinition>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String name = "job-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.register(new NewJob(name, "* * * * *", "echo " + name));
                }));
            }
            start.countDown();
            for (Future<JobDefinition> future : futures) {
                JobDefinition job = future.get(10, TimeUnit.SECONDS);
                assertThat(registry.snapshot().get(job.id())).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.snapshot()).hasSize(writers);
        assertThat(context.jobStore().loadAll()).hasSize(writers);
    }

    private RecorderContext openContext() throws Exception {
        return RecorderContext.open(
            tempDir.resolve("db").resolve("jobs.db"),
            tempDir.resolve("logs").resolve("scheduler.log"),
            tempDir.resolve("logs").resolve("runs"),
            ZoneOffset.UTC
        );
    }
}
