package io.gtask.app;

import io.gtask.cli.CliContext;
import io.gtask.cli.GtaskCliCommand;
import io.gtask.cli.JobsCommand;
import io.gtask.cli.ServeCommand;
import io.gtask.cli.ShowCommand;
import io.gtask.cli.StatusCommand;
import io.gtask.core.api.StatusServer;
import io.gtask.core.clock.TriggerClock;
import io.gtask.core.config.DirectoryBootstrap;
import io.gtask.core.config.GtaskConfig;
import io.gtask.core.execution.ShellCommandExecutor;
import io.gtask.core.job.ArmedJob;
import io.gtask.core.job.CronTabImport;
import io.gtask.core.job.JobRegistry;
import io.gtask.core.query.StatusQueryService;
import io.gtask.core.recorder.RecorderContext;
import io.gtask.core.recorder.StatusRecorder;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class GtaskApplication {
    private static final Logger LOG = LoggerFactory.getLogger(GtaskApplication.class);
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(35);

    private GtaskApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        final GtaskConfig config;
        try {
            config = GtaskConfig.load(Path.of("").toAbsolutePath());
            DirectoryBootstrap.ensureDirectories(config);
        } catch (IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("Failed to create gtask directories", e);
            return 1;
        }

        try (RecorderContext recorderContext = RecorderContext.open(
            config.databaseFile(),
            config.logFile(),
            config.runsDir(),
            config.zone()
        )) {
            Clock clock = Clock.system(config.zone());
            JobRegistry registry = new JobRegistry(recorderContext, clock);
            registry.reload();
            StatusQueryService queries = new StatusQueryService(recorderContext.executionStore());

            CliContext context = new CliContext(
                registry,
                queries,
                config.zone(),
                (cronFileOverride, importCronFile) -> runServe(
                    config,
                    recorderContext,
                    registry,
                    queries,
                    clock,
                    cronFileOverride,
                    importCronFile
                )
            );

            CommandLine commandLine = new CommandLine(new GtaskCliCommand());
            commandLine.addSubcommand("serve", new ServeCommand(context));
            commandLine.addSubcommand("status", new StatusCommand(context));
            commandLine.addSubcommand("show", new ShowCommand(context));
            commandLine.addSubcommand("jobs", new JobsCommand(context));

            return commandLine.execute(args);
        } catch (IOException e) {
            LOG.error("Failed to open job store at {}", config.databaseFile(), e);
            return 1;
        }
    }

    private static int runServe(
        GtaskConfig config,
        RecorderContext recorderContext,
        JobRegistry registry,
        StatusQueryService queries,
        Clock clock,
        Path cronFileOverride,
        boolean importCronFile
    ) throws Exception {
        StatusRecorder recorder = new StatusRecorder(recorderContext);
        CronTabImport imported = null;
        if (importCronFile) {
            Path cronFile = cronFileOverride != null ? cronFileOverride : config.cronFile();
            imported = registry.importCronTab(cronFile);
            LOG.info(
                "Imported {}: {} new, {} already registered, {} rejected",
                cronFile,
                imported.registered().size(),
                imported.alreadyRegistered(),
                imported.rejected().size()
            );
        }
        announceSchedule(registry, imported, recorder);

        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            shutdown.countDown();
            try {
                stopped.await(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "gtask-shutdown"));

        try (ShellCommandExecutor executor = new ShellCommandExecutor(config.shell(), clock);
             TriggerClock trigger = new TriggerClock(
                 registry,
                 executor,
                 recorder,
                 clock,
                 config.overlapPolicy(),
                 config.commandTimeout()
             );
             StatusServer server = new StatusServer(config.host(), config.port(), registry, queries, config.zone())) {
            server.start();
            trigger.start();
            System.out.println("gtask started with " + registry.snapshot().size() + " armed jobs");
            System.out.println("Status endpoint on http://" + config.host() + ":" + server.port()
                + " (GET /status, GET /download?task_uid=<uid>, GET|POST /jobs)");
            shutdown.await();
            LOG.info("Shutting down");
        } finally {
            stopped.countDown();
        }
        return 0;
    }

    /**
     * Notes every armed job, then every rejected line of the import, if there was one.
     */
    static void announceSchedule(JobRegistry registry, CronTabImport imported, StatusRecorder recorder) {
        for (ArmedJob job : registry.snapshot().values()) {
            recorder.note("Scheduled job: " + job.command() + " with cron expression: " + job.schedule().expression());
        }
        if (imported != null) {
            for (String rejected : imported.rejected()) {
                recorder.note("Error scheduling job: " + rejected);
            }
        }
    }
}
