package io.gtask.cli;

import io.gtask.core.error.GtaskException;
import io.gtask.core.job.JobDefinition;
import io.gtask.core.job.NewJob;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "jobs", description = "List, register, disable and enable jobs")
public final class JobsCommand implements Runnable {
    private final CliContext context;

    public JobsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        list(false);
    }

    @Command(name = "list", description = "List registered jobs")
    int list(@Option(names = {"--active"}, description = "Only armed jobs") boolean activeOnly) {
        List<JobDefinition> jobs = context.registry().list();
        for (JobDefinition job : jobs) {
            if (activeOnly && !job.active()) {
                continue;
            }
            System.out.println(job.id() + "  " + (job.active() ? "active  " : "disabled")
                + "  " + job.name() + "  [" + job.schedule() + "]  " + job.command());
        }
        return 0;
    }

    @Command(name = "add", description = "Register a job")
    int add(
        @Option(names = {"--name"}, required = true, description = "Unique job name") String name,
        @Option(names = {"--schedule"}, required = true, description = "Five-field cron expression or @descriptor") String schedule,
        @Option(names = {"--description"}, defaultValue = "", description = "Free text") String description,
        @Option(names = {"--timeout"}, defaultValue = "0", description = "Timeout in seconds, 0 for the default") long timeoutSeconds,
        @Parameters(arity = "1..*", description = "Command line run through the shell") List<String> command
    ) {
        try {
            JobDefinition job = context.registry().register(
                new NewJob(name, schedule, String.join(" ", command), description, timeoutSeconds)
            );
            System.out.println("Registered job " + job.id() + " (" + job.name() + ")");
            return 0;
        } catch (GtaskException e) {
            System.err.println(e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Jobs add failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "disable", description = "Stop scheduling a job; its history is kept")
    int disable(@Parameters(index = "0", description = "Job id") long id) {
        return setActive(id, false);
    }

    @Command(name = "enable", description = "Resume scheduling a disabled job")
    int enable(@Parameters(index = "0", description = "Job id") long id) {
        return setActive(id, true);
    }

    private int setActive(long id, boolean active) {
        try {
            JobDefinition job = active ? context.registry().enable(id) : context.registry().disable(id);
            System.out.println((active ? "Enabled" : "Disabled") + " job " + job.id() + " (" + job.name() + ")");
            return 0;
        } catch (GtaskException e) {
            System.err.println(e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Jobs " + (active ? "enable" : "disable") + " failed: " + e.getMessage());
            return 1;
        }
    }
}
