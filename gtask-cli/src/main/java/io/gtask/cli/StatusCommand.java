package io.gtask.cli;

import io.gtask.core.execution.ExecutionRecord;
import io.gtask.core.query.CommandSummary;
import io.gtask.core.recorder.ExecutionLog;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show the last run and run counts of every command")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--recent"}, description = "List the N most recent executions instead")
    int recent;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (recent > 0) {
                printRecent(context.queries().recent(recent));
            } else {
                printSummaries(context.queries().summarize());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private void printSummaries(List<CommandSummary> summaries) {
        if (summaries.isEmpty()) {
            System.out.println("No executions recorded yet.");
            return;
        }
        for (CommandSummary summary : summaries) {
            System.out.println("Command: " + summary.command());
            System.out.println("  Last run: " + ExecutionLog.formatTimestamp(summary.lastRunAt(), context.zone())
                + " (" + summary.lastTaskId() + ")");
            System.out.println("  Success: " + summary.successCount() + ", Failure: " + summary.failureCount());
        }
    }

    private void printRecent(List<ExecutionRecord> records) {
        for (ExecutionRecord record : records) {
            System.out.println(ExecutionLog.formatTimestamp(record.timestamp(), context.zone())
                + "  " + record.status().label()
                + "  " + record.uid()
                + "  " + record.command());
        }
    }
}
