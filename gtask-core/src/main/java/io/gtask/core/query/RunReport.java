package io.gtask.core.query;

import io.gtask.core.execution.ExecutionRecord;
import io.gtask.core.recorder.ExecutionLog;
import java.time.ZoneId;

/**
 * Plain-text rendering of a single execution, served as the downloadable run log.
 */
public final class RunReport {
    private RunReport() {
    }

    public static String render(ExecutionRecord record, ZoneId zone) {
        return "Task ID: " + record.uid() + "\n"
            + "Command: " + record.command() + "\n"
            + "Timestamp: " + ExecutionLog.formatTimestamp(record.timestamp(), zone) + "\n"
            + "Status: " + record.status().label() + "\n"
            + "\n"
            + "Output:\n"
            + record.output() + "\n";
    }

    public static String fileName(ExecutionRecord record) {
        return record.uid() + ".log";
    }
}
