package io.gtask.core.recorder;

import io.gtask.core.execution.ExecutionRecord;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Human-readable, append-only mirror of the execution history: one status line per run plus an
 * output block for failures. Each run's lines are also written to {@code <runsDir>/<uid>.log}.
 *
 * <p>Not thread-safe. Writers go through {@link RecorderContext#writeLock()}.
 */
public final class ExecutionLog implements Closeable {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("dd-MM-yyyy HH:mm:ss");

    private final Path path;
    private final Path runsDir;
    private final ZoneId zone;
    private final BufferedWriter writer;

    public ExecutionLog(Path path, Path runsDir, ZoneId zone) throws IOException {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.runsDir = runsDir;
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        Files.createDirectories(path.toAbsolutePath().getParent());
        if (runsDir != null) {
            Files.createDirectories(runsDir);
        }
        this.writer = Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.APPEND
        );
    }

    public Path path() {
        return path;
    }

    public void append(String line) throws IOException {
        writer.write(line.endsWith("\n") ? line : line + "\n");
        writer.flush();
    }

    public void appendRecord(ExecutionRecord record) throws IOException {
        String block = format(record);
        writer.write(block);
        writer.flush();
        if (runsDir != null) {
            Files.writeString(runsDir.resolve(record.uid() + ".log"), block, StandardCharsets.UTF_8);
        }
    }

    public String format(ExecutionRecord record) {
        String timestamp = formatTimestamp(record.timestamp(), zone);
        String status = record.status().label();
        StringBuilder block = new StringBuilder()
            .append('[').append(timestamp).append("] Status: ").append(status)
            .append(", Job UID: ").append(record.uid())
            .append(", Command: ").append(record.command())
            .append('\n');
        if (!record.succeeded()) {
            block.append('[').append(timestamp).append("] Error Occurred Status: ").append(status)
                .append(", Job UID: ").append(record.uid())
                .append('\n')
                .append("Command: ").append(record.command())
                .append(", Output: ").append(record.output());
            if (!record.output().endsWith("\n")) {
                block.append('\n');
            }
        }
        return block.toString();
    }

    public static String formatTimestamp(Instant instant, ZoneId zone) {
        return TIMESTAMP.format(instant.atZone(zone));
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
