package io.gtask.core.execution;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs commands through {@code <shell> -c} with stderr merged into stdout.
 *
 * <p>Output is drained on a separate thread so that a deadline holds even when a detached
 * background process keeps the output pipe open after the shell has been killed.
 */
public final class ShellCommandExecutor implements CommandExecutor, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ShellCommandExecutor.class);
    private static final Duration OUTPUT_GRACE = Duration.ofSeconds(1);

    private final String shell;
    private final Clock clock;
    private final ExecutorService readers;

    public ShellCommandExecutor(String shell, Clock clock) {
        this.shell = shell == null || shell.isBlank() ? "bash" : shell.trim();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        AtomicInteger counter = new AtomicInteger();
        this.readers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "gtask-output-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ExecutionRecord run(String command, Duration timeout) {
        String uid = UUID.randomUUID().toString();
        long startedAt = System.nanoTime();

        Process process;
        try {
            process = new ProcessBuilder(shell, "-c", command)
                .redirectErrorStream(true)
                .start();
        } catch (IOException e) {
            LOG.warn("Failed to start command '{}' with shell {}", command, shell, e);
            return finish(uid, command, -1, "failed to start command: " + e.getMessage(), startedAt);
        }

        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        Future<?> drain;
        try {
            process.getOutputStream().close();
            drain = readers.submit(() -> copy(process.getInputStream(), sink));
        } catch (IOException | RuntimeException e) {
            destroyTree(process);
            return finish(uid, command, -1, "failed to read command output: " + e.getMessage(), startedAt);
        }

        long deadlineMillis = deadlineMillis(timeout);
        try {
            if (deadlineMillis > 0 && !process.waitFor(deadlineMillis, TimeUnit.MILLISECONDS)) {
                destroyTree(process);
                process.waitFor();
                awaitOutput(drain, OUTPUT_GRACE);
                String output = text(sink);
                return finish(uid, command, -1, output + "\n[timed out after " + timeout.toSeconds() + "s]", startedAt);
            }
            int exitCode = process.waitFor();
            awaitOutput(drain, null);
            return finish(uid, command, exitCode, text(sink), startedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            return finish(uid, command, -1, "command interrupted", startedAt);
        }
    }

    @Override
    public void close() {
        readers.shutdownNow();
    }

    /**
     * Milliseconds until the deadline, or {@code 0} when the command may run without limit.
     */
    static long deadlineMillis(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        try {
            return timeout.toMillis();
        } catch (ArithmeticException e) {
            return 0;
        }
    }

    private static Void copy(InputStream stream, ByteArrayOutputStream sink) throws IOException {
        try (stream) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = stream.read(buffer)) != -1) {
                sink.write(buffer, 0, read);
            }
        }
        return null;
    }

    private static void awaitOutput(Future<?> drain, Duration limit) throws InterruptedException {
        try {
            if (limit == null) {
                drain.get();
            } else {
                drain.get(limit.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            LOG.warn("Output pipe still open after the command was killed; keeping what was read");
        } catch (ExecutionException e) {
            LOG.warn("Failed to read command output", e.getCause());
        }
    }

    private static String text(ByteArrayOutputStream sink) {
        return new String(sink.toByteArray(), StandardCharsets.UTF_8);
    }

    private ExecutionRecord finish(String uid, String command, int exitCode, String output, long startedAt) {
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        return new ExecutionRecord(
            uid,
            0,
            command,
            clock.instant(),
            ExecutionStatus.ofExitCode(exitCode),
            output,
            exitCode,
            durationMs
        );
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
