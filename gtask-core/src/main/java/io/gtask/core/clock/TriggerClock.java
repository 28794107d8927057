package io.gtask.core.clock;

import io.gtask.core.execution.CommandExecutor;
import io.gtask.core.execution.ExecutionRecord;
import io.gtask.core.job.ArmedJob;
import io.gtask.core.job.JobRegistry;
import io.gtask.core.recorder.ExecutionLog;
import io.gtask.core.recorder.StatusRecorder;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wakes at every minute boundary, evaluates the armed jobs against that minute and hands each
 * match to a worker thread. The ticker never waits for an execution to finish.
 *
 * <p>Cron fields are evaluated in the zone of the supplied {@link Clock}.
 */
public final class TriggerClock implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TriggerClock.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final JobRegistry registry;
    private final CommandExecutor executor;
    private final StatusRecorder recorder;
    private final Clock clock;
    private final OverlapPolicy overlapPolicy;
    private final Duration defaultTimeout;

    private final ScheduledExecutorService ticker;
    private final ExecutorService workers;
    private final Set<Long> running = ConcurrentHashMap.newKeySet();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicReference<Instant> lastEvaluated = new AtomicReference<>();
    private final AtomicReference<ClockState> state = new AtomicReference<>(ClockState.IDLE);
    private final AtomicBoolean started = new AtomicBoolean(false);

    public TriggerClock(
        JobRegistry registry,
        CommandExecutor executor,
        StatusRecorder recorder,
        Clock clock,
        OverlapPolicy overlapPolicy,
        Duration defaultTimeout
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.overlapPolicy = overlapPolicy == null ? OverlapPolicy.ALLOW : overlapPolicy;
        this.defaultTimeout = defaultTimeout == null ? Duration.ZERO : defaultTimeout;
        this.ticker = Executors.newSingleThreadScheduledExecutor(namedThreads("gtask-clock"));
        this.workers = Executors.newCachedThreadPool(namedThreads("gtask-job"));
    }

    /**
     * Announces startup in the execution log and schedules the first tick for the next minute
     * boundary. Calling it again has no effect.
     */
    public void start() {
        if (state.get() == ClockState.STOPPED) {
            throw new IllegalStateException("Trigger clock has been stopped");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        recorder.note("[" + ExecutionLog.formatTimestamp(clock.instant(), clock.getZone()) + "] Scheduler has started");
        scheduleNextTick();
    }

    /**
     * Evaluates one minute. A minute that was already evaluated (or one before it) dispatches
     * nothing, so a late or repeated wake-up cannot fire a job twice.
     *
     * @return one future per dispatched execution, completed with the stored record
     */
    public List<CompletableFuture<ExecutionRecord>> tick(ZonedDateTime at) {
        ZonedDateTime minute = at.truncatedTo(ChronoUnit.MINUTES);
        Instant key = minute.toInstant();
        Instant previous = lastEvaluated.getAndAccumulate(key, (current, candidate) ->
            current == null || candidate.isAfter(current) ? candidate : current);
        if (previous != null && !key.isAfter(previous)) {
            LOG.debug("Minute {} already evaluated", minute);
            return List.of();
        }
        if (!state.compareAndSet(ClockState.IDLE, ClockState.EVALUATING)) {
            LOG.debug("Skipping tick {} in state {}", minute, state.get());
            return List.of();
        }

        try {
            LocalDateTime local = minute.toLocalDateTime();
            List<ArmedJob> due = new ArrayList<>();
            Map<Long, ArmedJob> armed = registry.snapshot();
            for (ArmedJob job : armed.values()) {
                if (job.schedule().matches(local)) {
                    due.add(job);
                }
            }

            state.set(ClockState.DISPATCHING);
            List<CompletableFuture<ExecutionRecord>> dispatched = new ArrayList<>(due.size());
            for (ArmedJob job : due) {
                CompletableFuture<ExecutionRecord> future = dispatch(job);
                if (future != null) {
                    dispatched.add(future);
                }
            }
            if (!dispatched.isEmpty()) {
                LOG.debug("Dispatched {} of {} armed jobs at {}", dispatched.size(), armed.size(), minute);
            }
            return dispatched;
        } finally {
            state.compareAndSet(ClockState.EVALUATING, ClockState.IDLE);
            state.compareAndSet(ClockState.DISPATCHING, ClockState.IDLE);
        }
    }

    /**
     * Cancels future ticks. Executions already dispatched run to completion.
     */
    public void stop() {
        ClockState before = state.getAndSet(ClockState.STOPPED);
        if (before == ClockState.STOPPED) {
            return;
        }
        ticker.shutdownNow();
        workers.shutdown();
        LOG.info("Trigger clock stopped; {} executions still running", inFlight.get());
    }

    public ClockState state() {
        return state.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    @Override
    public void close() {
        stop();
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Executions still running after {}s; leaving them to process exit", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for executions to finish");
        }
    }

    private CompletableFuture<ExecutionRecord> dispatch(ArmedJob job) {
        boolean exclusive = overlapPolicy == OverlapPolicy.SKIP_IF_RUNNING;
        if (exclusive && !running.add(job.id())) {
            LOG.info("Skipping job {} ({}): previous execution still running", job.id(), job.name());
            return null;
        }
        Duration timeout = job.timeout().isZero() ? defaultTimeout : job.timeout();
        inFlight.incrementAndGet();
        try {
            // The returned stage completes only after the bookkeeping below has run.
            return CompletableFuture.supplyAsync(
                () -> recorder.record(executor.run(job.command(), timeout)),
                workers
            ).whenComplete((record, error) -> {
                inFlight.decrementAndGet();
                if (exclusive) {
                    running.remove(job.id());
                }
                if (error != null) {
                    LOG.error("Execution of job {} ({}) failed unexpectedly", job.id(), job.name(), error);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            if (exclusive) {
                running.remove(job.id());
            }
            LOG.warn("Not dispatching job {} ({}): clock is stopping", job.id(), job.name());
            return null;
        }
    }

    private void scheduleNextTick() {
        Instant now = clock.instant();
        Instant boundary = now.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        long delayMs = Math.max(0, Duration.between(now, boundary).toMillis());
        try {
            ticker.schedule(this::runScheduledTick, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Ticker shut down; no further ticks");
        }
    }

    private void runScheduledTick() {
        try {
            try {
                registry.reload();
            } catch (IOException e) {
                LOG.warn("Could not refresh jobs from the store; using the last known set", e);
            }
            tick(ZonedDateTime.now(clock));
        } catch (RuntimeException e) {
            LOG.error("Tick failed", e);
        } finally {
            if (state.get() != ClockState.STOPPED) {
                scheduleNextTick();
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
