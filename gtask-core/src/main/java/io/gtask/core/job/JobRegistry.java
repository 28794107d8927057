package io.gtask.core.job;

import io.gtask.core.error.DuplicateJobException;
import io.gtask.core.error.JobConfigurationException;
import io.gtask.core.error.JobNotFoundException;
import io.gtask.core.recorder.RecorderContext;
import io.gtask.core.schedule.CronExpression;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of known job definitions and the armed subset the trigger clock dispatches from.
 *
 * <p>Mutations are serialized and persisted through the {@link RecorderContext} before being
 * published. Both views are immutable maps swapped in a single volatile write, so a concurrent
 * {@link #snapshot()} sees either the state before a mutation or the state after it.
 */
public final class JobRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(JobRegistry.class);
    /** Thirty days. */
    public static final long MAX_TIMEOUT_SECONDS = 30L * 24 * 60 * 60;

    private final RecorderContext context;
    private final Clock clock;
    private final Object mutationLock = new Object();

    private volatile State state = new State(Map.of(), Map.of());

    public JobRegistry(RecorderContext context, Clock clock) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Replaces the in-memory view with what the job store holds. Called at startup and before
     * every tick so that edits made by other processes are picked up.
     */
    public void reload() throws IOException {
        synchronized (mutationLock) {
            List<JobDefinition> stored = context.jobStore().loadAll();
            Map<Long, JobDefinition> definitions = new LinkedHashMap<>();
            Map<Long, ArmedJob> armed = new LinkedHashMap<>();
            Map<Long, ArmedJob> current = state.armed();
            for (JobDefinition definition : stored) {
                definitions.put(definition.id(), definition);
                if (!definition.active()) {
                    continue;
                }
                ArmedJob existing = current.get(definition.id());
                if (existing != null && existing.schedule().expression().equals(definition.schedule())) {
                    armed.put(definition.id(), existing);
                    continue;
                }
                try {
                    armed.put(definition.id(), ArmedJob.of(definition, CronExpression.parse(definition.schedule())));
                } catch (RuntimeException e) {
                    LOG.warn("Not arming job {} ({}): {}", definition.id(), definition.name(), e.getMessage());
                }
            }
            publish(definitions, armed);
        }
    }

    /**
     * Validates, persists and arms a new job.
     *
     * @throws JobConfigurationException if a required field is missing or the schedule is invalid
     * @throws DuplicateJobException if the name is already taken
     */
    public JobDefinition register(NewJob job) throws IOException {
        NewJob normalized = validate(job);
        CronExpression schedule = parseSchedule(normalized.schedule());

        synchronized (mutationLock) {
            if (findByName(normalized.name()).isPresent()) {
                throw new DuplicateJobException(normalized.name());
            }
            Instant now = clock.instant();
            JobDefinition saved = context.exclusive(() -> context.jobStore().insert(normalized, now));

            Map<Long, JobDefinition> definitions = new LinkedHashMap<>(state.definitions());
            Map<Long, ArmedJob> armed = new LinkedHashMap<>(state.armed());
            definitions.put(saved.id(), saved);
            armed.put(saved.id(), ArmedJob.of(saved, schedule));
            publish(definitions, armed);
            LOG.info("Registered job {} ({}) '{}' with schedule '{}'", saved.id(), saved.name(), saved.command(), saved.schedule());
            return saved;
        }
    }

    /**
     * Marks a job inactive and removes it from future ticks. Executions already dispatched keep
     * running. Disabling an inactive job is a no-op.
     */
    public JobDefinition disable(long id) throws IOException {
        return setActive(id, false);
    }

    public JobDefinition enable(long id) throws IOException {
        return setActive(id, true);
    }

    /**
     * The armed jobs keyed by id, as of the last mutation.
     */
    public Map<Long, ArmedJob> snapshot() {
        return state.armed();
    }

    /**
     * Every definition ever registered, active or not, in id order.
     */
    public List<JobDefinition> list() {
        return List.copyOf(state.definitions().values());
    }

    public Optional<JobDefinition> find(long id) {
        return Optional.ofNullable(state.definitions().get(id));
    }

    public Optional<JobDefinition> findByName(String name) {
        return state.definitions().values().stream()
            .filter(definition -> definition.name().equals(name))
            .findFirst();
    }

    /**
     * Registers every valid line of a job file. Lines are named after their content, so importing
     * the same file again leaves the registry unchanged and keeps disabled lines disabled.
     */
    public CronTabImport importCronTab(Path file) throws IOException {
        List<JobDefinition> registered = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        int known = 0;
        for (CronTabEntry entry : CronTabFile.read(file)) {
            String name = cronTabName(entry);
            Optional<JobDefinition> existing = findByName(name);
            if (existing.isPresent()) {
                if (sameLine(existing.get(), entry)) {
                    known++;
                } else {
                    String reason = "name " + name + " is already used by job " + existing.get().id();
                    LOG.warn("Skipping line {} of {}: {}", entry.lineNumber(), file, reason);
                    rejected.add("line " + entry.lineNumber() + ": " + reason);
                }
                continue;
            }
            String description = "Imported from " + file.getFileName() + " line " + entry.lineNumber();
            try {
                registered.add(register(new NewJob(name, entry.schedule(), entry.command(), description, 0)));
            } catch (DuplicateJobException e) {
                // Imported concurrently by another process since the last reload.
                LOG.info("Line {} of {} was registered elsewhere: {}", entry.lineNumber(), file, e.getMessage());
                known++;
            } catch (JobConfigurationException e) {
                LOG.warn("Skipping line {} of {}: {}", entry.lineNumber(), file, e.getMessage());
                rejected.add("line " + entry.lineNumber() + ": " + e.getMessage());
            }
        }
        return new CronTabImport(registered, known, rejected);
    }

    /**
     * Names an imported line after a SHA-256 digest of its normalized schedule and command.
     */
    static String cronTabName(CronTabEntry entry) {
        String line = normalizeSchedule(entry.schedule()) + " " + entry.command().trim();
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(line.getBytes(StandardCharsets.UTF_8));
            return "crontab-" + HexFormat.of().formatHex(Arrays.copyOf(digest, 16));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static boolean sameLine(JobDefinition definition, CronTabEntry entry) {
        return definition.schedule().equals(normalizeSchedule(entry.schedule()))
            && definition.command().equals(entry.command().trim());
    }

    private static String normalizeSchedule(String schedule) {
        return schedule == null ? "" : schedule.trim().replaceAll("\\s+", " ");
    }

    private JobDefinition setActive(long id, boolean active) throws IOException {
        synchronized (mutationLock) {
            JobDefinition existing = state.definitions().get(id);
            if (existing == null) {
                throw new JobNotFoundException(id);
            }
            if (existing.active() == active) {
                return existing;
            }
            CronExpression schedule = active ? parseSchedule(existing.schedule()) : null;

            Instant now = clock.instant();
            context.exclusive(() -> {
                context.jobStore().updateActive(id, active, now);
                return null;
            });

            JobDefinition updated = existing.withActive(active, now);
            Map<Long, JobDefinition> definitions = new LinkedHashMap<>(state.definitions());
            Map<Long, ArmedJob> armed = new LinkedHashMap<>(state.armed());
            definitions.put(id, updated);
            if (active) {
                armed.put(id, ArmedJob.of(updated, schedule));
            } else {
                armed.remove(id);
            }
            publish(definitions, armed);
            LOG.info("{} job {} ({})", active ? "Enabled" : "Disabled", id, existing.name());
            return updated;
        }
    }

    private NewJob validate(NewJob job) {
        if (job == null) {
            throw new JobConfigurationException("job is required");
        }
        String name = job.name() == null ? "" : job.name().trim();
        String schedule = normalizeSchedule(job.schedule());
        String command = job.command() == null ? "" : job.command().trim();
        if (name.isEmpty()) {
            throw new JobConfigurationException("job name is required");
        }
        if (schedule.isEmpty()) {
            throw new JobConfigurationException("cron expression is required");
        }
        if (command.isEmpty()) {
            throw new JobConfigurationException("command is required");
        }
        if (job.timeoutSeconds() < 0 || job.timeoutSeconds() > MAX_TIMEOUT_SECONDS) {
            throw new JobConfigurationException("timeoutSeconds must be between 0 and " + MAX_TIMEOUT_SECONDS);
        }
        String description = job.description() == null ? "" : job.description().trim();
        return new NewJob(name, schedule, command, description, job.timeoutSeconds());
    }

    private CronExpression parseSchedule(String schedule) {
        try {
            return CronExpression.parse(schedule);
        } catch (RuntimeException e) {
            throw new JobConfigurationException("Invalid cron expression '" + schedule + "': " + e.getMessage(), e);
        }
    }

    private void publish(Map<Long, JobDefinition> definitions, Map<Long, ArmedJob> armed) {
        state = new State(
            Collections.unmodifiableMap(definitions),
            Collections.unmodifiableMap(armed)
        );
    }

    private record State(Map<Long, JobDefinition> definitions, Map<Long, ArmedJob> armed) {
    }
}
