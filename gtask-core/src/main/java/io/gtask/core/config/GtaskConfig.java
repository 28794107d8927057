package io.gtask.core.config;

import io.gtask.core.clock.OverlapPolicy;
import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.function.Function;

/**
 * Process configuration read from a {@code .env} file and the environment. Environment variables
 * win over the file.
 *
 * @param host listen address, {@code 0.0.0.0} when {@code ENDPOINT} has no host part
 * @param commandTimeout default execution deadline, {@link Duration#ZERO} for none
 * @param zone zone cron fields are evaluated in and log timestamps are rendered in
 */
public record GtaskConfig(
    Path logDir,
    Path dbDir,
    String host,
    int port,
    Path cronFile,
    String shell,
    Duration commandTimeout,
    OverlapPolicy overlapPolicy,
    ZoneId zone
) {
    public static final String LOG_DIR = "LOG_DIR";
    public static final String DB_DIR = "DB_DIR";
    public static final String ENDPOINT = "ENDPOINT";
    public static final String CRON_FILE = "CRON_FILE";
    public static final String COMMAND_SHELL = "COMMAND_SHELL";
    public static final String COMMAND_TIMEOUT_SECONDS = "COMMAND_TIMEOUT_SECONDS";
    public static final String OVERLAP_POLICY = "OVERLAP_POLICY";
    public static final String TIMEZONE = "TIMEZONE";

    public GtaskConfig {
        Objects.requireNonNull(logDir, "logDir must not be null");
        Objects.requireNonNull(dbDir, "dbDir must not be null");
        host = host == null || host.isBlank() ? "0.0.0.0" : host.trim();
        cronFile = cronFile == null ? Path.of("cron_jobs.txt") : cronFile;
        shell = shell == null || shell.isBlank() ? "bash" : shell.trim();
        commandTimeout = commandTimeout == null ? Duration.ZERO : commandTimeout;
        overlapPolicy = overlapPolicy == null ? OverlapPolicy.ALLOW : overlapPolicy;
        zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    /**
     * Reads {@code <directory>/.env} if present, falling back to the process environment.
     *
     * @throws IllegalStateException if a required key is missing or a value is malformed
     */
    public static GtaskConfig load(Path directory) {
        Dotenv dotenv = Dotenv.configure()
            .directory(directory.toString())
            .ignoreIfMissing()
            .load();
        return from(dotenv::get);
    }

    public static GtaskConfig from(Function<String, String> source) {
        Path logDir = Path.of(required(source, LOG_DIR));
        Path dbDir = Path.of(required(source, DB_DIR));
        String endpoint = required(source, ENDPOINT);

        int separator = endpoint.lastIndexOf(':');
        if (separator < 0) {
            throw new IllegalStateException(ENDPOINT + " must be host:port but was '" + endpoint + "'");
        }
        String host = endpoint.substring(0, separator);
        int port = parseInt(ENDPOINT, endpoint.substring(separator + 1));
        if (port < 0 || port > 65535) {
            throw new IllegalStateException(ENDPOINT + " port out of range: " + port);
        }

        String cronFile = optional(source, CRON_FILE);
        long timeoutSeconds = 0;
        String timeout = optional(source, COMMAND_TIMEOUT_SECONDS);
        if (timeout != null) {
            timeoutSeconds = parseInt(COMMAND_TIMEOUT_SECONDS, timeout);
            if (timeoutSeconds < 0) {
                throw new IllegalStateException(COMMAND_TIMEOUT_SECONDS + " must be >= 0");
            }
        }

        OverlapPolicy policy;
        try {
            policy = OverlapPolicy.parse(optional(source, OVERLAP_POLICY));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(OVERLAP_POLICY + ": " + e.getMessage(), e);
        }

        ZoneId zone = null;
        String zoneId = optional(source, TIMEZONE);
        if (zoneId != null) {
            try {
                zone = ZoneId.of(zoneId);
            } catch (DateTimeException e) {
                throw new IllegalStateException(TIMEZONE + " is not a valid zone id: " + zoneId, e);
            }
        }

        return new GtaskConfig(
            logDir,
            dbDir,
            host,
            port,
            cronFile == null ? null : Path.of(cronFile),
            optional(source, COMMAND_SHELL),
            Duration.ofSeconds(timeoutSeconds),
            policy,
            zone
        );
    }

    public Path logFile() {
        return logDir.resolve("scheduler.log");
    }

    public Path runsDir() {
        return logDir.resolve("runs");
    }

    public Path databaseFile() {
        return dbDir.resolve("jobs.db");
    }

    public String endpoint() {
        return host + ":" + port;
    }

    private static String required(Function<String, String> source, String key) {
        String value = optional(source, key);
        if (value == null) {
            throw new IllegalStateException(key + " is not set in .env or the environment");
        }
        return value;
    }

    private static String optional(Function<String, String> source, String key) {
        String value = source.apply(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a number but was '" + value + "'", e);
        }
    }
}
