package io.gtask.core.job;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a line-oriented job file of {@code <5-field-cron> <command>} entries.
 *
 * <p>Blank lines and {@code #} comments are ignored. A line may also start with a descriptor such
 * as {@code @hourly}. Lines without a command are skipped with a warning; the cron fields
 * themselves are validated at registration.
 */
public final class CronTabFile {
    private static final Logger LOG = LoggerFactory.getLogger(CronTabFile.class);
    private static final Pattern FIVE_FIELD_LINE = Pattern.compile("^(\\S+\\s+\\S+\\s+\\S+\\s+\\S+\\s+\\S+)\\s+(\\S.*)$");
    private static final Pattern DESCRIPTOR_LINE = Pattern.compile("^(@\\S+)\\s+(\\S.*)$");

    private CronTabFile() {
    }

    public static List<CronTabEntry> read(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.warn("Job file {} does not exist, nothing to import", path);
            return List.of();
        }

        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        List<CronTabEntry> entries = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            Matcher matcher = line.startsWith("@") ? DESCRIPTOR_LINE.matcher(line) : FIVE_FIELD_LINE.matcher(line);
            if (!matcher.matches()) {
                LOG.warn("Skipping invalid line {} in {}: {}", i + 1, path, line);
                continue;
            }
            String schedule = matcher.group(1).replaceAll("\\s+", " ");
            entries.add(new CronTabEntry(i + 1, schedule, matcher.group(2).trim()));
        }
        return entries;
    }
}
