package io.gtask.core.schedule;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed five-field cron expression (minute, hour, day-of-month, month, day-of-week).
 *
 * <p>Each field accepts {@code *}, literals, comma lists, ranges and {@code /} steps. Month and
 * day-of-week also accept three-letter names. When both day fields are restricted a minute
 * matches if either of them matches, as in classic cron.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class CronExpression {
    private static final Map<String, String> DESCRIPTORS = Map.of(
        "@yearly", "0 0 1 1 *",
        "@annually", "0 0 1 1 *",
        "@monthly", "0 0 1 * *",
        "@weekly", "0 0 * * 0",
        "@daily", "0 0 * * *",
        "@midnight", "0 0 * * *",
        "@hourly", "0 * * * *"
    );
    private static final int SEARCH_HORIZON_YEARS = 5;

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthStar;
    private final boolean dayOfWeekStar;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = CronField.MINUTE.parse(fields[0]);
        this.hours = CronField.HOUR.parse(fields[1]);
        this.daysOfMonth = CronField.DAY_OF_MONTH.parse(fields[2]);
        this.months = CronField.MONTH.parse(fields[3]);
        this.daysOfWeek = CronField.DAY_OF_WEEK.parse(fields[4]);
        this.dayOfMonthStar = fields[2].startsWith("*") || fields[2].startsWith("?");
        this.dayOfWeekStar = fields[4].startsWith("*") || fields[4].startsWith("?");
    }

    /**
     * Parses an expression, failing with a message that names the offending field.
     *
     * @throws IllegalArgumentException if the expression is blank, has the wrong number of
     *     fields, or contains an out-of-range or unparseable value
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        String normalized = expression.trim().replaceAll("\\s+", " ");
        String resolved = normalized;
        if (normalized.startsWith("@")) {
            resolved = DESCRIPTORS.get(normalized.toLowerCase(Locale.ROOT));
            if (resolved == null) {
                throw new IllegalArgumentException("unknown cron descriptor: " + normalized);
            }
        }
        String[] fields = resolved.split(" ");
        if (fields.length != 5) {
            throw new IllegalArgumentException(
                "expected 5 fields (minute hour day-of-month month day-of-week) but found "
                    + fields.length + " in '" + normalized + "'"
            );
        }
        return new CronExpression(normalized, fields);
    }

    public String expression() {
        return expression;
    }

    /**
     * Whether the expression fires during the minute containing {@code time}. Seconds are ignored.
     */
    public boolean matches(LocalDateTime time) {
        return minutes.get(time.getMinute())
            && hours.get(time.getHour())
            && months.get(time.getMonthValue())
            && dayMatches(time);
    }

    /**
     * The first matching minute strictly after {@code after}, or empty when none falls within
     * the search horizon (for example {@code 0 0 30 2 *}).
     */
    public Optional<LocalDateTime> next(LocalDateTime after) {
        LocalDateTime candidate = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDateTime limit = candidate.plusYears(SEARCH_HORIZON_YEARS);
        while (candidate.isBefore(limit)) {
            if (!months.get(candidate.getMonthValue())) {
                candidate = candidate.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(candidate)) {
                candidate = candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hours.get(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private boolean dayMatches(LocalDateTime time) {
        boolean dayOfMonth = daysOfMonth.get(time.getDayOfMonth());
        boolean dayOfWeek = daysOfWeek.get(time.getDayOfWeek().getValue() % 7);
        if (dayOfMonthStar || dayOfWeekStar) {
            return dayOfMonth && dayOfWeek;
        }
        return dayOfMonth || dayOfWeek;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof CronExpression that && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
