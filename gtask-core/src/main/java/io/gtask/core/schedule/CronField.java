package io.gtask.core.schedule;

import java.util.BitSet;
import java.util.List;
import java.util.Locale;

/**
 * One of the five positional fields of a cron expression, with its legal value range.
 */
enum CronField {
    MINUTE("minute", 0, 59, 59, List.of()),
    HOUR("hour", 0, 23, 23, List.of()),
    DAY_OF_MONTH("day-of-month", 1, 31, 31, List.of()),
    MONTH("month", 1, 12, 12, List.of(
        "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
    )),
    // 7 is accepted as an alias for Sunday and folded onto 0.
    DAY_OF_WEEK("day-of-week", 0, 7, 6, List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"));

    private final String label;
    private final int min;
    private final int max;
    private final int wildcardMax;
    private final List<String> names;

    CronField(String label, int min, int max, int wildcardMax, List<String> names) {
        this.label = label;
        this.min = min;
        this.max = max;
        this.wildcardMax = wildcardMax;
        this.names = names;
    }

    String label() {
        return label;
    }

    BitSet parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw invalid(raw, "value is required");
        }
        BitSet bits = new BitSet(max + 1);
        for (String part : raw.split(",", -1)) {
            if (part.isEmpty()) {
                throw invalid(raw, "empty list element");
            }
            parsePart(raw, part, bits);
        }
        if (this == DAY_OF_WEEK && bits.get(7)) {
            bits.clear(7);
            bits.set(0);
        }
        return bits;
    }

    private void parsePart(String raw, String part, BitSet bits) {
        String range = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = parseStep(raw, part.substring(slash + 1));
        }

        int start;
        int end;
        if ("*".equals(range) || "?".equals(range)) {
            start = min;
            end = wildcardMax;
        } else {
            int dash = range.indexOf('-');
            if (dash > 0) {
                start = value(raw, range.substring(0, dash));
                end = value(raw, range.substring(dash + 1));
                if (start > end) {
                    throw invalid(raw, "range start " + start + " is after range end " + end);
                }
            } else {
                start = value(raw, range);
                end = slash >= 0 ? wildcardMax : start;
            }
        }

        for (long i = start; i <= end; i += step) {
            bits.set((int) i);
        }
    }

    private int parseStep(String raw, String token) {
        try {
            int step = Integer.parseInt(token);
            if (step <= 0) {
                throw invalid(raw, "step must be positive");
            }
            if (step > max) {
                throw invalid(raw, "step " + step + " exceeds " + max);
            }
            return step;
        } catch (NumberFormatException e) {
            throw invalid(raw, "step is not a number: " + token);
        }
    }

    private int value(String raw, String token) {
        if (token.isEmpty()) {
            throw invalid(raw, "missing value");
        }
        int index = names.indexOf(token.toUpperCase(Locale.ROOT));
        if (index >= 0) {
            return this == MONTH ? index + 1 : index;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw invalid(raw, "not a number: " + token);
        }
        if (parsed < min || parsed > max) {
            throw invalid(raw, parsed + " is outside " + min + "-" + max);
        }
        return parsed;
    }

    private IllegalArgumentException invalid(String raw, String reason) {
        return new IllegalArgumentException("invalid " + label + " field '" + raw + "': " + reason);
    }
}
