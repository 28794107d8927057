package io.gtask.core.clock;

import java.util.Locale;

/**
 * What the trigger clock does when a job matches a tick while its previous execution is still
 * running.
 */
public enum OverlapPolicy {
    ALLOW,
    SKIP_IF_RUNNING;

    public static OverlapPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return ALLOW;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (OverlapPolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown overlap policy: " + value);
    }
}
