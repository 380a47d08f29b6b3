package org.snowlite.engine.project;

import java.time.Duration;
import java.util.Locale;

/**
 * Source freshness thresholds. A null threshold is never exceeded.
 *
 * @param loadedAtField Column holding the load timestamp
 * @param warnAfter     Age beyond which the table is stale (warn)
 * @param errorAfter    Age beyond which the table is stale (error)
 */
public record FreshnessPolicy(String loadedAtField, Duration warnAfter, Duration errorAfter) {

    public FreshnessPolicy {
        loadedAtField = loadedAtField == null || loadedAtField.isBlank() ? "updated_at" : loadedAtField;
    }

    /**
     * Builds a threshold from a {@code count}/{@code period} pair. Periods are
     * {@code minute}, {@code hour} and {@code day}; anything else counts as hours.
     */
    public static Duration period(long count, String period) {
        String unit = period == null ? "hour" : period.trim().toLowerCase(Locale.ROOT);
        return switch (unit) {
            case "minute", "minutes" -> Duration.ofMinutes(count);
            case "day", "days" -> Duration.ofDays(count);
            default -> Duration.ofHours(count);
        };
    }
}
