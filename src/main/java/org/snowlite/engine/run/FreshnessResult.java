package org.snowlite.engine.run;

import java.time.Duration;
import java.time.Instant;

/**
 * Freshness of one source table.
 *
 * @param maxLoadedAt Latest value of the loaded-at column, or null when unknown
 * @param age         Time since {@code maxLoadedAt}, or null when unknown
 */
public record FreshnessResult(
        String source,
        String table,
        Status status,
        Instant maxLoadedAt,
        Duration age,
        String message) {

    public enum Status {
        PASS,
        WARN,
        ERROR
    }

    public String uniqueId(String projectName) {
        return "source." + projectName + "." + source + "." + table;
    }
}
