package org.snowlite.engine.project;

/**
 * How a snapshot detects that a row changed.
 * <ul>
 *   <li>{@code TIMESTAMP}: the source's {@code updated_at} column moved forward</li>
 *   <li>{@code CHECK}: any of the configured compare columns differs</li>
 * </ul>
 */
public enum SnapshotStrategy {
    TIMESTAMP,
    CHECK;

    public static SnapshotStrategy fromValue(String value) {
        return value != null && value.trim().equalsIgnoreCase("check") ? CHECK : TIMESTAMP;
    }
}
