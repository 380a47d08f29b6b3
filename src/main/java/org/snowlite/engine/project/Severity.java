package org.snowlite.engine.project;

/**
 * Test severity. An {@code ERROR} test with violations fails; a {@code WARN} test warns.
 */
public enum Severity {
    ERROR,
    WARN;

    public static Severity fromValue(String value) {
        return value != null && value.trim().equalsIgnoreCase("warn") ? WARN : ERROR;
    }
}
