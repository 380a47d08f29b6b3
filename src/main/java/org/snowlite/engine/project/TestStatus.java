package org.snowlite.engine.project;

import java.util.Locale;

public enum TestStatus {
    PENDING,
    PASS,
    FAIL,
    WARN,
    ERROR;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
