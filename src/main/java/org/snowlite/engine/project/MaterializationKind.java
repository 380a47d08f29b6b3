package org.snowlite.engine.project;

import java.util.Locale;
import java.util.Optional;

/**
 * How a model's result becomes a relation.
 */
public enum MaterializationKind {
    VIEW,
    TABLE,
    INCREMENTAL,
    EPHEMERAL,
    SNAPSHOT,
    SEED,
    TEST;

    /**
     * @return The lower-case name used in {@code config(materialized='...')}
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MaterializationKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MaterializationKind kind : values()) {
            if (kind.value().equalsIgnoreCase(value.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
