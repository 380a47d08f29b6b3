package org.snowlite.engine.project;

import java.util.List;
import java.util.Objects;

/**
 * Documentation and tests declared for one column of a model or source table.
 */
public record ColumnDoc(String name, String description, String dataType, List<TestDeclaration> tests) {

    public ColumnDoc {
        Objects.requireNonNull(name, "Column name cannot be null");
        description = description == null ? "" : description;
        tests = tests == null ? List.of() : List.copyOf(tests);
    }

    public static ColumnDoc of(String name, String description) {
        return new ColumnDoc(name, description, null, List.of());
    }
}
