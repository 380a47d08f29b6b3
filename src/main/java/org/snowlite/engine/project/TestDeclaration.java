package org.snowlite.engine.project;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A generic test declared on a column, e.g. {@code unique}, or
 * {@code accepted_values} with {@code values: [...]}.
 *
 * @param kind   The test name ({@code unique}, {@code not_null}, {@code accepted_values},
 *               {@code relationships}, or anything else)
 * @param config Test arguments: {@code values}, {@code to}, {@code field}, {@code severity}
 */
public record TestDeclaration(String kind, Map<String, Object> config) {

    public TestDeclaration {
        Objects.requireNonNull(kind, "Test kind cannot be null");
        config = config == null ? Map.of() : Map.copyOf(config);
    }

    public static TestDeclaration of(String kind) {
        return new TestDeclaration(kind, Map.of());
    }

    public String stringArg(String key) {
        Object value = config.get(key);
        return value == null ? "" : value.toString();
    }

    public List<?> listArg(String key) {
        Object value = config.get(key);
        if (value instanceof List<?> list) {
            return list;
        }
        return value == null ? List.of() : List.of(value);
    }

    public Severity severity() {
        return Severity.fromValue(stringArg("severity"));
    }
}
