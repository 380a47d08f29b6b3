package org.snowlite.engine.template;

import org.snowlite.engine.project.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of compiling template SQL.
 *
 * @param sql    Plain SQL, still in the warehouse dialect
 * @param model  The current model with {@code config()} keys applied, or null when
 *               compiled without one
 * @param config Keys parsed from {@code config()} blocks
 */
public record CompiledSql(String sql, Model model, Map<String, Object> config) {

    public CompiledSql {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }
}
