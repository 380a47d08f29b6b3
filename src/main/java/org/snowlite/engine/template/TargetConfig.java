package org.snowlite.engine.template;

import org.snowlite.engine.project.ProjectConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The fields readable as {@code {{ target.<field> }}}.
 *
 * Defaults come from the project settings; the project's target map overrides
 * them and may add fields of its own.
 */
public record TargetConfig(Map<String, String> fields) {

    public TargetConfig {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static TargetConfig from(ProjectConfig config) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("name", "dev");
        fields.put("type", "snowflake");
        fields.put("account", "snowlite_local");
        fields.put("user", "dbt_user");
        fields.put("database", config.database());
        fields.put("schema", config.schema());
        fields.put("warehouse", config.warehouse());
        fields.put("role", config.role());
        fields.putAll(config.target());
        return new TargetConfig(fields);
    }

    /**
     * @return The field's value, or an empty string for an unknown field
     */
    public String field(String name) {
        return fields.getOrDefault(name, "");
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }
}
