package org.snowlite.engine.project;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Project-wide settings: naming defaults, variables and target overrides.
 *
 * Built with {@link #builder()} or read from properties:
 * <pre>
 * snowlite.project.name=shop
 * snowlite.database=ANALYTICS
 * snowlite.schema=PUBLIC
 * snowlite.warehouse=COMPUTE_WH
 * snowlite.role=ACCOUNTADMIN
 * snowlite.jdbc.url=jdbc:duckdb:
 * snowlite.full-refresh=false
 * snowlite.var.start_date=2024-01-01
 * snowlite.target.name=ci
 * </pre>
 */
public record ProjectConfig(
        String projectName,
        String database,
        String schema,
        String warehouse,
        String role,
        Map<String, Object> vars,
        Map<String, String> target,
        boolean fullRefresh,
        String jdbcUrl) {

    public static final String PREFIX = "snowlite.";

    public ProjectConfig {
        Objects.requireNonNull(projectName, "Project name cannot be null");
        Objects.requireNonNull(database, "Database cannot be null");
        Objects.requireNonNull(schema, "Schema cannot be null");
        vars = vars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(vars));
        target = target == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(target));
    }

    public static ProjectConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .projectName(projectName)
                .database(database)
                .schema(schema)
                .warehouse(warehouse)
                .role(role)
                .vars(vars)
                .target(target)
                .fullRefresh(fullRefresh)
                .jdbcUrl(jdbcUrl);
    }

    public ProjectConfig withVar(String name, Object value) {
        return toBuilder().var(name, value).build();
    }

    // ==================== Loading ====================

    /**
     * Reads {@code snowlite.*} keys; anything missing keeps its default.
     * Variable values are typed: integers, decimals and {@code true}/{@code false}
     * become numbers and booleans, everything else stays a string.
     */
    public static ProjectConfig fromProperties(Properties props) {
        Builder b = builder();
        String name = props.getProperty(PREFIX + "project.name");
        if (name != null) b.projectName(name.trim());
        String database = props.getProperty(PREFIX + "database");
        if (database != null) b.database(database.trim());
        String schema = props.getProperty(PREFIX + "schema");
        if (schema != null) b.schema(schema.trim());
        String warehouse = props.getProperty(PREFIX + "warehouse");
        if (warehouse != null) b.warehouse(warehouse.trim());
        String role = props.getProperty(PREFIX + "role");
        if (role != null) b.role(role.trim());
        String jdbcUrl = props.getProperty(PREFIX + "jdbc.url");
        if (jdbcUrl != null) b.jdbcUrl(jdbcUrl.trim());
        String fullRefresh = props.getProperty(PREFIX + "full-refresh");
        if (fullRefresh != null) b.fullRefresh(Boolean.parseBoolean(fullRefresh.trim()));

        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(PREFIX + "var.")) {
                b.var(key.substring((PREFIX + "var.").length()), typed(props.getProperty(key).trim()));
            } else if (key.startsWith(PREFIX + "target.")) {
                b.targetField(key.substring((PREFIX + "target.").length()), props.getProperty(key).trim());
            }
        }
        return b.build();
    }

    /**
     * Loads a properties file from the classpath.
     *
     * @throws IllegalArgumentException if the resource does not exist
     * @throws UncheckedIOException     if it cannot be read
     */
    public static ProjectConfig load(String resource) {
        try (InputStream in = ProjectConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Project configuration not found on classpath: " + resource);
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read project configuration: " + resource, e);
        }
    }

    static Object typed(String value) {
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(value);
        }
        if (value.matches("-?\\d{1,18}")) {
            return Long.parseLong(value);
        }
        if (value.matches("-?\\d+\\.\\d+")) {
            return Double.parseDouble(value);
        }
        return value;
    }

    // ==================== Builder ====================

    public static final class Builder {
        private String projectName = "snowlite_project";
        private String database = "SNOWLITE";
        private String schema = "PUBLIC";
        private String warehouse = "COMPUTE_WH";
        private String role = "ACCOUNTADMIN";
        private final Map<String, Object> vars = new LinkedHashMap<>();
        private final Map<String, String> target = new LinkedHashMap<>();
        private boolean fullRefresh;
        private String jdbcUrl = "jdbc:duckdb:";

        private Builder() {
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder warehouse(String warehouse) {
            this.warehouse = warehouse;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder vars(Map<String, Object> vars) {
            this.vars.clear();
            this.vars.putAll(vars);
            return this;
        }

        public Builder var(String name, Object value) {
            this.vars.put(name, value);
            return this;
        }

        public Builder target(Map<String, String> target) {
            this.target.clear();
            this.target.putAll(target);
            return this;
        }

        public Builder targetField(String field, String value) {
            this.target.put(field, value);
            return this;
        }

        public Builder fullRefresh(boolean fullRefresh) {
            this.fullRefresh = fullRefresh;
            return this;
        }

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public ProjectConfig build() {
            return new ProjectConfig(projectName, database, schema, warehouse, role, vars, target,
                    fullRefresh, jdbcUrl);
        }
    }
}
