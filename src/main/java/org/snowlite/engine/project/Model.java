package org.snowlite.engine.project;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named unit of SQL that materializes into a relation.
 *
 * Immutable. The run state ({@code status}, {@code error}, {@code lastRunAt},
 * {@code executionTimeMs}, {@code rowsAffected}) and the derived fields
 * ({@code compiledSql}, {@code dependsOn}) are replaced wholesale on every run
 * via {@link #toBuilder()}.
 */
public record Model(
        String name,
        String database,
        String schema,
        String alias,
        MaterializationKind materialization,
        String sql,
        String compiledSql,
        String uniqueId,
        List<String> dependsOn,
        List<ColumnDoc> columns,
        Map<String, Object> meta,
        List<String> tags,
        String description,
        RunStatus status,
        String error,
        Instant lastRunAt,
        double executionTimeMs,
        long rowsAffected) {

    public Model {
        Objects.requireNonNull(name, "Model name cannot be null");
        Objects.requireNonNull(database, "Model database cannot be null");
        Objects.requireNonNull(schema, "Model schema cannot be null");
        materialization = materialization == null ? MaterializationKind.VIEW : materialization;
        sql = sql == null ? "" : sql;
        compiledSql = compiledSql == null ? "" : compiledSql;
        uniqueId = uniqueId == null ? "model." + name : uniqueId;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        columns = columns == null ? List.of() : List.copyOf(columns);
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        tags = tags == null ? List.of() : List.copyOf(tags);
        description = description == null ? "" : description;
        status = status == null ? RunStatus.PENDING : status;
    }

    /**
     * @return The relation name: alias if set, else the model name
     */
    public String relationName() {
        return alias != null && !alias.isBlank() ? alias : name;
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public Object metaValue(String key) {
        return meta.get(key);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        return new Builder(name)
                .database(database)
                .schema(schema)
                .alias(alias)
                .materialization(materialization)
                .sql(sql)
                .compiledSql(compiledSql)
                .uniqueId(uniqueId)
                .dependsOn(dependsOn)
                .columns(columns)
                .meta(meta)
                .tags(tags)
                .description(description)
                .status(status)
                .error(error)
                .lastRunAt(lastRunAt)
                .executionTimeMs(executionTimeMs)
                .rowsAffected(rowsAffected);
    }

    // ==================== Builder ====================

    public static final class Builder {
        private final String name;
        private String database = "SNOWLITE";
        private String schema = "PUBLIC";
        private String alias;
        private MaterializationKind materialization = MaterializationKind.VIEW;
        private String sql = "";
        private String compiledSql = "";
        private String uniqueId;
        private List<String> dependsOn = new ArrayList<>();
        private List<ColumnDoc> columns = new ArrayList<>();
        private Map<String, Object> meta = new LinkedHashMap<>();
        private List<String> tags = new ArrayList<>();
        private String description = "";
        private RunStatus status = RunStatus.PENDING;
        private String error;
        private Instant lastRunAt;
        private double executionTimeMs;
        private long rowsAffected;

        private Builder(String name) {
            this.name = name;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder materialization(MaterializationKind materialization) {
            this.materialization = materialization;
            return this;
        }

        public Builder sql(String sql) {
            this.sql = sql;
            return this;
        }

        public Builder compiledSql(String compiledSql) {
            this.compiledSql = compiledSql;
            return this;
        }

        public Builder uniqueId(String uniqueId) {
            this.uniqueId = uniqueId;
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = new ArrayList<>(dependsOn);
            return this;
        }

        public Builder columns(List<ColumnDoc> columns) {
            this.columns = new ArrayList<>(columns);
            return this;
        }

        public Builder meta(Map<String, Object> meta) {
            this.meta = new LinkedHashMap<>(meta);
            return this;
        }

        public Builder putMeta(String key, Object value) {
            this.meta.put(key, value);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder executionTimeMs(double executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public Builder rowsAffected(long rowsAffected) {
            this.rowsAffected = rowsAffected;
            return this;
        }

        public Model build() {
            return new Model(name, database, schema, alias, materialization, sql, compiledSql, uniqueId,
                    dependsOn, columns, meta, tags, description, status, error, lastRunAt,
                    executionTimeMs, rowsAffected);
        }
    }
}
