package org.snowlite.engine.materialization;

import org.snowlite.engine.sql.ArgumentSplitter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * How a model's compiled query becomes a relation. Each strategy renders the
 * statements for one build, in execution order.
 */
public sealed interface MaterializationStrategy {

    /**
     * @param target      Fully qualified relation name
     * @param compiledSql The model's query, already in the engine dialect
     */
    List<String> statements(String target, String compiledSql);

    /**
     * @return False for strategies that never touch the engine
     */
    default boolean executes() {
        return true;
    }

    record View() implements MaterializationStrategy {
        @Override
        public List<String> statements(String target, String compiledSql) {
            return List.of("CREATE OR REPLACE VIEW " + target + " AS " + compiledSql);
        }
    }

    /**
     * Drop then create. Some engines reject {@code CREATE OR REPLACE TABLE ... AS},
     * so the pair is always two statements.
     */
    record Table() implements MaterializationStrategy {
        @Override
        public List<String> statements(String target, String compiledSql) {
            return List.of(
                    "DROP TABLE IF EXISTS " + target,
                    "CREATE TABLE " + target + " AS " + compiledSql);
        }
    }

    /**
     * Adds the query's rows to an existing table. With a unique key, rows whose key
     * reappears are deleted first so the insert replaces them. A composite key
     * matches rows on every key column.
     *
     * @param uniqueKey Key columns, empty for a plain append
     */
    record Incremental(List<String> uniqueKey) implements MaterializationStrategy {

        public Incremental {
            uniqueKey = uniqueKey == null ? List.of() : List.copyOf(uniqueKey);
        }

        @Override
        public List<String> statements(String target, String compiledSql) {
            String insert = "INSERT INTO " + target + " " + compiledSql;
            if (uniqueKey.isEmpty()) {
                return List.of(insert);
            }
            String source = ArgumentSplitter.parenthesize(compiledSql) + " src";
            if (uniqueKey.size() == 1) {
                String key = uniqueKey.get(0);
                return List.of(
                        "DELETE FROM " + target + " WHERE " + key + " IN (SELECT " + key + " FROM " + source + ")",
                        insert);
            }
            String matches = uniqueKey.stream()
                    .map(c -> "tgt." + c + " = src." + c)
                    .collect(Collectors.joining(" AND "));
            return List.of(
                    "DELETE FROM " + target + " AS tgt WHERE EXISTS (SELECT 1 FROM " + source + " WHERE " + matches + ")",
                    insert);
        }
    }

    /**
     * Ephemeral models are inlined into their dependents and never built.
     */
    record Ephemeral() implements MaterializationStrategy {
        @Override
        public List<String> statements(String target, String compiledSql) {
            return List.of();
        }

        @Override
        public boolean executes() {
            return false;
        }
    }

    static String requireSql(String compiledSql) {
        return Objects.requireNonNull(compiledSql, "Compiled SQL cannot be null");
    }
}
