package org.snowlite.engine.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.execution.CatalogCollaborator;
import org.snowlite.engine.execution.ExecutionBackend;
import org.snowlite.engine.project.RelationNames;
import org.snowlite.engine.project.Seed;
import org.snowlite.engine.project.SeedColumn;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads seed rows into a table.
 *
 * The table is (re)created from the inferred column types when it is missing or on
 * full refresh; otherwise its rows are replaced. Rows are inserted in batches.
 */
public class SeedLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SeedLoader.class);

    static final int BATCH_SIZE = 500;

    /**
     * The seed with its load recorded, and the run result.
     */
    public record Loaded(Seed seed, RunResult result) {}

    private final CatalogCollaborator catalog;
    private final RelationNames names;
    private final StatementRunner runner;
    private final Clock clock;

    public SeedLoader(ExecutionBackend backend, CatalogCollaborator catalog) {
        this(backend, catalog, RelationNames.DUCKDB, Clock.systemUTC());
    }

    public SeedLoader(ExecutionBackend backend, CatalogCollaborator catalog, RelationNames names, Clock clock) {
        this.catalog = catalog;
        this.names = names;
        this.runner = new StatementRunner(backend);
        this.clock = clock;
    }

    public Loaded load(Seed seed, String uniqueId, SeedData data, boolean fullRefresh) {
        long start = System.nanoTime();
        if (data == null || data.isEmpty()) {
            return new Loaded(seed, RunResult.success(uniqueId, seed.name(), "Seed " + seed.name() + " is empty", 0));
        }
        try {
            List<SeedColumn> columns = SeedTypeInference.infer(data);
            String target = names.of(seed);
            catalog.ensureSchemaExists(seed.database(), seed.schema());

            List<String> statements = new ArrayList<>();
            if (fullRefresh || !catalog.tableExists(seed.database(), seed.schema(), seed.name())) {
                statements.add("DROP TABLE IF EXISTS " + target);
                statements.add("CREATE TABLE " + target + " (" + columns.stream()
                        .map(c -> c.name() + " " + c.type())
                        .collect(Collectors.joining(", ")) + ")");
            } else {
                statements.add("DELETE FROM " + target);
            }
            statements.addAll(inserts(target, columns, data));

            StatementRunner.Outcome outcome = runner.run(statements);
            if (!outcome.success()) {
                LOG.error("Seed {} failed: {}", seed.name(), outcome.error());
                return new Loaded(seed, RunResult.error(uniqueId, seed.name(), outcome.error(), SnapshotEngine.elapsed(start)));
            }
            int rows = data.rows().size();
            return new Loaded(seed.withLoad(columns, rows, Instant.now(clock)),
                    RunResult.success(uniqueId, seed.name(), "Loaded " + rows + " rows into " + seed.name(),
                            SnapshotEngine.elapsed(start)));
        } catch (RuntimeException e) {
            LOG.error("Seed {} failed: {}", seed.name(), e.getMessage());
            return new Loaded(seed, RunResult.error(uniqueId, seed.name(), e.getMessage(), SnapshotEngine.elapsed(start)));
        }
    }

    private static List<String> inserts(String target, List<SeedColumn> columns, SeedData data) {
        List<String> statements = new ArrayList<>();
        for (int from = 0; from < data.rows().size(); from += BATCH_SIZE) {
            int to = Math.min(from + BATCH_SIZE, data.rows().size());
            List<String> tuples = new ArrayList<>();
            for (int r = from; r < to; r++) {
                List<String> values = new ArrayList<>();
                for (int c = 0; c < columns.size(); c++) {
                    values.add(literal(data.cell(r, c).trim(), columns.get(c).type()));
                }
                tuples.add("(" + String.join(", ", values) + ")");
            }
            statements.add("INSERT INTO " + target + " VALUES " + String.join(", ", tuples));
        }
        return statements;
    }

    /**
     * Every value is a quoted string cast to the column type, so a cell that does
     * not fit the inferred type fails the load instead of changing the statement.
     */
    static String literal(String value, String type) {
        if (value.isEmpty()) {
            return "NULL";
        }
        return switch (type) {
            case "VARCHAR" -> quote(value);
            case "TIMESTAMP" -> SeedTypeInference.US_DATE.matcher(value).matches()
                    ? "STRPTIME(" + quote(value) + ", '%m/%d/%Y')"
                    : "CAST(" + quote(value.replace('T', ' ')) + " AS TIMESTAMP)";
            default -> "CAST(" + quote(value) + " AS " + type + ")";
        };
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
