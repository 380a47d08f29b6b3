package org.snowlite.engine.run;

import org.snowlite.engine.execution.ExecutionBackend;
import org.snowlite.engine.execution.StatementResult;
import org.snowlite.engine.sql.StatementSplitter;

import java.util.List;

/**
 * Sends statements to the backend in order, stopping at the first failure.
 */
final class StatementRunner {

    record Outcome(boolean success, long rowsAffected, String error) {}

    private final ExecutionBackend backend;

    StatementRunner(ExecutionBackend backend) {
        this.backend = backend;
    }

    /**
     * Each entry may hold more than one statement; it is split on {@code ;} first.
     */
    Outcome run(List<String> statements) {
        long rows = 0;
        List<String> split = statements.stream().flatMap(s -> StatementSplitter.split(s).stream()).toList();
        for (String statement : split) {
            StatementResult result = backend.execute(statement);
            if (!result.success()) {
                return new Outcome(false, rows, result.error());
            }
            rows += result.rowCount();
        }
        return new Outcome(true, rows, null);
    }

    StatementResult query(String sql) {
        return backend.execute(sql);
    }
}
