package org.snowlite.engine.execution;

import java.util.List;

/**
 * Outcome of one statement sent to an {@link ExecutionBackend}.
 *
 * @param success  False when the backend rejected the statement
 * @param result   Rows returned by a query; empty for DDL and DML
 * @param rowCount Rows returned by a query, or rows affected by DML
 * @param error    The backend's message when {@code success} is false, else null
 */
public record StatementResult(boolean success, BufferedResult result, long rowCount, String error) {

    public StatementResult {
        result = result == null ? BufferedResult.empty() : result;
    }

    public static StatementResult ofRows(BufferedResult result) {
        return new StatementResult(true, result, result.rowCount(), null);
    }

    public static StatementResult ofUpdate(long affected) {
        return new StatementResult(true, BufferedResult.empty(), Math.max(0, affected), null);
    }

    public static StatementResult failure(String error) {
        return new StatementResult(false, BufferedResult.empty(), 0, error == null ? "Unknown error" : error);
    }

    public List<String> columns() {
        return result.columnNames();
    }

    public List<Row> data() {
        return result.rows();
    }
}
