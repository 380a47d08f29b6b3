package org.snowlite.engine.run;

import org.snowlite.engine.execution.BufferedResult;
import org.snowlite.engine.execution.Column;
import org.snowlite.engine.execution.ExecutionBackend;
import org.snowlite.engine.execution.Row;
import org.snowlite.engine.execution.StatementResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend double that records every statement. Statements containing a
 * registered fragment fail, or answer with canned rows.
 */
class RecordingBackend implements ExecutionBackend {

    final List<String> statements = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();
    private final Map<String, BufferedResult> answers = new LinkedHashMap<>();

    RecordingBackend failWhen(String fragment, String error) {
        failures.put(fragment, error);
        return this;
    }

    RecordingBackend answer(String fragment, String column, Object... values) {
        List<Row> rows = new ArrayList<>();
        for (Object value : values) {
            List<Object> cells = new ArrayList<>();
            cells.add(value);
            rows.add(new Row(cells));
        }
        answers.put(fragment, new BufferedResult(List.of(new Column(column, "VARCHAR", "String")), rows));
        return this;
    }

    @Override
    public StatementResult execute(String sql) {
        statements.add(sql);
        for (Map.Entry<String, String> failure : failures.entrySet()) {
            if (sql.contains(failure.getKey())) {
                return StatementResult.failure(failure.getValue());
            }
        }
        for (Map.Entry<String, BufferedResult> answer : answers.entrySet()) {
            if (sql.contains(answer.getKey())) {
                return StatementResult.ofRows(answer.getValue());
            }
        }
        return sql.startsWith("SELECT") ? StatementResult.ofRows(BufferedResult.empty()) : StatementResult.ofUpdate(1);
    }
}
