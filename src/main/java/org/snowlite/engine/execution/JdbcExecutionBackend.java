package org.snowlite.engine.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Executes statements over a JDBC connection.
 */
public class JdbcExecutionBackend implements ExecutionBackend {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcExecutionBackend.class);

    private final Connection connection;

    public JdbcExecutionBackend(Connection connection) {
        this.connection = connection;
    }

    @Override
    public StatementResult execute(String sql) {
        LOG.debug("Executing: {}", sql);
        try (Statement stmt = connection.createStatement()) {
            if (stmt.execute(sql)) {
                try (ResultSet rs = stmt.getResultSet()) {
                    return StatementResult.ofRows(BufferedResult.fromResultSet(rs));
                }
            }
            return StatementResult.ofUpdate(stmt.getUpdateCount());
        } catch (SQLException e) {
            LOG.debug("Statement failed: {}", e.getMessage());
            return StatementResult.failure(e.getMessage());
        }
    }

    public Connection connection() {
        return connection;
    }
}
