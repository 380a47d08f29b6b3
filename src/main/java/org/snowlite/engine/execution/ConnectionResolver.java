package org.snowlite.engine.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens DuckDB connections from JDBC URLs. Each call opens a new connection, and
 * an in-memory database lives only as long as its connection.
 */
public class ConnectionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionResolver.class);

    static {
        try {
            Class.forName("org.duckdb.DuckDBDriver");
        } catch (ClassNotFoundException e) {
            LOG.warn("DuckDB driver not found in classpath");
        }
    }

    /**
     * @param jdbcUrl A DuckDB URL: {@code jdbc:duckdb:} for in-memory, else {@code jdbc:duckdb:<path>}
     */
    public Connection resolve(String jdbcUrl) {
        try {
            LOG.debug("Opening {}", jdbcUrl);
            return DriverManager.getConnection(jdbcUrl);
        } catch (SQLException e) {
            throw new ExecutionException("Cannot connect to " + jdbcUrl, e);
        }
    }
}
