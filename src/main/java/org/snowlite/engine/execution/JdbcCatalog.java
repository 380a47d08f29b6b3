package org.snowlite.engine.execution;

import org.snowlite.engine.project.RelationNames;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Answers catalog questions from DuckDB's {@code information_schema}.
 *
 * Warehouse names map to engine schemas through {@link RelationNames}; lookups
 * ignore case.
 */
public class JdbcCatalog implements CatalogCollaborator {

    private static final String TABLE_EXISTS = """
            SELECT COUNT(*) FROM information_schema.tables
            WHERE lower(table_schema) = lower(?) AND lower(table_name) = lower(?)
            """;

    private final Connection connection;
    private final RelationNames names;

    public JdbcCatalog(Connection connection) {
        this(connection, RelationNames.DUCKDB);
    }

    public JdbcCatalog(Connection connection, RelationNames names) {
        this.connection = connection;
        this.names = names;
    }

    @Override
    public boolean tableExists(String database, String schema, String table) {
        try (PreparedStatement ps = connection.prepareStatement(TABLE_EXISTS)) {
            ps.setString(1, names.schemaOf(database, schema));
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            throw new ExecutionException("Cannot read catalog for " + database + "." + schema + "." + table, e);
        }
    }

    @Override
    public void ensureSchemaExists(String database, String schema) {
        String physical = names.schemaOf(database, schema);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE SCHEMA IF NOT EXISTS " + physical);
        } catch (SQLException e) {
            throw new ExecutionException("Cannot create schema " + physical, e);
        }
    }
}
