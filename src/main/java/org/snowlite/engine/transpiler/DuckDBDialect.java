package org.snowlite.engine.transpiler;

import java.util.Locale;

/**
 * SQL dialect implementation for DuckDB.
 * DuckDB uses double quotes for identifiers and single quotes for strings.
 *
 * DuckDB has a single schema level under its catalog, so the warehouse's
 * {@code DATABASE.SCHEMA} pair collapses into one schema named
 * {@code database_schema} in lower case.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    private DuckDBDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "DuckDB";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        // Escape any existing double quotes by doubling them
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String quoteStringLiteral(String value) {
        // Escape any existing single quotes by doubling them
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    public String physicalSchema(String database, String schema) {
        return database.toLowerCase(Locale.ROOT) + "_" + schema.toLowerCase(Locale.ROOT);
    }
}
