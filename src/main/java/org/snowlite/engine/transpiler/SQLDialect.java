package org.snowlite.engine.transpiler;

/**
 * Interface defining SQL dialect-specific behavior of the execution engine.
 * Implementations handle differences between database engines.
 */
public interface SQLDialect {

    /**
     * @return The dialect name (e.g., "DuckDB")
     */
    String name();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    String quoteStringLiteral(String value);

    /**
     * Format a boolean literal.
     *
     * @param value The boolean value
     * @return The SQL boolean representation
     */
    String formatBoolean(boolean value);

    /**
     * Format a NULL literal.
     *
     * @return The SQL NULL representation
     */
    default String formatNull() {
        return "NULL";
    }

    /**
     * Maps a warehouse {@code database.schema} pair onto the engine's schema name.
     *
     * @param database The warehouse database
     * @param schema   The warehouse schema
     * @return The schema name the engine stores the relation under
     */
    String physicalSchema(String database, String schema);

    /**
     * Builds the fully qualified, engine-side name of a relation.
     *
     * @param database The warehouse database
     * @param schema   The warehouse schema
     * @param relation The relation name (alias or model name)
     * @return e.g. {@code snowlite_public.STG_CUSTOMERS}
     */
    default String qualifiedName(String database, String schema, String relation) {
        return physicalSchema(database, schema) + "." + relation.toUpperCase();
    }
}
