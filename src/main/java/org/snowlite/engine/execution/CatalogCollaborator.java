package org.snowlite.engine.execution;

/**
 * Catalog lookups the run engines need, in warehouse terms (database, schema, relation).
 */
public interface CatalogCollaborator {

    boolean tableExists(String database, String schema, String table);

    /**
     * Creates the engine-side schema for {@code database.schema} if it is missing.
     */
    void ensureSchemaExists(String database, String schema);
}
