package org.snowlite.engine.project;

import org.snowlite.engine.transpiler.DuckDBDialect;
import org.snowlite.engine.transpiler.SQLDialect;

/**
 * Builds the engine-side names of models, seeds, snapshots and source tables.
 */
public final class RelationNames {

    public static final RelationNames DUCKDB = new RelationNames(DuckDBDialect.INSTANCE);

    private final SQLDialect dialect;

    public RelationNames(SQLDialect dialect) {
        this.dialect = dialect;
    }

    public String of(String database, String schema, String relation) {
        return dialect.qualifiedName(database, schema, relation);
    }

    public String of(Model model) {
        return of(model.database(), model.schema(), model.relationName());
    }

    public String of(Seed seed) {
        return of(seed.database(), seed.schema(), seed.name());
    }

    public String of(Snapshot snapshot) {
        return of(snapshot.database(), snapshot.schema(), snapshot.name());
    }

    public String schemaOf(String database, String schema) {
        return dialect.physicalSchema(database, schema);
    }

    public SQLDialect dialect() {
        return dialect;
    }
}
