package org.snowlite.engine.server;

import org.snowlite.engine.project.ColumnDoc;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.Source;
import org.snowlite.engine.project.SourceTable;
import org.snowlite.engine.project.TestDeclaration;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the documentation manifest: project metadata, every model keyed by
 * unique id and every source table keyed by {@code source.<project>.<source>.<table>}.
 */
public final class ManifestGenerator {

    static final String DBT_VERSION = "1.7.0";
    static final String ADAPTER = "snowlite";

    public Map<String, Object> generate(CompileContext ctx, Instant generatedAt) {
        String project = ctx.config().projectName();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("project_id", project);
        metadata.put("generated_at", generatedAt.toString());
        metadata.put("dbt_version", DBT_VERSION);
        metadata.put("adapter", ADAPTER);

        Map<String, Object> nodes = new LinkedHashMap<>();
        for (Model model : ctx.models().values()) {
            nodes.put(model.uniqueId(), node(model));
        }

        Map<String, Object> sources = new LinkedHashMap<>();
        for (Source source : ctx.sources().values()) {
            for (SourceTable table : source.tables()) {
                String id = "source." + project + "." + source.name() + "." + table.name();
                sources.put(id, sourceNode(id, source, table));
            }
        }

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("metadata", metadata);
        manifest.put("nodes", nodes);
        manifest.put("sources", sources);
        manifest.put("metrics", Map.of());
        manifest.put("exposures", Map.of());
        return manifest;
    }

    private static Map<String, Object> node(Model model) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("unique_id", model.uniqueId());
        node.put("name", model.name());
        node.put("database", model.database());
        node.put("schema", model.schema());
        node.put("alias", model.alias());
        node.put("description", model.description());
        node.put("columns", columns(model.columns()));
        node.put("meta", model.meta());
        node.put("tags", model.tags());
        node.put("depends_on", model.dependsOn());
        node.put("compiled_sql", model.compiledSql());
        node.put("resource_type", "model");
        node.put("materialization", model.materialization().value());
        return node;
    }

    private static Map<String, Object> sourceNode(String id, Source source, SourceTable table) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("unique_id", id);
        node.put("source_name", source.name());
        node.put("name", table.name());
        node.put("identifier", table.physicalName());
        node.put("database", source.database());
        node.put("schema", source.schema());
        node.put("description", table.description().isEmpty() ? source.description() : table.description());
        node.put("loader", source.loader());
        node.put("columns", columns(table.columns()));
        return node;
    }

    private static Map<String, Object> columns(List<ColumnDoc> columns) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (ColumnDoc column : columns) {
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("name", column.name());
            doc.put("description", column.description());
            if (column.dataType() != null) {
                doc.put("data_type", column.dataType());
            }
            doc.put("tests", column.tests().stream().map(TestDeclaration::kind).toList());
            out.put(column.name(), doc);
        }
        return out;
    }
}
