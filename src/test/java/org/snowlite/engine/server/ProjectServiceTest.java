package org.snowlite.engine.server;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.snowlite.engine.execution.CatalogCollaborator;
import org.snowlite.engine.execution.ExecutionBackend;
import org.snowlite.engine.execution.StatementResult;
import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.ProjectConfig;
import org.snowlite.engine.project.RunStatus;
import org.snowlite.engine.run.RunOptions;
import org.snowlite.engine.run.RunResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Project service behaviour over backend and catalog doubles: merging run state
 * into the registry and compile previews.
 */
@DisplayName("Project Service Tests")
class ProjectServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static final String INCREMENTAL = """
            {{ config(materialized='incremental') }}
            SELECT * FROM src{% if is_incremental() %} WHERE id > 5{% endif %}""";

    private final List<String> statements = new ArrayList<>();
    private final Set<String> tables = new HashSet<>();

    private final CatalogCollaborator catalog = new CatalogCollaborator() {
        @Override
        public boolean tableExists(String database, String schema, String table) {
            return tables.contains(table.toUpperCase(Locale.ROOT));
        }

        @Override
        public void ensureSchemaExists(String database, String schema) {
        }
    };

    private ProjectService service(ProjectConfig config, ExecutionBackend backend) {
        return new ProjectService(config, backend, catalog, Clock.fixed(NOW, ZoneOffset.UTC),
                Map.<String, String>of()::get);
    }

    /**
     * A service whose backend runs {@code onFirstStatement} against the service
     * while the first statement of a run executes.
     */
    private ProjectService serviceWith(Consumer<ProjectService> onFirstStatement) {
        List<ProjectService> holder = new ArrayList<>();
        ProjectService service = service(ProjectConfig.defaults(), sql -> {
            statements.add(sql);
            if (statements.size() == 1) {
                onFirstStatement.accept(holder.get(0));
            }
            return StatementResult.ofUpdate(1);
        });
        holder.add(service);
        return service;
    }

    // ==================== Run state ====================

    @Test
    @DisplayName("A finished run records its state on the registered model")
    void testRunStateMerged() {
        ProjectService service = serviceWith(s -> { });
        service.registerModel("a", "SELECT 1 AS v");

        service.run(RunOptions.defaults());

        Model a = service.context().model("a").orElseThrow();
        assertEquals(RunStatus.SUCCESS, a.status());
        assertEquals("SELECT 1 AS v", a.compiledSql());
        assertEquals(NOW, a.lastRunAt());
        assertEquals(1, a.rowsAffected());
    }

    @Test
    @DisplayName("A model re-registered during a run keeps its new SQL")
    void testReRegisteredDuringRun() {
        ProjectService service = serviceWith(s -> s.registerModel("a", "SELECT 2 AS v"));
        service.registerModel("a", "SELECT 1 AS v");

        List<RunResult> results = service.run(RunOptions.defaults());

        assertEquals(RunResult.Status.SUCCESS, results.get(0).status());
        Model a = service.context().model("a").orElseThrow();
        assertEquals("SELECT 2 AS v", a.sql());
        assertEquals(RunStatus.PENDING, a.status());
        assertEquals("", a.compiledSql());
    }

    @Test
    @DisplayName("A model removed during a run stays removed")
    void testRemovedDuringRun() {
        ProjectService service = serviceWith(s -> s.removeModel("a"));
        service.registerModel("a", "SELECT 1 AS v");

        service.run(RunOptions.defaults());

        assertTrue(service.context().model("a").isEmpty());
    }

    // ==================== Compile preview ====================

    @Test
    @DisplayName("The preview of a new incremental model matches its first build")
    void testPreviewFirstBuild() {
        ProjectService service = service(ProjectConfig.defaults(), sql -> {
            statements.add(sql);
            return StatementResult.ofUpdate(1);
        });
        service.registerModel("inc", INCREMENTAL);

        String preview = service.compileModel("inc").orElseThrow();
        service.run(RunOptions.defaults());

        assertEquals("SELECT * FROM src", preview);
        assertEquals("CREATE TABLE snowlite_public.INC AS " + preview, statements.get(statements.size() - 1));
    }

    @Test
    @DisplayName("The preview of an existing incremental model includes the incremental filter")
    void testPreviewIncrementalBuild() {
        ProjectService service = service(ProjectConfig.defaults(), sql -> StatementResult.ofUpdate(1));
        service.registerModel("inc", INCREMENTAL);
        tables.add("INC");

        assertEquals("SELECT * FROM src WHERE id > 5", service.compileModel("inc").orElseThrow());
    }

    @Test
    @DisplayName("A project set to full refresh previews the rebuild")
    void testPreviewFullRefresh() {
        ProjectConfig config = ProjectConfig.builder().fullRefresh(true).build();
        ProjectService service = service(config, sql -> StatementResult.ofUpdate(1));
        service.registerModel("inc", INCREMENTAL);
        tables.add("INC");

        assertEquals("SELECT * FROM src", service.compileModel("inc").orElseThrow());
        assertTrue(service.compileModel("missing").isEmpty());
    }
}
