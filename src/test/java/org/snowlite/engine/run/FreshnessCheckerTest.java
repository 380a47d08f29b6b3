package org.snowlite.engine.run;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.FreshnessPolicy;
import org.snowlite.engine.project.ProjectConfig;
import org.snowlite.engine.project.RelationNames;
import org.snowlite.engine.project.Source;
import org.snowlite.engine.project.SourceTable;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Freshness Checker Tests")
class FreshnessCheckerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private RecordingBackend backend;
    private FreshnessChecker checker;

    @BeforeEach
    void setUp() {
        backend = new RecordingBackend();
        checker = new FreshnessChecker(backend, RelationNames.DUCKDB, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CompileContext withSource(Source source) {
        return CompileContext.empty(ProjectConfig.defaults()).withSource(source);
    }

    private static Source raw(FreshnessPolicy policy, SourceTable... tables) {
        return new Source("raw", "SNOWLITE", "RAW", List.of(tables), "", "", policy, Map.of());
    }

    private static final FreshnessPolicy POLICY =
            new FreshnessPolicy("_loaded_at", Duration.ofHours(12), Duration.ofHours(24));

    // ==================== Thresholds ====================

    @Test
    @DisplayName("Recent loads pass")
    void testPass() {
        backend.answer("ORDERS", "max", "2024-06-01 09:00:00");

        List<FreshnessResult> results = checker.check(withSource(raw(POLICY, SourceTable.of("orders"))), null);

        assertEquals(List.of("SELECT MAX(_loaded_at) FROM snowlite_raw.ORDERS"), backend.statements);
        FreshnessResult result = results.get(0);
        assertEquals(FreshnessResult.Status.PASS, result.status());
        assertEquals(Instant.parse("2024-06-01T09:00:00Z"), result.maxLoadedAt());
        assertEquals(Duration.ofHours(3), result.age());
        assertEquals("source.snowlite_project.raw.orders", result.uniqueId("snowlite_project"));
    }

    @Test
    @DisplayName("Loads past warn_after warn and past error_after fail")
    void testThresholds() {
        backend.answer("ORDERS", "max", "2024-05-31T20:00:00")
                .answer("CUSTOMERS", "max", "2024-05-30T12:00:00");

        List<FreshnessResult> results = checker.check(
                withSource(raw(POLICY, SourceTable.of("orders"), SourceTable.of("customers"))), List.of());

        assertEquals(FreshnessResult.Status.WARN, results.get(0).status());
        assertEquals(FreshnessResult.Status.ERROR, results.get(1).status());
    }

    @Test
    @DisplayName("A table policy overrides the source's and tables without one are skipped")
    void testPolicyResolution() {
        FreshnessPolicy strict = new FreshnessPolicy("synced_at", null, Duration.ofMinutes(30));
        SourceTable events = new SourceTable("events", "EVENT_LOG", "", List.of(), strict);
        backend.answer("EVENT_LOG", "max", "2024-06-01 11:00:00");

        List<FreshnessResult> results = checker.check(withSource(raw(null, events, SourceTable.of("orders"))), null);

        assertEquals(1, results.size());
        assertEquals(List.of("SELECT MAX(synced_at) FROM snowlite_raw.EVENT_LOG"), backend.statements);
        assertEquals(FreshnessResult.Status.ERROR, results.get(0).status());
    }

    // ==================== Errors ====================

    @Test
    @DisplayName("An empty table or a failed query is an error")
    void testErrors() {
        backend.answer("ORDERS", "max", (Object) null)
                .failWhen("CUSTOMERS", "Table with name CUSTOMERS does not exist!");

        List<FreshnessResult> results = checker.check(
                withSource(raw(POLICY, SourceTable.of("orders"), SourceTable.of("customers"))), null);

        assertEquals("No _loaded_at values in snowlite_raw.ORDERS", results.get(0).message());
        assertEquals(FreshnessResult.Status.ERROR, results.get(1).status());
        assertEquals("Table with name CUSTOMERS does not exist!", results.get(1).message());
    }

    @Test
    @DisplayName("Sources outside the selection are not checked")
    void testSelection() {
        assertTrue(checker.check(withSource(raw(POLICY, SourceTable.of("orders"))), List.of("stripe")).isEmpty());
        assertTrue(backend.statements.isEmpty());
    }

    // ==================== Timestamp conversion ====================

    @Test
    @DisplayName("Zone-less engine values are read as UTC")
    void testToInstant() {
        Instant expected = Instant.parse("2024-06-01T09:00:00Z");
        assertEquals(expected, FreshnessChecker.toInstant(LocalDateTime.of(2024, 6, 1, 9, 0)));
        assertEquals(expected, FreshnessChecker.toInstant(Timestamp.valueOf(LocalDateTime.of(2024, 6, 1, 9, 0))));
        assertEquals(expected, FreshnessChecker.toInstant("2024-06-01T11:00:00+02:00"));
        assertEquals(Instant.parse("2024-06-01T00:00:00Z"), FreshnessChecker.toInstant(LocalDate.of(2024, 6, 1)));
        assertNull(FreshnessChecker.toInstant("not a timestamp"));
        assertNull(FreshnessChecker.toInstant(null));
    }

    @Test
    @DisplayName("Threshold periods accept minutes, hours and days")
    void testPeriod() {
        assertEquals(Duration.ofMinutes(15), FreshnessPolicy.period(15, "minute"));
        assertEquals(Duration.ofDays(2), FreshnessPolicy.period(2, "days"));
        assertEquals(Duration.ofHours(6), FreshnessPolicy.period(6, "hour"));
        assertEquals(Duration.ofHours(6), FreshnessPolicy.period(6, null));
    }
}
