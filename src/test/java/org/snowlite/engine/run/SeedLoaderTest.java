package org.snowlite.engine.run;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.snowlite.engine.project.RelationNames;
import org.snowlite.engine.project.Seed;
import org.snowlite.engine.project.SeedColumn;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Seed type inference, literal rendering and load statements.
 */
@DisplayName("Seed Loader Tests")
class SeedLoaderTest {

    private static final Instant NOW = Instant.parse("2024-03-01T08:30:00Z");

    private RecordingBackend backend;
    private FakeCatalog catalog;
    private SeedLoader loader;
    private final Seed seed = Seed.of("country_codes", "SNOWLITE", "PUBLIC", "seeds/country_codes.csv");

    @BeforeEach
    void setUp() {
        backend = new RecordingBackend();
        catalog = new FakeCatalog();
        loader = new SeedLoader(backend, catalog, RelationNames.DUCKDB, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SeedData data(List<String> header, String... rows) {
        List<List<String>> parsed = new ArrayList<>();
        for (String row : rows) {
            parsed.add(Arrays.asList(row.split(",", -1)));
        }
        return new SeedData(header, parsed);
    }

    // ==================== Type inference ====================

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "1;2;-3                | INTEGER",
            "1;3000000000          | BIGINT",
            "1.5;2;1e3             | DOUBLE",
            "true;FALSE            | BOOLEAN",
            "2024-01-01;2024-02-29 | TIMESTAMP",
            "2024-01-01 10:00:00   | TIMESTAMP",
            "01/31/2024            | TIMESTAMP",
            "1;abc                 | VARCHAR",
            "1.5d                  | VARCHAR"
    })
    @DisplayName("Column types follow the first type every value fits")
    void testTypeOf(String values, String expected) {
        assertEquals(expected, SeedTypeInference.typeOf(Arrays.asList(values.split(";"))));
    }

    @Test
    @DisplayName("0 and 1 alone are integers, not booleans")
    void testZeroOneIsInteger() {
        assertEquals("INTEGER", SeedTypeInference.typeOf(List.of("0", "1")));
        assertEquals("BOOLEAN", SeedTypeInference.typeOf(List.of("1", "true")));
    }

    @Test
    @DisplayName("Empty cells are ignored and an all-empty column is VARCHAR")
    void testInferSkipsEmpty() {
        SeedData data = data(List.of("id", " note ", "score"), "1,,", "2,,4.5", ",,");

        assertEquals(List.of(
                new SeedColumn("id", "INTEGER"),
                new SeedColumn("note", "VARCHAR"),
                new SeedColumn("score", "DOUBLE")), SeedTypeInference.infer(data));
    }

    // ==================== Literals ====================

    @Test
    @DisplayName("Literals render per column type")
    void testLiterals() {
        assertEquals("CAST('42' AS INTEGER)", SeedLoader.literal("42", "INTEGER"));
        assertEquals("CAST('1.5' AS DOUBLE)", SeedLoader.literal("1.5", "DOUBLE"));
        assertEquals("CAST('false' AS BOOLEAN)", SeedLoader.literal("false", "BOOLEAN"));
        assertEquals("STRPTIME('01/31/2024', '%m/%d/%Y')", SeedLoader.literal("01/31/2024", "TIMESTAMP"));
        assertEquals("CAST('2024-01-31 10:00:00' AS TIMESTAMP)", SeedLoader.literal("2024-01-31T10:00:00", "TIMESTAMP"));
        assertEquals("'O''Brien'", SeedLoader.literal("O'Brien", "VARCHAR"));
        assertEquals("NULL", SeedLoader.literal("", "INTEGER"));
    }

    @Test
    @DisplayName("Values that do not fit the column type stay quoted inside the cast")
    void testNonConformingLiterals() {
        assertEquals("CAST('O''Brien' AS INTEGER)", SeedLoader.literal("O'Brien", "INTEGER"));
        assertEquals("CAST('maybe' AS BOOLEAN)", SeedLoader.literal("maybe", "BOOLEAN"));
        assertEquals("CAST('2024-01-31 10:00:00''' AS TIMESTAMP)",
                SeedLoader.literal("2024-01-31 10:00:00'", "TIMESTAMP"));
    }

    @Test
    @DisplayName("A cell past the inference sample cannot break out of its insert")
    void testCellAfterSample() {
        String[] rows = new String[SeedTypeInference.SAMPLE_ROWS + 1];
        for (int i = 0; i < SeedTypeInference.SAMPLE_ROWS; i++) {
            rows[i] = String.valueOf(i);
        }
        rows[SeedTypeInference.SAMPLE_ROWS] = "1); DROP TABLE x; --";

        loader.load(seed, "seed.snowlite_project.country_codes", data(List.of("n"), rows), false);

        assertEquals(3, backend.statements.size());
        assertEquals("CREATE TABLE snowlite_public.COUNTRY_CODES (n INTEGER)", backend.statements.get(1));
        assertTrue(backend.statements.get(2).endsWith(", CAST('1); DROP TABLE x; --' AS INTEGER)"));
    }

    // ==================== Loading ====================

    @Test
    @DisplayName("A new seed creates its table and inserts the rows")
    void testFirstLoad() {
        SeedLoader.Loaded loaded = loader.load(seed, "seed.snowlite_project.country_codes",
                data(List.of("code", "name"), "US,United States", "FR,France"), false);

        assertEquals(List.of(
                "DROP TABLE IF EXISTS snowlite_public.COUNTRY_CODES",
                "CREATE TABLE snowlite_public.COUNTRY_CODES (code VARCHAR, name VARCHAR)",
                "INSERT INTO snowlite_public.COUNTRY_CODES VALUES ('US', 'United States'), ('FR', 'France')"),
                backend.statements);
        assertEquals(RunResult.Status.SUCCESS, loaded.result().status());
        assertEquals("Loaded 2 rows into country_codes", loaded.result().message());
        assertEquals(2, loaded.seed().rowsLoaded());
        assertEquals(NOW, loaded.seed().loadedAt());
        assertEquals(List.of("SNOWLITE.PUBLIC"), catalog.ensuredSchemas);
    }

    @Test
    @DisplayName("Reloading an existing seed replaces its rows")
    void testReload() {
        catalog.withTable("SNOWLITE", "PUBLIC", "country_codes");

        loader.load(seed, "seed.snowlite_project.country_codes", data(List.of("code"), "US"), false);

        assertEquals(List.of(
                "DELETE FROM snowlite_public.COUNTRY_CODES",
                "INSERT INTO snowlite_public.COUNTRY_CODES VALUES ('US')"), backend.statements);
    }

    @Test
    @DisplayName("Full refresh recreates an existing seed table")
    void testFullRefresh() {
        catalog.withTable("SNOWLITE", "PUBLIC", "country_codes");

        loader.load(seed, "seed.snowlite_project.country_codes", data(List.of("code"), "US"), true);

        assertEquals("DROP TABLE IF EXISTS snowlite_public.COUNTRY_CODES", backend.statements.get(0));
    }

    @Test
    @DisplayName("Rows are inserted in batches")
    void testBatches() {
        String[] rows = new String[SeedLoader.BATCH_SIZE + 1];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = String.valueOf(i);
        }

        loader.load(seed, "seed.snowlite_project.country_codes", data(List.of("n"), rows), false);

        assertEquals(4, backend.statements.size());
        assertTrue(backend.statements.get(3).endsWith("VALUES (CAST('500' AS INTEGER))"));
    }

    @Test
    @DisplayName("Empty seeds succeed without touching the engine")
    void testEmptySeed() {
        SeedLoader.Loaded loaded = loader.load(seed, "seed.snowlite_project.country_codes",
                new SeedData(List.of("code"), List.of()), false);

        assertTrue(backend.statements.isEmpty());
        assertEquals("Seed country_codes is empty", loaded.result().message());
    }

    @Test
    @DisplayName("A rejected insert fails the seed and leaves it unloaded")
    void testFailedInsert() {
        backend.failWhen("INSERT INTO", "Conversion Error");

        SeedLoader.Loaded loaded = loader.load(seed, "seed.snowlite_project.country_codes",
                data(List.of("code"), "US"), false);

        assertEquals(RunResult.Status.ERROR, loaded.result().status());
        assertEquals("Conversion Error", loaded.result().message());
        assertNull(loaded.seed().loadedAt());
    }
}
