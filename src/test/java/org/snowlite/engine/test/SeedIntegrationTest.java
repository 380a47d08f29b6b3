package org.snowlite.engine.test;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.snowlite.engine.project.Seed;
import org.snowlite.engine.project.SeedColumn;
import org.snowlite.engine.run.RunOptions;
import org.snowlite.engine.run.RunResult;
import org.snowlite.engine.run.SeedData;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Seed Integration Tests - DuckDB")
class SeedIntegrationTest extends AbstractDatabaseTest {

    private static final Seed COUNTRIES = Seed.of("country_codes", "SNOWLITE", "PUBLIC", "seeds/country_codes.csv");

    private static final SeedData DATA = new SeedData(
            List.of("code", "name", "population", "eu", "joined"),
            List.of(
                    List.of("FR", "France", "68000000", "true", "1958-01-01"),
                    List.of("DE", "Germany", "84000000", "true", "1958-01-01"),
                    List.of("NO", "Norway", "5500000", "false", "")));

    private String columnType(String column) throws SQLException {
        return queryStrings("SELECT data_type FROM information_schema.columns "
                + "WHERE table_schema = 'snowlite_public' AND lower(table_name) = 'country_codes' "
                + "AND column_name = '" + column + "'").get(0);
    }

    @Test
    @DisplayName("Seeds load with inferred column types")
    void testLoad() throws SQLException {
        service.registerSeed(COUNTRIES, DATA);

        List<RunResult> results = service.seed(null, false);

        assertEquals(RunResult.Status.SUCCESS, results.get(0).status());
        assertEquals("seed.jaffle_shop.country_codes", results.get(0).uniqueId());
        assertEquals("Loaded 3 rows into country_codes", results.get(0).message());
        assertEquals(3, queryLong("SELECT COUNT(*) FROM snowlite_public.COUNTRY_CODES"));
        assertEquals("VARCHAR", columnType("name"));
        assertEquals("INTEGER", columnType("population"));
        assertEquals("BOOLEAN", columnType("eu"));
        assertEquals("TIMESTAMP", columnType("joined"));
        assertEquals(1, queryLong("SELECT COUNT(*) FROM snowlite_public.COUNTRY_CODES WHERE joined IS NULL"));

        Seed loaded = service.context().seed("country_codes").orElseThrow();
        assertEquals(3, loaded.rowsLoaded());
        assertEquals(NOW, loaded.loadedAt());
        assertEquals(new SeedColumn("eu", "BOOLEAN"), loaded.columns().get(3));
    }

    @Test
    @DisplayName("Reloading replaces the rows and models can ref a seed")
    void testReloadAndRef() throws SQLException {
        service.registerSeed(COUNTRIES, DATA);
        service.seed(null, false);
        service.registerModel("eu_countries", "SELECT code FROM {{ ref('country_codes') }} WHERE eu");

        service.run(RunOptions.defaults());
        assertEquals(List.of("DE", "FR"), queryStrings("SELECT code FROM snowlite_public.EU_COUNTRIES ORDER BY code"));

        service.registerSeed(COUNTRIES, new SeedData(List.of("code", "name", "population", "eu", "joined"),
                List.of(List.of("IE", "Ireland", "5100000", "true", "1973-01-01"))));
        service.seed(List.of("country_codes"), false);

        assertEquals(1, queryLong("SELECT COUNT(*) FROM snowlite_public.COUNTRY_CODES"));
        assertEquals(List.of("IE"), queryStrings("SELECT code FROM snowlite_public.EU_COUNTRIES"));
    }

    @Test
    @DisplayName("A cell past the inference sample that does not fit its type fails the load")
    void testNonConformingCell() throws SQLException {
        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            rows.add(List.of(String.valueOf(i)));
        }
        rows.add(List.of("O'Brien"));
        service.registerSeed(COUNTRIES, new SeedData(List.of("population"), rows));

        List<RunResult> results = service.seed(null, false);

        assertEquals(RunResult.Status.ERROR, results.get(0).status());
        assertEquals(0, queryLong("SELECT COUNT(*) FROM snowlite_public.COUNTRY_CODES"));
        assertNull(service.context().seed("country_codes").orElseThrow().loadedAt());
    }

    @Test
    @DisplayName("A seed without data is reported and left alone")
    void testMissingData() throws SQLException {
        service.registerSeed(COUNTRIES, null);

        List<RunResult> results = service.seed(null, true);

        assertEquals("Seed country_codes is empty", results.get(0).message());
        assertEquals(0, queryLong("SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = 'snowlite_public'"));
    }
}
