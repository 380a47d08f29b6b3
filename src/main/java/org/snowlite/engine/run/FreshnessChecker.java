package org.snowlite.engine.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.execution.ExecutionBackend;
import org.snowlite.engine.execution.StatementResult;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.FreshnessPolicy;
import org.snowlite.engine.project.RelationNames;
import org.snowlite.engine.project.Source;
import org.snowlite.engine.project.SourceTable;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * Checks how recently source tables were loaded.
 *
 * Only tables with a freshness policy (their own or their source's) are checked.
 * A table is stale when the age of {@code MAX(loaded_at_field)} exceeds a
 * threshold: past {@code error_after} is an error, past {@code warn_after} a warning.
 * Engine-side timestamps without a zone are read as UTC.
 */
public class FreshnessChecker {

    private static final Logger LOG = LoggerFactory.getLogger(FreshnessChecker.class);

    private final ExecutionBackend backend;
    private final RelationNames names;
    private final Clock clock;

    public FreshnessChecker(ExecutionBackend backend) {
        this(backend, RelationNames.DUCKDB, Clock.systemUTC());
    }

    public FreshnessChecker(ExecutionBackend backend, RelationNames names, Clock clock) {
        this.backend = backend;
        this.names = names;
        this.clock = clock;
    }

    /**
     * @param select Source names to check; null or empty checks all of them
     */
    public List<FreshnessResult> check(CompileContext ctx, Collection<String> select) {
        List<FreshnessResult> results = new ArrayList<>();
        for (Source source : ctx.sources().values()) {
            if (select != null && !select.isEmpty() && !select.contains(source.name())) {
                continue;
            }
            for (SourceTable table : source.tables()) {
                FreshnessPolicy policy = source.freshnessFor(table);
                if (policy != null) {
                    results.add(check(source, table, policy));
                }
            }
        }
        return results;
    }

    FreshnessResult check(Source source, SourceTable table, FreshnessPolicy policy) {
        String relation = names.of(source.database(), source.schema(), table.physicalName());
        StatementResult result = backend.execute("SELECT MAX(" + policy.loadedAtField() + ") FROM " + relation);
        if (!result.success()) {
            LOG.error("Freshness check of {}.{} failed: {}", source.name(), table.name(), result.error());
            return new FreshnessResult(source.name(), table.name(), FreshnessResult.Status.ERROR, null, null,
                    result.error());
        }

        Instant loadedAt = result.rowCount() == 0 ? null : toInstant(result.result().getValue(0, 0));
        if (loadedAt == null) {
            return new FreshnessResult(source.name(), table.name(), FreshnessResult.Status.ERROR, null, null,
                    "No " + policy.loadedAtField() + " values in " + relation);
        }

        Duration age = Duration.between(loadedAt, Instant.now(clock));
        FreshnessResult.Status status = FreshnessResult.Status.PASS;
        if (exceeds(age, policy.errorAfter())) {
            status = FreshnessResult.Status.ERROR;
        } else if (exceeds(age, policy.warnAfter())) {
            status = FreshnessResult.Status.WARN;
        }
        return new FreshnessResult(source.name(), table.name(), status, loadedAt, age,
                "Last loaded " + loadedAt + " (" + age.toMinutes() + " minutes ago)");
    }

    private static boolean exceeds(Duration age, Duration threshold) {
        return threshold != null && age.compareTo(threshold) > 0;
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp ts) {
            return ts.toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        String text = value.toString().trim();
        try {
            return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text.replace(' ', 'T')).toInstant();
            } catch (DateTimeParseException second) {
                LOG.warn("Cannot read '{}' as a timestamp", text);
                return null;
            }
        }
    }
}
