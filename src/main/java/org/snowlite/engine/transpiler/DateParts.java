package org.snowlite.engine.transpiler;

import org.snowlite.engine.sql.ArgumentSplitter;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Normalises warehouse date-part names and abbreviations ({@code yy}, {@code mon},
 * {@code hh}, ...) to the canonical unit names the engine accepts.
 */
final class DateParts {

    private static final Map<String, String> UNITS = new HashMap<>();

    static {
        register("YEAR", "YEAR", "YEARS", "Y", "YY", "YYY", "YYYY", "YR", "YRS");
        register("QUARTER", "QUARTER", "QUARTERS", "Q", "QTR", "QTRS");
        register("MONTH", "MONTH", "MONTHS", "MM", "MON", "MONS");
        register("WEEK", "WEEK", "WEEKS", "W", "WK", "WEEKOFYEAR", "WOY", "WY");
        register("DAY", "DAY", "DAYS", "D", "DD", "DAYOFMONTH");
        register("HOUR", "HOUR", "HOURS", "H", "HH", "HR", "HRS");
        register("MINUTE", "MINUTE", "MINUTES", "M", "MI", "MIN", "MINS");
        register("SECOND", "SECOND", "SECONDS", "S", "SEC", "SECS");
        register("MILLISECOND", "MILLISECOND", "MILLISECONDS", "MS", "MSEC");
        register("MICROSECOND", "MICROSECOND", "MICROSECONDS", "US", "USEC");
    }

    private DateParts() {
    }

    private static void register(String canonical, String... aliases) {
        for (String alias : aliases) {
            UNITS.put(alias, canonical);
        }
    }

    /**
     * @param part A date part as written in SQL, optionally quoted
     * @return The canonical upper-case unit, or empty when the part is unknown
     */
    static Optional<String> normalize(String part) {
        String key = ArgumentSplitter.unquote(part).toUpperCase(Locale.ROOT);
        return Optional.ofNullable(UNITS.get(key));
    }

    /**
     * Like {@link #normalize(String)} but returns the upper-cased input for unknown parts.
     */
    static String normalizeOrSelf(String part) {
        return normalize(part).orElse(ArgumentSplitter.unquote(part).toUpperCase(Locale.ROOT));
    }
}
