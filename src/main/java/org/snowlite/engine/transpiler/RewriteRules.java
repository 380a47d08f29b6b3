package org.snowlite.engine.transpiler;

import org.snowlite.engine.sql.ArgumentSplitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * The table of function-call rewrites, keyed by upper-cased function name.
 *
 * Rules see their arguments after the arguments have been rewritten, so nested
 * calls such as {@code NVL(IFF(a, b, c), 0)} resolve inner to outer without any
 * rule knowing about any other. A rule's output is never scanned again, which is
 * why {@code ARRAY_SIZE -> LEN} does not go on to become {@code LENGTH}.
 *
 * Rules registered with {@code suffixed = true} also receive a trailing
 * {@code OVER (...)} or {@code WITHIN GROUP (...)} clause and replace it.
 */
public final class RewriteRules {

    /**
     * One row of the rule table.
     */
    public record Entry(String name, RewriteRule rule, boolean suffixed) {}

    private static final RewriteRules STANDARD = buildStandard();

    private final Map<String, Entry> entries;

    private RewriteRules(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static RewriteRules standard() {
        return STANDARD;
    }

    public Optional<Entry> find(String functionName) {
        return Optional.ofNullable(entries.get(functionName.toUpperCase(Locale.ROOT)));
    }

    /**
     * @return All rule names in registration order
     */
    public List<String> names() {
        return new ArrayList<>(entries.keySet());
    }

    // ==================== Table ====================

    private static RewriteRules buildStandard() {
        Builder b = new Builder();

        // Plain renames
        b.rename("LEN", "LENGTH");
        b.rename("ARRAY_SIZE", "LEN");
        b.rename("NVL", "COALESCE");
        b.rename("IFNULL", "COALESCE");
        b.rename("BOOLOR_AGG", "BOOL_OR");
        b.rename("BOOLAND_AGG", "BOOL_AND");
        b.rename("BITOR_AGG", "BIT_OR");
        b.rename("BITAND_AGG", "BIT_AND");
        b.rename("TRUNCATE", "TRUNC");
        b.rename("SHA1", "SHA256");
        b.rename("BASE64_ENCODE", "BASE64");
        b.rename("BASE64_DECODE_STRING", "FROM_BASE64");
        b.rename("OBJECT_KEYS", "JSON_KEYS");
        b.rename("ARRAY_CONSTRUCT", "LIST_VALUE");
        b.rename("REGEXP_LIKE", "REGEXP_FULL_MATCH");
        b.rename("RLIKE", "REGEXP_FULL_MATCH");
        b.rename("SPLIT", "STRING_SPLIT");

        // Current date/time
        b.add("GETDATE", c -> Optional.of("CURRENT_TIMESTAMP"));
        b.add("SYSDATE", c -> Optional.of("CURRENT_TIMESTAMP"));
        b.add("SYSTIMESTAMP", c -> Optional.of("CURRENT_TIMESTAMP"));
        b.add("CURRENT_TIMESTAMP", c -> Optional.of("CURRENT_TIMESTAMP"));
        b.add("CURRENT_DATE", c -> Optional.of("CURRENT_DATE"));
        b.add("CURRENT_TIME", c -> Optional.of("CURRENT_TIME"));

        // Conditionals
        b.add("IFF", RewriteRules::iff);
        b.add("DECODE", RewriteRules::decode);
        b.add("NVL2", c -> c.arity() != 3 ? Optional.empty()
                : Optional.of("CASE WHEN " + c.arg(0) + " IS NOT NULL THEN " + c.arg(1) + " ELSE " + c.arg(2) + " END"));
        b.add("DIV0", c -> c.arity() != 2 ? Optional.empty()
                : Optional.of("CASE WHEN " + c.arg(1) + " = 0 THEN 0 ELSE (" + c.arg(0) + ") / (" + c.arg(1) + ") END"));
        b.add("ZEROIFNULL", c -> unary(c, x -> "COALESCE(" + x + ", 0)"));
        b.add("NULLIFZERO", c -> unary(c, x -> "CASE WHEN " + x + " = 0 THEN NULL ELSE " + x + " END"));
        b.add("EQUAL_NULL", c -> c.arity() != 2 ? Optional.empty()
                : Optional.of("(" + c.arg(0) + " IS NOT DISTINCT FROM " + c.arg(1) + ")"));

        // Dates
        b.add("DATEADD", RewriteRules::dateAdd);
        b.add("TIMEADD", RewriteRules::dateAdd);
        b.add("TIMESTAMPADD", RewriteRules::dateAdd);
        b.add("DATEDIFF", RewriteRules::dateDiff);
        b.add("TIMEDIFF", RewriteRules::dateDiff);
        b.add("TIMESTAMPDIFF", RewriteRules::dateDiff);
        b.add("TO_DATE", c -> toTemporal(c, "DATE", "CAST"));
        b.add("TRY_TO_DATE", c -> toTemporal(c, "DATE", "TRY_CAST"));
        for (String name : List.of("TO_TIMESTAMP", "TO_TIMESTAMP_NTZ", "TO_TIMESTAMP_LTZ", "TO_TIMESTAMP_TZ")) {
            b.add(name, c -> toTemporal(c, "TIMESTAMP", "CAST"));
            b.add("TRY_" + name, c -> toTemporal(c, "TIMESTAMP", "TRY_CAST"));
        }
        b.add("TIME_SLICE", RewriteRules::timeSlice);
        b.add("LAST_DAY", RewriteRules::lastDay);
        b.add("MONTHNAME", c -> unary(c, x -> "STRFTIME(" + x + ", '%b')"));
        b.add("DAYNAME", c -> unary(c, x -> "STRFTIME(" + x + ", '%a')"));

        // Conversions
        b.add("TO_VARCHAR", RewriteRules::toVarchar);
        b.add("TO_CHAR", RewriteRules::toVarchar);
        for (String name : List.of("TO_NUMBER", "TO_DECIMAL", "TO_NUMERIC")) {
            b.add(name, c -> toNumber(c, "CAST"));
            b.add("TRY_" + name, c -> toNumber(c, "TRY_CAST"));
        }
        b.add("TO_DOUBLE", c -> unary(c, x -> "CAST(" + x + " AS DOUBLE)"));
        b.add("TRY_TO_DOUBLE", c -> unary(c, x -> "TRY_CAST(" + x + " AS DOUBLE)"));
        b.add("TO_BOOLEAN", c -> unary(c, x -> "CAST(" + x + " AS BOOLEAN)"));
        b.add("TRY_TO_BOOLEAN", c -> unary(c, x -> "TRY_CAST(" + x + " AS BOOLEAN)"));
        b.add("PARSE_JSON", c -> unary(c, x -> "CAST(" + x + " AS JSON)"));
        b.add("TRY_PARSE_JSON", c -> unary(c, x -> "TRY_CAST(" + x + " AS JSON)"));

        // Math
        b.add("SQUARE", c -> unary(c, x -> "POWER(" + x + ", 2)"));
        b.suffixed("RATIO_TO_REPORT", c -> !c.hasWindow() || c.arity() != 1 ? Optional.empty()
                : Optional.of("((" + c.arg(0) + ") / SUM(" + c.arg(0) + ") OVER (" + c.window() + "))"));

        // Strings
        b.add("CHARINDEX", c -> c.arity() != 2 ? Optional.empty()
                : Optional.of("STRPOS(" + c.arg(1) + ", " + c.arg(0) + ")"));
        b.add("STRTOK", RewriteRules::strtok);
        b.suffixed("LISTAGG", RewriteRules::listagg);

        // Semi-structured
        b.add("OBJECT_CONSTRUCT", c -> c.arity() % 2 != 0 ? Optional.empty()
                : Optional.of("JSON_OBJECT(" + c.argList() + ")"));
        b.add("FLATTEN", RewriteRules::flatten);
        b.add("GET_PATH", RewriteRules::getPath);
        b.add("GET", RewriteRules::get);
        for (Map.Entry<String, String> type : Map.of(
                "ARRAY", "'ARRAY'",
                "OBJECT", "'OBJECT'",
                "BOOLEAN", "'BOOLEAN'",
                "VARCHAR", "'VARCHAR'",
                "CHAR", "'VARCHAR'",
                "INTEGER", "'BIGINT', 'UBIGINT'",
                "DECIMAL", "'BIGINT', 'UBIGINT', 'DOUBLE'",
                "DOUBLE", "'BIGINT', 'UBIGINT', 'DOUBLE'",
                "REAL", "'BIGINT', 'UBIGINT', 'DOUBLE'",
                "NULL_VALUE", "'NULL'").entrySet()) {
            b.add("IS_" + type.getKey(), c -> unary(c, x -> "(JSON_TYPE(" + x + ") IN (" + type.getValue() + "))"));
        }

        // Misc
        b.add("IDENTIFIER", c -> c.arity() == 1 && ArgumentSplitter.isQuoted(c.arg(0))
                ? Optional.of(ArgumentSplitter.unquote(c.arg(0)))
                : Optional.empty());
        b.add("UUID_STRING", c -> c.arity() != 0 ? Optional.empty() : Optional.of("CAST(UUID() AS VARCHAR)"));

        // Clause-shaped: FROM t SAMPLE (10) / SAMPLE (5 ROWS)
        b.add("SAMPLE", RewriteRules::sample);
        b.add("TABLESAMPLE", RewriteRules::sample);

        return new RewriteRules(b.entries);
    }

    // ==================== Rules ====================

    private static Optional<String> iff(FunctionCall c) {
        if (c.arity() != 3) {
            return Optional.empty();
        }
        return Optional.of("CASE WHEN " + c.arg(0) + " THEN " + c.arg(1) + " ELSE " + c.arg(2) + " END");
    }

    /**
     * DECODE(expr, k1, v1, ..., [default]). A NULL search key matches NULL.
     */
    private static Optional<String> decode(FunctionCall c) {
        if (c.arity() < 3) {
            return Optional.empty();
        }
        String expr = c.arg(0);
        StringBuilder sb = new StringBuilder("CASE");
        int i = 1;
        for (; i + 1 < c.arity(); i += 2) {
            String key = c.arg(i);
            String condition = key.equalsIgnoreCase("NULL") ? expr + " IS NULL" : expr + " = " + key;
            sb.append(" WHEN ").append(condition).append(" THEN ").append(c.arg(i + 1));
        }
        if (i < c.arity()) {
            sb.append(" ELSE ").append(c.arg(i));
        }
        return Optional.of(sb.append(" END").toString());
    }

    private static Optional<String> dateAdd(FunctionCall c) {
        if (c.arity() != 3) {
            return Optional.empty();
        }
        String unit = DateParts.normalizeOrSelf(c.arg(0));
        return Optional.of("(" + c.arg(2) + " + INTERVAL (" + c.arg(1) + ") " + unit + ")");
    }

    private static Optional<String> dateDiff(FunctionCall c) {
        if (c.arity() != 3) {
            return Optional.empty();
        }
        String unit = DateParts.normalize(c.arg(0)).orElse("DAY").toLowerCase(Locale.ROOT);
        return Optional.of("DATE_DIFF('" + unit + "', " + c.arg(1) + ", " + c.arg(2) + ")");
    }

    private static Optional<String> toTemporal(FunctionCall c, String type, String cast) {
        if (c.arity() == 1) {
            return Optional.of(cast + "(" + c.arg(0) + " AS " + type + ")");
        }
        if (c.arity() != 2) {
            return Optional.empty();
        }
        String parse = (cast.equals("TRY_CAST") ? "TRY_STRPTIME(" : "STRPTIME(")
                + c.arg(0) + ", " + DateFormats.toStrptime(c.arg(1)) + ")";
        return Optional.of(type.equals("DATE") ? cast + "(" + parse + " AS DATE)" : parse);
    }

    private static Optional<String> toVarchar(FunctionCall c) {
        if (c.arity() == 1) {
            return Optional.of("CAST(" + c.arg(0) + " AS VARCHAR)");
        }
        if (c.arity() == 2) {
            return Optional.of("STRFTIME(" + c.arg(0) + ", " + DateFormats.toStrptime(c.arg(1)) + ")");
        }
        return Optional.empty();
    }

    /**
     * TO_NUMBER(x [, fmt] [, precision [, scale]]).
     */
    private static Optional<String> toNumber(FunctionCall c, String cast) {
        if (c.arity() == 0 || c.arity() > 4) {
            return Optional.empty();
        }
        List<String> rest = new ArrayList<>(c.args().subList(1, c.arity()));
        if (!rest.isEmpty() && ArgumentSplitter.isQuoted(rest.get(0))) {
            rest.remove(0); // format model
        }
        String type = switch (rest.size()) {
            case 0 -> "DOUBLE";
            case 1 -> "DECIMAL(" + rest.get(0) + ", 0)";
            default -> "DECIMAL(" + rest.get(0) + ", " + rest.get(1) + ")";
        };
        return Optional.of(cast + "(" + c.arg(0) + " AS " + type + ")");
    }

    /**
     * TIME_SLICE(expr, n, 'part' [, 'START' | 'END']).
     */
    private static Optional<String> timeSlice(FunctionCall c) {
        if (c.arity() != 3 && c.arity() != 4) {
            return Optional.empty();
        }
        String interval = "INTERVAL (" + c.arg(1) + ") " + DateParts.normalizeOrSelf(c.arg(2));
        String bucket = "TIME_BUCKET(" + interval + ", " + c.arg(0) + ")";
        if (c.arity() == 4 && ArgumentSplitter.unquote(c.arg(3)).equalsIgnoreCase("END")) {
            return Optional.of("(" + bucket + " + " + interval + ")");
        }
        return Optional.of(bucket);
    }

    private static Optional<String> lastDay(FunctionCall c) {
        if (c.arity() != 2) {
            return Optional.empty(); // LAST_DAY(d) is the same on both sides
        }
        String unit = DateParts.normalizeOrSelf(c.arg(1));
        if (unit.equals("MONTH")) {
            return Optional.of("LAST_DAY(" + c.arg(0) + ")");
        }
        return Optional.of("CAST(DATE_TRUNC('" + unit.toLowerCase(Locale.ROOT) + "', " + c.arg(0)
                + ") + INTERVAL 1 " + unit + " - INTERVAL 1 DAY AS DATE)");
    }

    private static Optional<String> strtok(FunctionCall c) {
        return switch (c.arity()) {
            case 1 -> Optional.of("SPLIT_PART(" + c.arg(0) + ", ' ', 1)");
            case 2 -> Optional.of("SPLIT_PART(" + c.arg(0) + ", " + c.arg(1) + ", 1)");
            case 3 -> Optional.of("SPLIT_PART(" + c.argList() + ")");
            default -> Optional.empty();
        };
    }

    /**
     * LISTAGG(x [, sep]) [WITHIN GROUP (ORDER BY ...)] [OVER (...)].
     */
    private static Optional<String> listagg(FunctionCall c) {
        if (c.arity() != 1 && c.arity() != 2) {
            return Optional.empty();
        }
        String separator = c.arity() == 2 ? c.arg(1) : "''";
        StringBuilder sb = new StringBuilder("STRING_AGG(").append(c.arg(0)).append(", ").append(separator);
        if (c.withinGroup() != null && !c.withinGroup().isBlank()) {
            sb.append(' ').append(c.withinGroup().trim());
        }
        sb.append(')');
        if (c.hasWindow()) {
            sb.append(" OVER (").append(c.window()).append(')');
        }
        return Optional.of(sb.toString());
    }

    private static Optional<String> flatten(FunctionCall c) {
        for (String arg : c.args()) {
            String[] named = arg.split("=>", 2);
            if (named.length == 1) {
                return Optional.of("UNNEST(" + arg + ")");
            }
            if (named[0].trim().equalsIgnoreCase("INPUT")) {
                return Optional.of("UNNEST(" + named[1].trim() + ")");
            }
        }
        return Optional.empty();
    }

    private static Optional<String> getPath(FunctionCall c) {
        if (c.arity() != 2 || !ArgumentSplitter.isQuoted(c.arg(1))) {
            return Optional.empty();
        }
        String path = ArgumentSplitter.unquote(c.arg(1));
        String jsonPath = path.startsWith("[") ? "$" + path : "$." + path;
        return Optional.of("JSON_EXTRACT(" + c.arg(0) + ", '" + jsonPath.replace("'", "''") + "')");
    }

    private static Optional<String> get(FunctionCall c) {
        if (c.arity() != 2) {
            return Optional.empty();
        }
        String key = c.arg(1);
        if (ArgumentSplitter.isQuoted(key)) {
            return Optional.of("JSON_EXTRACT(" + c.arg(0) + ", '$." + ArgumentSplitter.unquote(key).replace("'", "''") + "')");
        }
        if (key.chars().allMatch(Character::isDigit)) {
            return Optional.of("JSON_EXTRACT(" + c.arg(0) + ", '$[" + key + "]')");
        }
        return Optional.empty();
    }

    private static Optional<String> sample(FunctionCall c) {
        if (c.arity() != 1) {
            return Optional.empty();
        }
        String[] parts = c.arg(0).trim().split("\\s+");
        if (parts.length == 2 && (parts[1].equalsIgnoreCase("ROWS") || parts[1].equalsIgnoreCase("ROW"))) {
            return Optional.of("USING SAMPLE " + parts[0] + " ROWS");
        }
        if (parts.length == 1) {
            return Optional.of("USING SAMPLE " + parts[0] + " PERCENT");
        }
        return Optional.empty();
    }

    private static Optional<String> unary(FunctionCall c, UnaryOperator<String> body) {
        return c.arity() == 1 ? Optional.of(body.apply(c.arg(0))) : Optional.empty();
    }

    // ==================== Builder ====================

    private static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        void add(String name, RewriteRule rule) {
            entries.put(name, new Entry(name, rule, false));
        }

        void suffixed(String name, RewriteRule rule) {
            entries.put(name, new Entry(name, rule, true));
        }

        void rename(String from, String to) {
            add(from, c -> Optional.of(to + "(" + c.argList() + ")"));
        }
    }
}
