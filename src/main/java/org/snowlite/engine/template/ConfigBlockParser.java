package org.snowlite.engine.template;

import org.snowlite.engine.sql.ArgumentSplitter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code {{ config(key=value, ...) }}} blocks from template SQL.
 *
 * Values may be quoted strings, bare words, {@code true}/{@code false}, numbers
 * or {@code [...]} lists of those. Later blocks override earlier keys.
 */
public final class ConfigBlockParser {

    static final Pattern CONFIG_BLOCK = Pattern.compile("\\{\\{-?\\s*config\\s*\\((.*?)\\)\\s*-?}}", Pattern.DOTALL);

    /**
     * The SQL with config blocks removed, and the merged config.
     */
    public record Extraction(String sql, Map<String, Object> config) {}

    private ConfigBlockParser() {
    }

    public static Extraction extract(String sql) {
        Map<String, Object> config = new LinkedHashMap<>();
        Matcher m = CONFIG_BLOCK.matcher(sql);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            config.putAll(parseArgs(m.group(1)));
            m.appendReplacement(out, "");
        }
        m.appendTail(out);
        return new Extraction(out.toString(), config);
    }

    /**
     * Parses {@code key=value} pairs. Arguments without {@code =} are ignored.
     */
    public static Map<String, Object> parseArgs(String argsText) {
        Map<String, Object> config = new LinkedHashMap<>();
        for (String arg : ArgumentSplitter.split(argsText)) {
            int eq = arg.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = arg.substring(0, eq).trim();
            if (!key.matches("\\w+")) {
                continue;
            }
            config.put(key, parseValue(arg.substring(eq + 1).trim()));
        }
        return config;
    }

    static Object parseValue(String raw) {
        String value = raw.trim();
        if (value.startsWith("[") && value.endsWith("]")) {
            List<Object> items = new ArrayList<>();
            for (String item : ArgumentSplitter.split(value.substring(1, value.length() - 1))) {
                if (!item.isEmpty()) {
                    items.add(parseValue(item));
                }
            }
            return items;
        }
        if (ArgumentSplitter.isQuoted(value)) {
            return ArgumentSplitter.unquote(value);
        }
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(value);
        }
        if (value.matches("-?\\d{1,18}")) {
            return Long.parseLong(value);
        }
        if (value.matches("-?\\d+\\.\\d+")) {
            return Double.parseDouble(value);
        }
        return value;
    }
}
