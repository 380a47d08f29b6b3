package org.snowlite.engine.transpiler;

import org.snowlite.engine.sql.ArgumentSplitter;

/**
 * Converts warehouse date/time format strings ({@code 'YYYY-MM-DD HH24:MI:SS'})
 * into strptime/strftime patterns ({@code '%Y-%m-%d %H:%M:%S'}).
 *
 * The format is scanned left to right with longest element first, so {@code MM}
 * and {@code MI} or {@code HH24} and {@code HH} never collide. Double-quoted runs
 * are literal text. Anything else is copied as is.
 */
public final class DateFormats {

    // Longest first within each shared prefix
    private static final String[][] ELEMENTS = {
            {"YYYY", "%Y"},
            {"YY", "%y"},
            {"MMMM", "%B"},
            {"MON", "%b"},
            {"MM", "%m"},
            {"DD", "%d"},
            {"DY", "%a"},
            {"HH24", "%H"},
            {"HH12", "%I"},
            {"HH", "%H"},
            {"MI", "%M"},
            {"SS", "%S"},
            {"AM", "%p"},
            {"PM", "%p"},
            {"TZH:TZM", "%z"},
    };

    private DateFormats() {
    }

    /**
     * Converts a format argument. Non-literal arguments (column references,
     * expressions) are returned unchanged.
     *
     * @param formatArgument The SQL text of the format argument, e.g. {@code 'YYYY-MM-DD'}
     * @return The converted literal, e.g. {@code '%Y-%m-%d'}
     */
    public static String toStrptime(String formatArgument) {
        if (!ArgumentSplitter.isQuoted(formatArgument) || formatArgument.trim().charAt(0) != '\'') {
            return formatArgument;
        }
        String format = ArgumentSplitter.unquote(formatArgument);
        return "'" + convert(format).replace("'", "''") + "'";
    }

    static String convert(String format) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        outer:
        while (i < format.length()) {
            char c = format.charAt(i);

            if (c == '"') {
                int end = format.indexOf('"', i + 1);
                end = end < 0 ? format.length() : end;
                out.append(format, i + 1, end);
                i = end + 1;
                continue;
            }
            if (c == '%') {
                out.append("%%");
                i++;
                continue;
            }
            if (startsWithIgnoreCase(format, i, "FF")) {
                // FF, FF3, FF6, FF9 all become fractional seconds
                out.append("%f");
                i += 2;
                if (i < format.length() && Character.isDigit(format.charAt(i))) {
                    i++;
                }
                continue;
            }
            for (String[] element : ELEMENTS) {
                if (startsWithIgnoreCase(format, i, element[0])) {
                    out.append(element[1]);
                    i += element[0].length();
                    continue outer;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static boolean startsWithIgnoreCase(String s, int offset, String prefix) {
        return s.regionMatches(true, offset, prefix, 0, prefix.length());
    }
}
