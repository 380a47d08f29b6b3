package org.snowlite.engine.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script into statements on {@code ;}, ignoring semicolons inside quoted
 * text and comments. Blank statements are dropped.
 */
public final class StatementSplitter {

    private StatementSplitter() {
    }

    public static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        if (script == null) {
            return statements;
        }

        StringBuilder current = new StringBuilder();
        int i = 0;
        int n = script.length();
        while (i < n) {
            char c = script.charAt(i);

            if (c == '\'' || c == '"') {
                int end = skipQuoted(script, i, c);
                current.append(script, i, end);
                i = end;
            } else if (c == '-' && i + 1 < n && script.charAt(i + 1) == '-') {
                int end = script.indexOf('\n', i);
                end = end < 0 ? n : end;
                current.append(script, i, end);
                i = end;
            } else if (c == '/' && i + 1 < n && script.charAt(i + 1) == '*') {
                int end = script.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                current.append(script, i, end);
                i = end;
            } else if (c == ';') {
                addIfNotBlank(statements, current);
                current.setLength(0);
                i++;
            } else {
                current.append(c);
                i++;
            }
        }
        addIfNotBlank(statements, current);
        return statements;
    }

    private static int skipQuoted(String s, int start, char quote) {
        int i = start + 1;
        while (i < s.length()) {
            if (s.charAt(i) == quote) {
                if (i + 1 < s.length() && s.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    private static void addIfNotBlank(List<String> statements, StringBuilder sb) {
        String stmt = sb.toString().trim();
        if (!stmt.isEmpty() && !isOnlyComments(stmt)) {
            statements.add(stmt);
        }
    }

    private static boolean isOnlyComments(String stmt) {
        String stripped = stmt.replaceAll("(?s)/\\*.*?\\*/", "").replaceAll("(?m)--.*$", "");
        return stripped.isBlank();
    }
}
