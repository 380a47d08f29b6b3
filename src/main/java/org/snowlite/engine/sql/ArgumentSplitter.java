package org.snowlite.engine.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the text between a call's parentheses into its top-level arguments.
 *
 * Commas nested inside parentheses, brackets, braces or quoted text do not split.
 * Doubled quotes inside a literal ({@code 'it''s'}) are honoured. Arguments are
 * returned trimmed; an empty or blank argument list yields an empty list.
 */
public final class ArgumentSplitter {

    private ArgumentSplitter() {
    }

    public static List<String> split(String argsText) {
        List<String> args = new ArrayList<>();
        if (argsText == null || argsText.isBlank()) {
            return args;
        }

        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;

        for (int i = 0; i < argsText.length(); i++) {
            char c = argsText.charAt(i);

            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    if (i + 1 < argsText.length() && argsText.charAt(i + 1) == quote) {
                        current.append(quote);
                        i++;
                    } else {
                        quote = 0;
                    }
                }
                continue;
            }

            switch (c) {
                case '\'', '"' -> {
                    quote = c;
                    current.append(c);
                }
                case '(', '[', '{' -> {
                    depth++;
                    current.append(c);
                }
                case ')', ']', '}' -> {
                    depth = Math.max(0, depth - 1);
                    current.append(c);
                }
                case ',' -> {
                    if (depth == 0) {
                        args.add(current.toString().trim());
                        current.setLength(0);
                    } else {
                        current.append(c);
                    }
                }
                default -> current.append(c);
            }
        }

        args.add(current.toString().trim());
        return args;
    }

    /**
     * Finds the parenthesis closing the one at {@code openIndex}, skipping quoted text.
     *
     * @return the index of the matching ')', or -1 when the input is unbalanced
     */
    public static int findClosingParen(String text, int openIndex) {
        int depth = 0;
        char quote = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                        i++;
                    } else {
                        quote = 0;
                    }
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Strips one level of matching single or double quotes and un-doubles embedded quotes.
     * Returns the input trimmed when it is not a quoted literal.
     */
    public static String unquote(String literal) {
        String s = literal.trim();
        if (s.length() >= 2) {
            char first = s.charAt(0);
            if ((first == '\'' || first == '"') && s.charAt(s.length() - 1) == first) {
                String q = String.valueOf(first);
                return s.substring(1, s.length() - 1).replace(q + q, q);
            }
        }
        return s;
    }

    public static boolean isQuoted(String literal) {
        String s = literal.trim();
        return s.length() >= 2
                && (s.charAt(0) == '\'' || s.charAt(0) == '"')
                && s.charAt(s.length() - 1) == s.charAt(0);
    }

    /**
     * Wraps a query in parentheses with each on its own line, so a trailing
     * {@code --} comment in the query cannot swallow the closing paren.
     */
    public static String parenthesize(String sql) {
        return "(\n" + sql + "\n)";
    }
}
