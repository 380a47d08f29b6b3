package org.snowlite.engine.transpiler;

import org.snowlite.engine.sql.Lexer;
import org.snowlite.engine.sql.Lexer.Lexeme;
import org.snowlite.engine.sql.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites warehouse type names into engine type names.
 *
 * Works on whole tokens, so {@code TIMESTAMP_NTZ} and {@code INTEGER} can never be
 * partially matched by {@code TIMESTAMP} or {@code INT}. A word is only treated as
 * a type where a type is expected:
 * <ul>
 *   <li>after {@code ::}</li>
 *   <li>after {@code AS} inside {@code CAST(...)} or {@code TRY_CAST(...)}</li>
 *   <li>after a column name inside the column list of {@code CREATE TABLE t (...)}</li>
 *   <li>after {@code ADD COLUMN c}, {@code TYPE} or {@code RETURNS}</li>
 * </ul>
 * so a column that happens to be called {@code number} or {@code date} is left alone.
 */
public final class TypeMapper implements TranslationPass {

    private static final Map<String, String> SIMPLE_TYPES = Map.ofEntries(
            Map.entry("INT", "INTEGER"),
            Map.entry("BYTEINT", "TINYINT"),
            Map.entry("FLOAT4", "FLOAT"),
            Map.entry("FLOAT8", "DOUBLE"),
            Map.entry("DATETIME", "TIMESTAMP"),
            Map.entry("TIMESTAMP_NTZ", "TIMESTAMP"),
            Map.entry("TIMESTAMP_LTZ", "TIMESTAMP"),
            Map.entry("TIMESTAMP_TZ", "TIMESTAMP"),
            Map.entry("BINARY", "BLOB"),
            Map.entry("VARBINARY", "BLOB"),
            Map.entry("VARIANT", "JSON"),
            Map.entry("OBJECT", "JSON"),
            Map.entry("ARRAY", "JSON"));

    private static final Set<String> DECIMAL_TYPES = Set.of("NUMBER", "NUMERIC", "DECIMAL");

    private static final Set<String> CHARACTER_TYPES = Set.of(
            "VARCHAR", "CHAR", "CHARACTER", "STRING", "TEXT", "NCHAR", "NVARCHAR", "NVARCHAR2");

    private enum ParenKind { CAST, COLUMNS, OTHER }

    @Override
    public String apply(String sql) {
        List<Lexeme> tokens = Lexer.tokenize(sql);
        TextEdits edits = new TextEdits(sql);
        Deque<ParenKind> parens = new ArrayDeque<>();

        for (int i = 0; i < tokens.size(); i++) {
            Lexeme t = tokens.get(i);
            if (t.is(Token.LPAREN)) {
                parens.push(parenKind(tokens, i));
                continue;
            }
            if (t.is(Token.RPAREN)) {
                if (!parens.isEmpty()) {
                    parens.pop();
                }
                continue;
            }
            if (t.is(Token.IDENTIFIER) && isTypePosition(tokens, i, parens.peek())) {
                i = rewriteType(tokens, i, edits);
            }
        }
        return edits.apply();
    }

    // ==================== Type position ====================

    private static ParenKind parenKind(List<Lexeme> tokens, int lparen) {
        if (lparen == 0) {
            return ParenKind.OTHER;
        }
        Lexeme prev = tokens.get(lparen - 1);
        if (prev.is(Token.CAST) || prev.is(Token.TRY_CAST)) {
            return ParenKind.CAST;
        }
        // CREATE TABLE db.schema.name ( ...
        int j = lparen - 1;
        while (j >= 0 && isName(tokens.get(j))) {
            if (j >= 1 && tokens.get(j - 1).is(Token.DOT)) {
                j -= 2;
            } else {
                j--;
                break;
            }
        }
        if (j >= 0 && j < lparen - 1 && tokens.get(j).isWord("TABLE")) {
            return ParenKind.COLUMNS;
        }
        return ParenKind.OTHER;
    }

    private static boolean isTypePosition(List<Lexeme> tokens, int i, ParenKind enclosing) {
        if (i == 0) {
            return false;
        }
        Lexeme prev = tokens.get(i - 1);
        if (prev.is(Token.DOUBLE_COLON)) {
            return true;
        }
        if (prev.is(Token.AS)) {
            return enclosing == ParenKind.CAST;
        }
        if (prev.isWord("RETURNS") || prev.isWord("TYPE")) {
            return true;
        }
        if (isName(prev) && i >= 2) {
            Lexeme before = tokens.get(i - 2);
            if (enclosing == ParenKind.COLUMNS && (before.is(Token.LPAREN) || before.is(Token.COMMA))) {
                return true;
            }
            return before.isWord("COLUMN");
        }
        return false;
    }

    private static boolean isName(Lexeme t) {
        return t.is(Token.IDENTIFIER) || t.is(Token.QUOTED_IDENTIFIER);
    }

    // ==================== Rewriting ====================

    /**
     * Rewrites the type starting at {@code i} and returns the index of the last token consumed.
     */
    private static int rewriteType(List<Lexeme> tokens, int i, TextEdits edits) {
        Lexeme t = tokens.get(i);
        String name = t.text().toUpperCase(Locale.ROOT);
        int last = i;

        if (name.equals("DOUBLE") && i + 1 < tokens.size() && tokens.get(i + 1).isWord("PRECISION")) {
            edits.replace(t.start(), tokens.get(i + 1).end(), "DOUBLE");
            return i + 1;
        }
        if (name.equals("CHARACTER") && i + 1 < tokens.size() && tokens.get(i + 1).isWord("VARYING")) {
            last = i + 1;
        }

        List<String> precision = new ArrayList<>();
        int precisionEnd = parsePrecision(tokens, last + 1, precision);

        String replacement;
        int consumedTo = last;
        if (DECIMAL_TYPES.contains(name)) {
            if (!precision.isEmpty()) {
                replacement = "DECIMAL(" + String.join(",", precision) + ")";
                consumedTo = precisionEnd;
            } else if (name.equals("DECIMAL")) {
                return last;
            } else {
                replacement = "DOUBLE";
            }
        } else if (CHARACTER_TYPES.contains(name)) {
            if (!precision.isEmpty()) {
                replacement = "VARCHAR(" + precision.get(0) + ")";
                consumedTo = precisionEnd;
            } else {
                replacement = "VARCHAR";
            }
            if (name.equals("VARCHAR") && consumedTo == last) {
                return last;
            }
        } else if (SIMPLE_TYPES.containsKey(name)) {
            replacement = SIMPLE_TYPES.get(name);
            // precision on timestamps and floats has no engine equivalent
            if (!precision.isEmpty()) {
                consumedTo = precisionEnd;
            }
        } else {
            return last;
        }

        edits.replace(t.start(), tokens.get(consumedTo).end(), replacement);
        return consumedTo;
    }

    /**
     * Parses {@code ( int [, int] )} at {@code from}. Fills {@code out} and returns the index of
     * the closing paren, or leaves {@code out} empty and returns -1 when nothing matches.
     */
    private static int parsePrecision(List<Lexeme> tokens, int from, List<String> out) {
        if (from >= tokens.size() || !tokens.get(from).is(Token.LPAREN)) {
            return -1;
        }
        List<String> values = new ArrayList<>();
        int j = from + 1;
        while (j < tokens.size() && tokens.get(j).is(Token.INTEGER)) {
            values.add(tokens.get(j).text());
            j++;
            if (j < tokens.size() && tokens.get(j).is(Token.COMMA)) {
                j++;
            } else {
                break;
            }
        }
        if (values.isEmpty() || values.size() > 2 || j >= tokens.size() || !tokens.get(j).is(Token.RPAREN)) {
            return -1;
        }
        out.addAll(values);
        return j;
    }
}
