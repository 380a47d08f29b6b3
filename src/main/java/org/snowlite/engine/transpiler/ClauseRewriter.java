package org.snowlite.engine.transpiler;

import org.snowlite.engine.sql.Lexer;
import org.snowlite.engine.sql.Lexer.Lexeme;
import org.snowlite.engine.sql.Token;

import java.util.List;

/**
 * Rewrites the operator-shaped constructs that are not function calls:
 * <ul>
 *   <li>{@code expr COLLATE 'en-ci'} loses the collation</li>
 *   <li>{@code a [NOT] RLIKE p} becomes {@code [NOT] REGEXP_FULL_MATCH(a, p)}</li>
 * </ul>
 * The RLIKE operands are single terms: a (possibly qualified) name, a literal, or a
 * parenthesized group.
 */
public final class ClauseRewriter implements TranslationPass {

    @Override
    public String apply(String sql) {
        List<Lexeme> tokens = Lexer.tokenize(sql);
        TextEdits edits = new TextEdits(sql);

        for (int i = 0; i < tokens.size(); i++) {
            Lexeme t = tokens.get(i);

            if (t.is(Token.COLLATE) && i + 1 < tokens.size() && tokens.get(i + 1).is(Token.STRING)) {
                int from = i > 0 ? tokens.get(i - 1).end() : t.start();
                edits.replace(from, tokens.get(i + 1).end(), "");
                i++;
                continue;
            }

            if (t.is(Token.RLIKE) && !(i + 1 < tokens.size() && tokens.get(i + 1).is(Token.LPAREN))) {
                boolean negated = i > 0 && tokens.get(i - 1).is(Token.NOT);
                int leftEnd = negated ? i - 2 : i - 1;
                int leftStart = termStart(tokens, leftEnd);
                int rightEnd = termEnd(tokens, i + 1);
                if (leftStart < 0 || rightEnd < 0) {
                    continue;
                }
                String left = sql.substring(tokens.get(leftStart).start(), tokens.get(leftEnd).end());
                String right = sql.substring(tokens.get(i + 1).start(), tokens.get(rightEnd).end());
                edits.replace(tokens.get(leftStart).start(), tokens.get(rightEnd).end(),
                        (negated ? "NOT " : "") + "REGEXP_FULL_MATCH(" + left + ", " + right + ")");
                i = rightEnd;
            }
        }
        return edits.apply();
    }

    /**
     * First token of the term ending at {@code end}, or -1.
     */
    private static int termStart(List<Lexeme> tokens, int end) {
        if (end < 0) {
            return -1;
        }
        Lexeme t = tokens.get(end);
        if (t.is(Token.RPAREN)) {
            int depth = 0;
            for (int j = end; j >= 0; j--) {
                if (tokens.get(j).is(Token.RPAREN)) {
                    depth++;
                } else if (tokens.get(j).is(Token.LPAREN) && --depth == 0) {
                    // include a function name in front of the group
                    return j > 0 && tokens.get(j - 1).token() == Token.IDENTIFIER ? j - 1 : j;
                }
            }
            return -1;
        }
        if (!isAtom(t)) {
            return -1;
        }
        int j = end;
        while (j >= 2 && tokens.get(j - 1).is(Token.DOT) && isAtom(tokens.get(j - 2))) {
            j -= 2;
        }
        return j;
    }

    /**
     * Last token of the term starting at {@code start}, or -1.
     */
    private static int termEnd(List<Lexeme> tokens, int start) {
        if (start >= tokens.size()) {
            return -1;
        }
        Lexeme t = tokens.get(start);
        int j = start;
        if (t.is(Token.IDENTIFIER) && j + 1 < tokens.size() && tokens.get(j + 1).is(Token.LPAREN)) {
            j++;
        }
        if (tokens.get(j).is(Token.LPAREN)) {
            int depth = 0;
            for (; j < tokens.size(); j++) {
                if (tokens.get(j).is(Token.LPAREN)) {
                    depth++;
                } else if (tokens.get(j).is(Token.RPAREN) && --depth == 0) {
                    return j;
                }
            }
            return -1;
        }
        if (!isAtom(t)) {
            return -1;
        }
        while (j + 2 < tokens.size() && tokens.get(j + 1).is(Token.DOT) && isAtom(tokens.get(j + 2))) {
            j += 2;
        }
        return j;
    }

    private static boolean isAtom(Lexeme t) {
        return switch (t.token()) {
            case IDENTIFIER, QUOTED_IDENTIFIER, STRING, INTEGER, DECIMAL -> true;
            default -> false;
        };
    }
}
