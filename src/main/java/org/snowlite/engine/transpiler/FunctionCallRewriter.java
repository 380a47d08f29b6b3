package org.snowlite.engine.transpiler;

import org.snowlite.engine.sql.ArgumentSplitter;
import org.snowlite.engine.sql.Lexer;
import org.snowlite.engine.sql.Lexer.Lexeme;
import org.snowlite.engine.sql.Token;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds {@code NAME ( ... )} call sites in the token stream and applies the
 * matching {@link RewriteRules} entry.
 *
 * The text between the parentheses is rewritten first (recursively), then split
 * into arguments with {@link ArgumentSplitter}, then handed to the rule. Calls
 * without a rule keep their name and spacing verbatim; only their arguments are
 * rewritten. Qualified names ({@code schema.fn(...)}) never match a rule.
 */
public final class FunctionCallRewriter implements TranslationPass {

    private final RewriteRules rules;

    public FunctionCallRewriter(RewriteRules rules) {
        this.rules = rules;
    }

    public FunctionCallRewriter() {
        this(RewriteRules.standard());
    }

    @Override
    public String apply(String sql) {
        List<Lexeme> tokens = Lexer.tokenize(sql);
        TextEdits edits = new TextEdits(sql);

        int i = 0;
        while (i < tokens.size()) {
            Lexeme t = tokens.get(i);
            if (!isCallSite(tokens, i)) {
                i++;
                continue;
            }
            int close = matchingParen(tokens, i + 1);
            if (close < 0) {
                break; // unbalanced; leave the rest as written
            }

            String inner = apply(sql.substring(tokens.get(i + 1).end(), tokens.get(close).start()));
            Optional<RewriteRules.Entry> entry = isQualified(tokens, i)
                    ? Optional.empty()
                    : rules.find(t.text());

            int spanEnd = tokens.get(close).end();
            int next = close + 1;
            String replacement = null;

            if (entry.isPresent()) {
                String window = null;
                String withinGroup = null;
                if (entry.get().suffixed()) {
                    int groupOpen = suffixParen(tokens, next, "WITHIN", "GROUP");
                    if (groupOpen > 0) {
                        int groupClose = matchingParen(tokens, groupOpen);
                        if (groupClose > 0) {
                            withinGroup = apply(sql.substring(tokens.get(groupOpen).end(), tokens.get(groupClose).start()));
                            spanEnd = tokens.get(groupClose).end();
                            next = groupClose + 1;
                        }
                    }
                    int overOpen = suffixParen(tokens, next, "OVER", null);
                    if (overOpen > 0) {
                        int overClose = matchingParen(tokens, overOpen);
                        if (overClose > 0) {
                            window = apply(sql.substring(tokens.get(overOpen).end(), tokens.get(overClose).start()));
                            spanEnd = tokens.get(overClose).end();
                            next = overClose + 1;
                        }
                    }
                }
                FunctionCall call = new FunctionCall(t.text().toUpperCase(Locale.ROOT),
                        ArgumentSplitter.split(inner), window, withinGroup);
                replacement = entry.get().rule().rewrite(call).orElse(null);
                if (replacement == null) {
                    // rule declined: keep the call and any suffix exactly as written
                    spanEnd = tokens.get(close).end();
                    next = close + 1;
                }
            }
            if (replacement == null) {
                replacement = sql.substring(t.start(), tokens.get(i + 1).end()) + inner + ")";
            }
            edits.replace(t.start(), spanEnd, replacement);
            i = next;
        }
        return edits.apply();
    }

    private static boolean isCallSite(List<Lexeme> tokens, int i) {
        return tokens.get(i).token().isWord()
                && i + 1 < tokens.size()
                && tokens.get(i + 1).is(Token.LPAREN);
    }

    private static boolean isQualified(List<Lexeme> tokens, int i) {
        return i > 0 && tokens.get(i - 1).is(Token.DOT);
    }

    /**
     * Index of the '(' following {@code first [second]} at {@code from}, or -1.
     */
    private static int suffixParen(List<Lexeme> tokens, int from, String first, String second) {
        int j = from;
        if (j >= tokens.size() || !tokens.get(j).isWord(first)) {
            return -1;
        }
        j++;
        if (second != null) {
            if (j >= tokens.size() || !tokens.get(j).isWord(second)) {
                return -1;
            }
            j++;
        }
        return j < tokens.size() && tokens.get(j).is(Token.LPAREN) ? j : -1;
    }

    private static int matchingParen(List<Lexeme> tokens, int open) {
        int depth = 0;
        for (int j = open; j < tokens.size(); j++) {
            if (tokens.get(j).is(Token.LPAREN)) {
                depth++;
            } else if (tokens.get(j).is(Token.RPAREN)) {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return -1;
    }
}
