package org.snowlite.engine.transpiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.sql.SQLParseException;

import java.util.List;

/**
 * Translates warehouse-dialect SQL into SQL the local engine runs.
 *
 * Best effort and total: unknown functions pass through verbatim and input the
 * lexer cannot scan is returned unchanged. Problems surface later as execution
 * errors, never as translation errors.
 *
 * Passes run in this order:
 * <ol>
 *   <li>{@link TypeMapper}: type names, so rules never see warehouse types</li>
 *   <li>{@link FunctionCallRewriter}: the {@link RewriteRules} table, inner calls first</li>
 *   <li>{@link ClauseRewriter}: operators that read across rewritten calls</li>
 * </ol>
 *
 * Example:
 * <pre>
 * DialectTranslator translator = new DialectTranslator();
 * String sql = translator.translate("SELECT IFF(a > 0, 'pos', 'neg') FROM t;");
 * // SELECT CASE WHEN a > 0 THEN 'pos' ELSE 'neg' END FROM t
 * </pre>
 */
public final class DialectTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(DialectTranslator.class);

    private final List<TranslationPass> passes;

    public DialectTranslator() {
        this(List.of(new TypeMapper(), new FunctionCallRewriter(), new ClauseRewriter()));
    }

    public DialectTranslator(List<TranslationPass> passes) {
        this.passes = List.copyOf(passes);
    }

    public String translate(String sql) {
        if (sql == null) {
            return "";
        }
        String input = sql.strip();
        if (input.endsWith(";")) {
            input = input.substring(0, input.length() - 1).strip();
        }

        String translated = input;
        try {
            for (TranslationPass pass : passes) {
                translated = pass.apply(translated);
            }
        } catch (SQLParseException e) {
            LOG.warn("Leaving SQL untranslated: {}", e.getMessage());
            return input;
        }
        return translated;
    }
}
