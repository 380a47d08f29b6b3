package org.snowlite.engine.transpiler;

/**
 * One stage of the dialect translation pipeline.
 *
 * Passes run in the order {@link DialectTranslator} lists them; a pass may rely
 * on the output shape of the passes before it but never on the ones after it.
 */
@FunctionalInterface
public interface TranslationPass {

    String apply(String sql);
}
