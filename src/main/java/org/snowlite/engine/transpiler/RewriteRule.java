package org.snowlite.engine.transpiler;

import java.util.Optional;

/**
 * Rewrites one warehouse function call into engine SQL.
 */
@FunctionalInterface
public interface RewriteRule {

    /**
     * @param call The call, arguments already rewritten
     * @return The replacement text, or empty to keep the call as written
     */
    Optional<String> rewrite(FunctionCall call);
}
