package org.snowlite.engine.template;

/**
 * Thrown for a malformed template directive. The compiler catches it and degrades
 * the directive to a best-guess value or an inline diagnostic comment.
 */
public class CompileException extends RuntimeException {

    private final String directive;

    public CompileException(String message, String directive) {
        super(message + ": " + directive);
        this.directive = directive;
    }

    public String getDirective() {
        return directive;
    }
}
