package org.snowlite.engine.transpiler;

import java.util.List;
import java.util.Objects;

/**
 * A call site found in the token stream, with its arguments already translated.
 *
 * @param name        Upper-cased function name
 * @param args        Top-level arguments, trimmed, in source order
 * @param window      Text inside a trailing {@code OVER ( ... )}, or null
 * @param withinGroup Text inside a trailing {@code WITHIN GROUP ( ... )}, or null
 */
public record FunctionCall(String name, List<String> args, String window, String withinGroup) {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        args = List.copyOf(args);
    }

    public FunctionCall(String name, List<String> args) {
        this(name, args, null, null);
    }

    public int arity() {
        return args.size();
    }

    public String arg(int index) {
        return args.get(index);
    }

    public String argList() {
        return String.join(", ", args);
    }

    public boolean hasWindow() {
        return window != null;
    }
}
