package org.snowlite.engine.transpiler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects non-overlapping span replacements over a source string and applies them
 * in one pass, copying untouched text (whitespace, comments) verbatim.
 */
final class TextEdits {

    private record Edit(int start, int end, String replacement) {}

    private final String source;
    private final List<Edit> edits = new ArrayList<>();

    TextEdits(String source) {
        this.source = source;
    }

    void replace(int start, int end, String replacement) {
        edits.add(new Edit(start, end, replacement));
    }

    boolean isEmpty() {
        return edits.isEmpty();
    }

    String apply() {
        if (edits.isEmpty()) {
            return source;
        }
        edits.sort(Comparator.comparingInt(Edit::start));
        StringBuilder out = new StringBuilder(source.length() + 32);
        int copied = 0;
        for (Edit edit : edits) {
            if (edit.start() < copied) {
                continue; // overlapping edit, first one wins
            }
            out.append(source, copied, edit.start());
            out.append(edit.replacement());
            copied = edit.end();
        }
        out.append(source, copied, source.length());
        return out.toString();
    }
}
