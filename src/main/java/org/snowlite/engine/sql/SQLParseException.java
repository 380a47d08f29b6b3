package org.snowlite.engine.sql;

/**
 * Exception thrown when SQL text cannot be scanned, e.g. an unterminated string literal.
 */
public class SQLParseException extends RuntimeException {

    private final int position;

    public SQLParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
