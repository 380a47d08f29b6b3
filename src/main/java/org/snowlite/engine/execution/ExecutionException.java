package org.snowlite.engine.execution;

/**
 * A JDBC failure outside a single statement's execution, such as opening a
 * connection or reading the catalog.
 */
public class ExecutionException extends RuntimeException {

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
