package org.snowlite.engine.execution;

/**
 * Runs one SQL statement against the local engine.
 *
 * Implementations report failures through {@link StatementResult#failure(String)}
 * rather than throwing. Splitting scripts into statements is the caller's job.
 */
@FunctionalInterface
public interface ExecutionBackend {

    StatementResult execute(String sql);
}
