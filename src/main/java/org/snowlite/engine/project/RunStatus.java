package org.snowlite.engine.project;

/**
 * Outcome of the most recent run of a model.
 */
public enum RunStatus {
    PENDING,
    SUCCESS,
    ERROR
}
