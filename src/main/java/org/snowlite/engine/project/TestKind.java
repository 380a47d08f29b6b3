package org.snowlite.engine.project;

/**
 * {@code SCHEMA} tests are generated from column declarations; {@code SINGULAR}
 * tests are freestanding assertion queries.
 */
public enum TestKind {
    SCHEMA,
    SINGULAR
}
