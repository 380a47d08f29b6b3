package org.snowlite.engine.run;

import org.snowlite.engine.project.DataTest;

/**
 * A test after execution, with its status and failure count filled in, and the
 * matching run result.
 */
public record TestOutcome(DataTest test, RunResult result) {
}
