package org.snowlite.engine.run;

import org.snowlite.engine.project.CompileContext;

import java.util.List;

/**
 * The results of an invocation, with the registry as it stands afterwards
 * (compiled SQL, run state, test outcomes).
 */
public record RunOutcome(CompileContext context, List<RunResult> results) {

    public RunOutcome {
        results = List.copyOf(results);
    }

    public RunSummary summary() {
        return RunSummary.of(results);
    }
}
