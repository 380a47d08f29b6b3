package org.snowlite.engine.run;

import java.util.List;

/**
 * Per-status counts over a list of results.
 */
public record RunSummary(int total, int success, int error, int skipped, int warn) {

    public static RunSummary of(List<RunResult> results) {
        return new RunSummary(
                results.size(),
                count(results, RunResult.Status.SUCCESS),
                count(results, RunResult.Status.ERROR),
                count(results, RunResult.Status.SKIPPED),
                count(results, RunResult.Status.WARN));
    }

    private static int count(List<RunResult> results, RunResult.Status status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }

    public boolean hasErrors() {
        return error > 0;
    }

    @Override
    public String toString() {
        return "Done. PASS=" + success + " WARN=" + warn + " ERROR=" + error + " SKIP=" + skipped + " TOTAL=" + total;
    }
}
