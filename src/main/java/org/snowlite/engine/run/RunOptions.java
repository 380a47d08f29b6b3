package org.snowlite.engine.run;

/**
 * Options of one model run.
 *
 * @param select                 Selection expression; blank selects every model
 * @param exclude                Exclusion expression, same grammar
 * @param fullRefresh            Rebuild incremental models from scratch
 * @param skipDependentsOfFailed Skip models downstream of a model that failed in this run.
 *                               Off by default: a failed node does not stop its dependents.
 */
public record RunOptions(String select, String exclude, boolean fullRefresh, boolean skipDependentsOfFailed) {

    public static RunOptions defaults() {
        return new RunOptions(null, null, false, false);
    }

    public static RunOptions select(String select) {
        return new RunOptions(select, null, false, false);
    }

    public RunOptions withFullRefresh(boolean refresh) {
        return new RunOptions(select, exclude, refresh, skipDependentsOfFailed);
    }

    public RunOptions withExclude(String exclusion) {
        return new RunOptions(select, exclusion, fullRefresh, skipDependentsOfFailed);
    }

    public RunOptions withSkipDependentsOfFailed(boolean skip) {
        return new RunOptions(select, exclude, fullRefresh, skip);
    }
}
