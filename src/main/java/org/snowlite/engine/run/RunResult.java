package org.snowlite.engine.run;

import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of one node in one invocation. Never changed after creation.
 *
 * @param uniqueId        The node's unique id
 * @param node            The node's name
 * @param executionTimeMs Wall time spent on the node
 * @param failures        Violating rows for tests, else 0
 */
public record RunResult(
        String uniqueId,
        String node,
        Status status,
        String message,
        double executionTimeMs,
        long failures) {

    public enum Status {
        SUCCESS,
        ERROR,
        SKIPPED,
        WARN;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public RunResult {
        Objects.requireNonNull(node, "Node cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        uniqueId = uniqueId == null ? node : uniqueId;
        message = message == null ? "" : message;
    }

    public static RunResult success(String uniqueId, String node, String message, double executionTimeMs) {
        return new RunResult(uniqueId, node, Status.SUCCESS, message, executionTimeMs, 0);
    }

    public static RunResult error(String uniqueId, String node, String message, double executionTimeMs) {
        return new RunResult(uniqueId, node, Status.ERROR, message, executionTimeMs, 0);
    }

    public static RunResult skipped(String uniqueId, String node, String message) {
        return new RunResult(uniqueId, node, Status.SKIPPED, message, 0, 0);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
