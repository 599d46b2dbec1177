package com.switchboard.core.model;

/**
 * Typed reason a task ended in {@link TaskStatus#FAILED}.
 *
 * @param kind    which boundary the failure came from
 * @param worker  the worker involved, if one was resolved
 * @param message human-readable detail
 */
public record ExecutionError(Kind kind, String worker, String message) {

    public enum Kind {
        /** No worker was assigned and none could be matched, or the name did not resolve. */
        WORKER_LOOKUP,
        /** The worker threw while executing. */
        EXECUTION
    }

    public static ExecutionError workerLookup(String worker, String message) {
        return new ExecutionError(Kind.WORKER_LOOKUP, worker, message);
    }

    public static ExecutionError execution(String worker, String message) {
        return new ExecutionError(Kind.EXECUTION, worker, message);
    }
}
