package com.switchboard.core.model;

import java.time.Instant;

/**
 * Append-only record of something the scheduler did.
 *
 * @param type      whether a worker delegated or the scheduler executed a task
 * @param from      delegating worker (delegations only)
 * @param to        delegate worker (delegations only)
 * @param worker    executing worker (executions only)
 * @param task      task text
 * @param timestamp when the entry was appended
 */
public record ExecutionLogEntry(
    Type type,
    String from,
    String to,
    String worker,
    String task,
    Instant timestamp
) {

    public enum Type { DELEGATION, EXECUTION }

    public static ExecutionLogEntry delegation(String from, String to, String task) {
        return new ExecutionLogEntry(Type.DELEGATION, from, to, null, task, Instant.now());
    }

    public static ExecutionLogEntry execution(String worker, String task) {
        return new ExecutionLogEntry(Type.EXECUTION, null, null, worker, task, Instant.now());
    }
}
