package com.switchboard.core.model;

import java.util.List;
import java.util.Set;

/**
 * Declares the artifacts a worker consumes and produces.
 * <p>
 * Used only for dependency inference between top-level tasks; nothing enforces
 * the contract at runtime.
 *
 * @param inputs      artifact names this worker expects to find in the context
 * @param outputs     artifact names this worker produces
 * @param delegatesTo workers this worker may hand sub-tasks to (informational)
 */
public record WorkerContract(
    Set<String> inputs,
    Set<String> outputs,
    List<String> delegatesTo
) {

    public static final WorkerContract EMPTY = new WorkerContract(Set.of(), Set.of(), List.of());

    public WorkerContract {
        inputs = inputs == null ? Set.of() : Set.copyOf(inputs);
        outputs = outputs == null ? Set.of() : Set.copyOf(outputs);
        delegatesTo = delegatesTo == null ? List.of() : List.copyOf(delegatesTo);
    }

    public static WorkerContract of(Set<String> inputs, Set<String> outputs) {
        return new WorkerContract(inputs, outputs, List.of());
    }
}
