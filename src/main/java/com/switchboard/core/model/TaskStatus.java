package com.switchboard.core.model;

/**
 * Lifecycle of a {@link Task}. {@code COMPLETED} and {@code FAILED} are terminal.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
