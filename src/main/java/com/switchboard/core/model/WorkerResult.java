package com.switchboard.core.model;

import java.util.Map;

/**
 * Output of a worker execution.
 *
 * @param content  the worker's response text
 * @param metadata free-form details (model, token usage, ...)
 */
public record WorkerResult(String content, Map<String, Object> metadata) {

    public WorkerResult {
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static WorkerResult of(String content) {
        return new WorkerResult(content, Map.of());
    }

    /** Synthetic result stored on a task that failed. */
    public static WorkerResult error(String message) {
        return new WorkerResult("Error: " + message, Map.of("error", true));
    }

    public boolean isError() {
        return Boolean.TRUE.equals(metadata.get("error"));
    }
}
