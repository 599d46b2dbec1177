package com.switchboard.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a tool call. Failures are carried as data, never thrown.
 *
 * @param content      result text (empty on error)
 * @param isError      whether the call failed
 * @param errorMessage failure description, null on success
 * @param errorKind    failure category, null on success
 * @param metadata     handler-specific extras; values may be null
 */
public record ToolResult(
    String content,
    boolean isError,
    String errorMessage,
    ErrorKind errorKind,
    Map<String, Object> metadata
) {

    public enum ErrorKind {
        /** No handler advertises the tool. */
        UNKNOWN_TOOL,
        /** The owning handler is missing or circuit-broken; it was not invoked. */
        HANDLER_UNAVAILABLE,
        /** The handler reported a failure. */
        HANDLER_ERROR,
        /** The handler threw instead of returning a result. */
        HANDLER_FAULT
    }

    public ToolResult {
        content = content != null ? content : "";
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static ToolResult success(String content) {
        return new ToolResult(content, false, null, null, Map.of());
    }

    public static ToolResult success(String content, Map<String, Object> metadata) {
        return new ToolResult(content, false, null, null, metadata);
    }

    /** A failure reported by a handler. */
    public static ToolResult error(String message) {
        return error(ErrorKind.HANDLER_ERROR, message);
    }

    public static ToolResult error(ErrorKind kind, String message) {
        return new ToolResult("", true, message, kind, Map.of());
    }
}
