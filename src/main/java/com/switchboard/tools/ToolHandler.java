package com.switchboard.tools;

import java.util.List;
import java.util.Map;

/**
 * A source of tools, typically one remote tool server.
 * <p>
 * {@link #callTool} must report failures through {@link ToolResult#error}; the
 * connection manager still guards against handlers that throw.
 */
public interface ToolHandler {

    default String name() {
        return config().name();
    }

    ToolHandlerConfig config();

    /**
     * Establish the connection. Either throw or leave {@link #isConnected()} false on failure.
     */
    void connect() throws Exception;

    boolean isConnected();

    List<ToolDefinition> listTools();

    ToolResult callTool(String toolName, Map<String, Object> arguments);

    /** Idempotent. */
    void disconnect() throws Exception;

    default boolean healthCheck() {
        return isConnected();
    }

    boolean matchesScope(String stage, String agent);
}
