package com.switchboard.tools;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.tools.ToolResult.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lifecycle manager for tool handlers: lazy connection, tool routing, circuit breaking
 * and shutdown.
 * <p>
 * Handlers connect on first discovery, never at construction. Tool names map to the first
 * handler that advertised them. A handler returning {@value #DEFAULT_CIRCUIT_BREAKER_THRESHOLD}
 * error results in a row (by default) is marked broken and is not called again until
 * {@link #shutdownAll()}. A handler whose connect fails is broken the same way.
 * <p>
 * Safe for concurrent {@link #callTool} from worker-pool threads. All mutations of the
 * connection, routing and breaker state happen under a single mutex; handler calls
 * themselves run outside it.
 * <p>
 * Use with try-with-resources: {@link #close()} disconnects every connected handler.
 */
public class ToolConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToolConnectionManager.class);

    public static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 3;

    private final ToolDirectory directory;
    private final EventBus eventBus;
    private final SwitchboardMetrics metrics;
    private final int circuitBreakerThreshold;

    private final Object mutex = new Object();
    private final Map<String, String> toolMap = new ConcurrentHashMap<>();
    private final Set<String> connectedHandlers = ConcurrentHashMap.newKeySet();
    private final Set<String> failedHandlers = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> errorCounts = new ConcurrentHashMap<>();

    public ToolConnectionManager(ToolDirectory directory) {
        this(directory, new EventBus(), null, DEFAULT_CIRCUIT_BREAKER_THRESHOLD);
    }

    /**
     * @param metrics                 optional, may be null
     * @param circuitBreakerThreshold consecutive error results that mark a handler broken
     */
    public ToolConnectionManager(ToolDirectory directory, EventBus eventBus,
                                 SwitchboardMetrics metrics, int circuitBreakerThreshold) {
        if (circuitBreakerThreshold < 1) {
            throw new IllegalArgumentException("circuitBreakerThreshold must be >= 1, got " + circuitBreakerThreshold);
        }
        this.directory = directory;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.circuitBreakerThreshold = circuitBreakerThreshold;
    }

    // ── Discovery ───────────────────────────────────────────────────

    /**
     * Returns the tools of every handler matching the scope, connecting handlers on first
     * access. Broken handlers are skipped; a tool name already owned by another handler
     * is dropped with a warning.
     *
     * @param stage null for any stage
     * @param agent null for any agent
     */
    public List<ToolDefinition> getToolsForScope(String stage, String agent) {
        var tools = new ArrayList<ToolDefinition>();

        for (ToolHandler handler : directory.getForScope(stage, agent)) {
            String handlerName = handler.name();
            if (failedHandlers.contains(handlerName)) {
                continue;
            }
            if (!connectedHandlers.contains(handlerName)) {
                ensureConnected(handler);
                if (failedHandlers.contains(handlerName)) {
                    continue;
                }
            }

            List<ToolDefinition> handlerTools = listToolsSafely(handler);
            synchronized (mutex) {
                for (ToolDefinition tool : handlerTools) {
                    String existing = toolMap.get(tool.name());
                    if (existing != null && !existing.equals(handlerName)) {
                        log.warn("Tool name collision: '{}' already registered by '{}', ignoring from '{}'",
                                tool.name(), existing, handlerName);
                        continue;
                    }
                    toolMap.put(tool.name(), handlerName);
                    tools.add(tool);
                }
            }
        }

        log.debug("Tool discovery for stage={} agent={} returned {} tool(s)", stage, agent, tools.size());
        return tools;
    }

    /**
     * Tools of {@link #getToolsForScope} in function-calling form.
     */
    public List<Map<String, Object>> getToolsAsSchema(String stage, String agent) {
        return getToolsForScope(stage, agent).stream()
                .map(ToolDefinition::toFunctionSchema)
                .toList();
    }

    // ── Invocation ──────────────────────────────────────────────────

    /**
     * Routes a call to the handler that owns the tool. Never throws; every failure is an
     * error {@link ToolResult}.
     */
    public ToolResult callTool(String toolName, Map<String, Object> arguments) {
        String handlerName = toolName != null ? toolMap.get(toolName) : null;
        if (handlerName == null) {
            return ToolResult.error(ErrorKind.UNKNOWN_TOOL, "Unknown tool: " + toolName);
        }

        Optional<ToolHandler> handler = directory.get(handlerName);
        if (handler.isEmpty() || failedHandlers.contains(handlerName)) {
            return ToolResult.error(ErrorKind.HANDLER_UNAVAILABLE, "Handler '" + handlerName + "' is unavailable");
        }

        ToolResult result = invoke(handler.get(), toolName, arguments != null ? arguments : Map.of());
        recordOutcome(handlerName, result);
        return result;
    }

    private ToolResult invoke(ToolHandler handler, String toolName, Map<String, Object> arguments) {
        MdcContext.setToolHandler(handler.name());
        try {
            ToolResult result = handler.callTool(toolName, arguments);
            if (result == null) {
                return ToolResult.error(ErrorKind.HANDLER_FAULT,
                        "Handler '" + handler.name() + "' returned no result for " + toolName);
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Handler '{}' threw while calling {}: {}", handler.name(), toolName, e.getMessage(), e);
            return ToolResult.error(ErrorKind.HANDLER_FAULT,
                    "Handler '" + handler.name() + "' failed: " + describe(e));
        } finally {
            MdcContext.clearToolHandler();
        }
    }

    private void recordOutcome(String handlerName, ToolResult result) {
        if (metrics != null) {
            metrics.recordToolCall(handlerName, !result.isError());
        }
        boolean tripped = false;
        int count;
        synchronized (mutex) {
            if (result.isError()) {
                count = errorCounts.merge(handlerName, 1, Integer::sum);
                if (count >= circuitBreakerThreshold) {
                    tripped = failedHandlers.add(handlerName);
                }
            } else {
                count = 0;
                errorCounts.put(handlerName, 0);
            }
        }
        if (tripped) {
            log.warn("Circuit breaker tripped for handler '{}' after {} errors", handlerName, count);
            notice("tool.handler.disabled", handlerName,
                    "Tool handler '" + handlerName + "' disabled after " + count + " consecutive failures");
            if (metrics != null) {
                metrics.recordCircuitBreak(handlerName, "errors");
            }
        }
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    /**
     * Disconnects every connected handler, then forgets all routing, counters and broken
     * marks. A handler failing to disconnect is logged and does not stop the others.
     */
    public void shutdownAll() {
        for (ToolHandler handler : directory.listAll()) {
            if (!connectedHandlers.contains(handler.name())) {
                continue;
            }
            try {
                handler.disconnect();
                log.info("Tool handler '{}' disconnected", handler.name());
            } catch (Exception e) {
                log.warn("Error disconnecting handler '{}': {}", handler.name(), e.getMessage());
            }
        }
        synchronized (mutex) {
            connectedHandlers.clear();
            toolMap.clear();
            errorCounts.clear();
            failedHandlers.clear();
        }
    }

    @Override
    public void close() {
        shutdownAll();
    }

    // ── Diagnostics ─────────────────────────────────────────────────

    public boolean isBroken(String handlerName) {
        return failedHandlers.contains(handlerName);
    }

    public boolean isConnected(String handlerName) {
        return connectedHandlers.contains(handlerName);
    }

    public int consecutiveErrors(String handlerName) {
        return errorCounts.getOrDefault(handlerName, 0);
    }

    public Optional<String> handlerForTool(String toolName) {
        return Optional.ofNullable(toolMap.get(toolName));
    }

    public int circuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public ToolDirectory directory() {
        return directory;
    }

    // ── Internal ────────────────────────────────────────────────────

    private void ensureConnected(ToolHandler handler) {
        String handlerName = handler.name();
        String failure = null;
        synchronized (mutex) {
            if (connectedHandlers.contains(handlerName) || failedHandlers.contains(handlerName)) {
                return;
            }
            MdcContext.setToolHandler(handlerName);
            try {
                handler.connect();
                if (handler.isConnected()) {
                    connectedHandlers.add(handlerName);
                    log.info("Tool handler '{}' connected", handlerName);
                } else {
                    failedHandlers.add(handlerName);
                    failure = "connect() completed but the handler reports not connected";
                }
            } catch (Exception e) {
                failedHandlers.add(handlerName);
                failure = describe(e);
            } finally {
                MdcContext.clearToolHandler();
            }
        }
        if (failure != null) {
            log.warn("Failed to connect tool handler '{}': {}", handlerName, failure);
            notice("tool.handler.connect_failed", handlerName,
                    "Tool handler '" + handlerName + "' failed to connect: " + failure);
            if (metrics != null) {
                metrics.recordCircuitBreak(handlerName, "connect");
            }
        }
    }

    private List<ToolDefinition> listToolsSafely(ToolHandler handler) {
        try {
            List<ToolDefinition> tools = handler.listTools();
            return tools != null ? tools : List.of();
        } catch (RuntimeException e) {
            log.warn("Tool listing failed for handler '{}': {}", handler.name(), e.getMessage());
            return List.of();
        }
    }

    private void notice(String eventType, String handlerName, String message) {
        eventBus.publish(SwitchboardEvent.of(eventType, SwitchboardEvent.TOOLS_SCOPE, handlerName,
                Map.of("handler", handlerName, "message", message)));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
