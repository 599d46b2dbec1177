package com.switchboard.tools;

import java.util.List;
import java.util.Map;

/**
 * Static configuration of one tool handler.
 *
 * @param name           unique handler name
 * @param stages         stages the handler serves, or null for all stages
 * @param agents         agents the handler serves, or null for all agents
 * @param enabled        disabled handlers never match a scope
 * @param timeoutSeconds per-request timeout used by the handler
 * @param maxRetries     attempts after the first failed request
 * @param maxResultBytes result text is truncated to this many characters
 * @param settings       handler-specific settings
 */
public record ToolHandlerConfig(
    String name,
    List<String> stages,
    List<String> agents,
    boolean enabled,
    int timeoutSeconds,
    int maxRetries,
    int maxResultBytes,
    Map<String, Object> settings
) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final int DEFAULT_MAX_RESULT_BYTES = 8192;

    public ToolHandlerConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool handler name must not be blank");
        }
        stages = stages != null ? List.copyOf(stages) : null;
        agents = agents != null ? List.copyOf(agents) : null;
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }

    /** Enabled for every stage and agent, with default limits. */
    public static ToolHandlerConfig of(String name) {
        return new ToolHandlerConfig(name, null, null, true,
                DEFAULT_TIMEOUT_SECONDS, DEFAULT_MAX_RETRIES, DEFAULT_MAX_RESULT_BYTES, Map.of());
    }

    public ToolHandlerConfig withStages(List<String> stages) {
        return new ToolHandlerConfig(name, stages, agents, enabled, timeoutSeconds, maxRetries, maxResultBytes, settings);
    }

    public ToolHandlerConfig withAgents(List<String> agents) {
        return new ToolHandlerConfig(name, stages, agents, enabled, timeoutSeconds, maxRetries, maxResultBytes, settings);
    }

    public ToolHandlerConfig withEnabled(boolean enabled) {
        return new ToolHandlerConfig(name, stages, agents, enabled, timeoutSeconds, maxRetries, maxResultBytes, settings);
    }
}
