package com.switchboard.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the scheduler or the tool manager.
 *
 * @param eventType event type (e.g. "task.started", "plan.cycle_fallback", "tool.handler.disabled")
 * @param scope     plan id for scheduler events, {@link #TOOLS_SCOPE} for tool manager events
 * @param subject   the task description or handler name the event is about (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SwitchboardEvent(
    String eventType,
    String scope,
    String subject,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String TOOLS_SCOPE = "tools";

    public static SwitchboardEvent of(String eventType, String scope, String subject, Map<String, Object> payload) {
        return new SwitchboardEvent(eventType, scope, subject, payload, Instant.now());
    }
}
