package com.switchboard.tools;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for tool handlers.
 * Reports each handler as UP, BROKEN or idle; any broken handler degrades the status.
 */
@Component
public class ToolHandlerHealthIndicator implements HealthIndicator {

    private final ToolConnectionManager manager;

    public ToolHandlerHealthIndicator(ToolConnectionManager manager) {
        this.manager = manager;
    }

    @Override
    public Health health() {
        var handlers = manager.directory().listAll();
        if (handlers.isEmpty()) {
            return Health.unknown().withDetail("reason", "no tool handlers registered").build();
        }

        var builder = Health.up();
        boolean anyBroken = false;

        for (ToolHandler handler : handlers) {
            String name = handler.name();
            if (manager.isBroken(name)) {
                builder.withDetail(name, "BROKEN (" + manager.consecutiveErrors(name) + " consecutive errors)");
                anyBroken = true;
            } else if (manager.isConnected(name)) {
                builder.withDetail(name, handler.healthCheck() ? "UP" : "DOWN: health check failed");
            } else {
                builder.withDetail(name, "idle (not connected yet)");
            }
        }

        return anyBroken ? builder.status("DEGRADED").build() : builder.build();
    }
}
