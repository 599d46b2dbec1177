package com.switchboard.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolHandlerHealthIndicatorTest {

    @Test
    @DisplayName("no handlers -> UNKNOWN")
    void noHandlers() {
        var indicator = new ToolHandlerHealthIndicator(new ToolConnectionManager(new ToolRegistry()));

        assertEquals(Status.UNKNOWN, indicator.health().getStatus());
    }

    @Test
    @DisplayName("connected and idle handlers -> UP with per-handler details")
    void upWithDetails() {
        var registry = new ToolRegistry();
        registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("docs"), "search"));
        registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("ci").withStages(List.of("build")), "run"));
        var manager = new ToolConnectionManager(registry);
        manager.getToolsForScope("design", null);

        var health = new ToolHandlerHealthIndicator(manager).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("UP", health.getDetails().get("docs"));
        assertTrue(health.getDetails().get("ci").toString().startsWith("idle"));
    }

    @Test
    @DisplayName("broken handler -> DEGRADED")
    void degraded() {
        var registry = new ToolRegistry();
        registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("docs"), "search")
                .respondWith(ToolResult.error("no")));
        var manager = new ToolConnectionManager(registry);
        manager.getToolsForScope(null, null);
        for (int i = 0; i < 3; i++) {
            manager.callTool("search", Map.of());
        }

        var health = new ToolHandlerHealthIndicator(manager).health();

        assertEquals("DEGRADED", health.getStatus().getCode());
        assertTrue(health.getDetails().get("docs").toString().startsWith("BROKEN"));
    }
}
