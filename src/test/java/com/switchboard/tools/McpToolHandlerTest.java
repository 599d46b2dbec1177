package com.switchboard.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Offline behaviour of {@link McpToolHandler}; nothing here opens a connection.
 */
class McpToolHandlerTest {

    private static McpToolHandler handler(ToolHandlerConfig config) {
        return new McpToolHandler(config, "http://localhost:9/mcp", "secret", new ObjectMapper());
    }

    @Test
    @DisplayName("blank URL is rejected")
    void blankUrl() {
        assertThrows(IllegalArgumentException.class,
                () -> new McpToolHandler(ToolHandlerConfig.of("docs"), " ", null, new ObjectMapper()));
    }

    @Test
    @DisplayName("calls before connect return an error result")
    void callBeforeConnect() {
        var h = handler(ToolHandlerConfig.of("docs"));

        ToolResult result = h.callTool("search", Map.of("q", "x"));

        assertTrue(result.isError());
        assertEquals(ToolResult.ErrorKind.HANDLER_ERROR, result.errorKind());
        assertTrue(result.errorMessage().contains("not connected"));
    }

    @Test
    @DisplayName("listing before connect is empty and health check fails")
    void idleHandler() {
        var h = handler(ToolHandlerConfig.of("docs"));

        assertEquals(List.of(), h.listTools());
        assertFalse(h.healthCheck());
        assertFalse(h.isConnected());
    }

    @Test
    @DisplayName("disconnect is idempotent")
    void disconnectIdempotent() {
        var h = handler(ToolHandlerConfig.of("docs"));

        assertDoesNotThrow(() -> {
            h.disconnect();
            h.disconnect();
        });
    }

    @Test
    @DisplayName("result text is truncated to maxResultBytes")
    void truncation() {
        var config = new ToolHandlerConfig("docs", null, null, true, 30, 0, 5, Map.of());
        var h = handler(config);

        assertEquals("abc", h.truncate("abc"));
        assertEquals("abcde" + McpToolHandler.TRUNCATION_MARKER, h.truncate("abcdefgh"));
    }

    @Test
    @DisplayName("scope rules come from the config")
    void scopeFromConfig() {
        var h = handler(ToolHandlerConfig.of("docs").withStages(List.of("build")));

        assertTrue(h.matchesScope("build", null));
        assertFalse(h.matchesScope("deploy", null));
        assertEquals("http://localhost:9/mcp", h.url());
    }
}
