package com.switchboard.tools;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.tools.ToolResult.ErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ToolConnectionManagerTest {

    private ToolRegistry registry;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private List<SwitchboardEvent> notices;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        notices = new CopyOnWriteArrayList<>();
        eventBus.subscribe(SwitchboardEvent.TOOLS_SCOPE, notices::add);
    }

    private ToolConnectionManager manager() {
        return new ToolConnectionManager(registry, eventBus, new SwitchboardMetrics(meterRegistry),
                ToolConnectionManager.DEFAULT_CIRCUIT_BREAKER_THRESHOLD);
    }

    private List<String> noticeTypes() {
        return notices.stream().map(SwitchboardEvent::eventType).toList();
    }

    // -- Discovery ------------------------------------------------------------

    @Nested
    @DisplayName("getToolsForScope")
    class Discovery {

        @Test
        @DisplayName("connects lazily on first discovery only")
        void lazyConnect() {
            var docs = new FakeToolHandler(ToolHandlerConfig.of("docs"), "search");
            registry.registerBuiltin(docs);
            var manager = manager();

            assertEquals(0, docs.connectCalls());
            manager.getToolsForScope(null, null);
            manager.getToolsForScope(null, null);

            assertEquals(1, docs.connectCalls());
            assertTrue(manager.isConnected("docs"));
        }

        @Test
        @DisplayName("stages=[build] handler serves build and no-stage scopes only")
        void scopeFilter() {
            var compiler = new FakeToolHandler(ToolHandlerConfig.of("compiler").withStages(List.of("build")), "compile");
            registry.registerBuiltin(compiler);
            var manager = manager();

            assertEquals(List.of("compile"), names(manager.getToolsForScope("build", null)));
            assertTrue(manager.getToolsForScope("design", null).isEmpty());
            assertEquals(List.of("compile"), names(manager.getToolsForScope(null, null)));
        }

        @Test
        @DisplayName("out-of-scope handler is never connected")
        void outOfScopeNotConnected() {
            var compiler = new FakeToolHandler(ToolHandlerConfig.of("compiler").withStages(List.of("build")), "compile");
            registry.registerBuiltin(compiler);

            manager().getToolsForScope("design", null);

            assertEquals(0, compiler.connectCalls());
        }

        @Test
        @DisplayName("echo collision: first handler wins and receives the calls")
        void toolNameCollision() {
            var h1 = new FakeToolHandler(ToolHandlerConfig.of("h1"), "echo");
            var h2 = new FakeToolHandler(ToolHandlerConfig.of("h2"), "echo", "shout");
            registry.registerBuiltin(h1);
            registry.registerBuiltin(h2);
            var manager = manager();

            var tools = manager.getToolsForScope(null, null);

            assertEquals(List.of("echo", "shout"), names(tools));
            assertEquals("h1", tools.get(0).handlerName());
            assertEquals("h1", manager.handlerForTool("echo").orElseThrow());

            ToolResult result = manager.callTool("echo", Map.of());
            assertEquals("h1:echo", result.content());
            assertEquals(1, h1.callCount());
            assertEquals(0, h2.callCount());
        }

        @Test
        @DisplayName("rediscovery keeps the same owner and returns the tool again")
        void rediscoveryStable() {
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("h1"), "echo"));
            var manager = manager();

            manager.getToolsForScope(null, null);
            var again = manager.getToolsForScope(null, null);

            assertEquals(List.of("echo"), names(again));
        }

        @Test
        @DisplayName("throwing connect marks the handler broken and publishes a notice")
        void connectFailure() {
            var bad = new FakeToolHandler(ToolHandlerConfig.of("bad"), "x")
                    .failConnectWith(new IOException("connection refused"));
            var good = new FakeToolHandler(ToolHandlerConfig.of("good"), "y");
            registry.registerBuiltin(bad);
            registry.registerBuiltin(good);
            var manager = manager();

            var tools = manager.getToolsForScope(null, null);

            assertEquals(List.of("y"), names(tools));
            assertTrue(manager.isBroken("bad"));
            assertEquals(List.of("tool.handler.connect_failed"), noticeTypes());
            assertTrue(notices.get(0).payload().get("message").toString().contains("connection refused"));

            manager.getToolsForScope(null, null);
            assertEquals(1, bad.connectCalls());
        }

        @Test
        @DisplayName("connect that leaves the handler disconnected marks it broken")
        void silentConnectFailure() {
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("quiet"), "x").connectSilentlyFails());
            var manager = manager();

            assertTrue(manager.getToolsForScope(null, null).isEmpty());
            assertTrue(manager.isBroken("quiet"));
            assertFalse(manager.isConnected("quiet"));
        }

        @Test
        @DisplayName("tool listing failure yields no tools from that handler")
        void listingFailure() {
            ToolHandler flaky = mock(ToolHandler.class);
            when(flaky.name()).thenReturn("flaky");
            when(flaky.isConnected()).thenReturn(true);
            when(flaky.matchesScope(any(), any())).thenReturn(true);
            when(flaky.listTools()).thenThrow(new IllegalStateException("stream closed"));
            registry.registerBuiltin(flaky);
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("ok"), "fine"));

            assertEquals(List.of("fine"), names(manager().getToolsForScope(null, null)));
        }

        @Test
        @DisplayName("a nameless tool drops only its own handler's tools")
        void namelessToolContained() {
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("sloppy"), "ignored") {
                @Override
                public List<ToolDefinition> listTools() {
                    return List.of(new ToolDefinition(null, "no name", Map.of(), name()));
                }
            });
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("ok"), "fine"));
            var manager = manager();

            assertEquals(List.of("fine"), names(manager.getToolsForScope(null, null)));
            assertFalse(manager.isBroken("sloppy"));
        }

        @Test
        @DisplayName("tool definitions require a name")
        void definitionRequiresName() {
            assertThrows(IllegalArgumentException.class, () -> new ToolDefinition(null, "d", Map.of(), "h"));
            assertThrows(IllegalArgumentException.class, () -> new ToolDefinition("  ", "d", Map.of(), "h"));
        }

        @Test
        @DisplayName("schema form wraps each tool as a function")
        void schemaForm() {
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("docs"), "search"));

            var schema = manager().getToolsAsSchema(null, null);

            assertEquals(1, schema.size());
            assertEquals("function", schema.get(0).get("type"));
            @SuppressWarnings("unchecked")
            var function = (Map<String, Object>) schema.get(0).get("function");
            assertEquals("search", function.get("name"));
            assertEquals("search from docs", function.get("description"));
            assertEquals("object", ((Map<?, ?>) function.get("parameters")).get("type"));
        }

        @Test
        @DisplayName("empty input schema defaults to an empty object schema")
        void schemaDefaultParameters() {
            var definition = new ToolDefinition("ping", null, Map.of(), "h");

            var function = (Map<?, ?>) definition.toFunctionSchema().get("function");

            assertEquals(Map.of("type", "object", "properties", Map.of()), function.get("parameters"));
            assertEquals("", function.get("description"));
        }
    }

    // -- Invocation and circuit breaking ---------------------------------------

    @Nested
    @DisplayName("callTool")
    class Invocation {

        @Test
        @DisplayName("unknown tool returns UNKNOWN_TOOL without raising")
        void unknownTool() {
            ToolResult result = manager().callTool("nope", Map.of());

            assertTrue(result.isError());
            assertEquals(ErrorKind.UNKNOWN_TOOL, result.errorKind());
            assertEquals("Unknown tool: nope", result.errorMessage());
        }

        @Test
        @DisplayName("three consecutive errors break the handler; the fourth call never reaches it")
        void circuitBreaker() {
            var docs = new FakeToolHandler(ToolHandlerConfig.of("docs"), "search")
                    .respondWith(ToolResult.error("timeout"));
            registry.registerBuiltin(docs);
            var manager = manager();
            manager.getToolsForScope(null, null);

            for (int i = 0; i < 3; i++) {
                assertEquals(ErrorKind.HANDLER_ERROR, manager.callTool("search", Map.of()).errorKind());
            }
            ToolResult fourth = manager.callTool("search", Map.of());

            assertEquals(3, docs.callCount());
            assertTrue(manager.isBroken("docs"));
            assertEquals(ErrorKind.HANDLER_UNAVAILABLE, fourth.errorKind());
            assertEquals("Handler 'docs' is unavailable", fourth.errorMessage());
            assertEquals(List.of("tool.handler.disabled"), noticeTypes());
            assertEquals(1.0, meterRegistry.find("switchboard.tool.circuit_breaks").tag("handler", "docs").counter().count());
        }

        @Test
        @DisplayName("a success resets the consecutive error count")
        void resetOnSuccess() {
            var docs = new FakeToolHandler(ToolHandlerConfig.of("docs"), "search").respondWith(
                    ToolResult.error("e1"), ToolResult.error("e2"), ToolResult.success("ok"),
                    ToolResult.error("e3"), ToolResult.error("e4"), ToolResult.success("ok"));
            registry.registerBuiltin(docs);
            var manager = manager();
            manager.getToolsForScope(null, null);

            for (int i = 0; i < 5; i++) {
                manager.callTool("search", Map.of());
            }
            assertEquals(2, manager.consecutiveErrors("docs"));

            ToolResult sixth = manager.callTool("search", Map.of());

            assertFalse(sixth.isError());
            assertEquals(0, manager.consecutiveErrors("docs"));
            assertFalse(manager.isBroken("docs"));
            assertEquals(6, docs.callCount());
        }

        @Test
        @DisplayName("a throwing handler yields HANDLER_FAULT and counts as a failure")
        void throwingHandler() {
            var docs = new FakeToolHandler(ToolHandlerConfig.of("docs"), "search")
                    .throwOnCall(new IllegalStateException("socket reset"));
            registry.registerBuiltin(docs);
            var manager = manager();
            manager.getToolsForScope(null, null);

            ToolResult result = manager.callTool("search", Map.of());

            assertEquals(ErrorKind.HANDLER_FAULT, result.errorKind());
            assertTrue(result.errorMessage().contains("socket reset"));
            assertEquals(1, manager.consecutiveErrors("docs"));
        }

        @Test
        @DisplayName("success metadata with null values is a success, not a fault")
        void nullMetadataValues() {
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("meta"), "trace") {
                @Override
                public ToolResult callTool(String toolName, Map<String, Object> arguments) {
                    var metadata = new HashMap<String, Object>();
                    metadata.put("trace", null);
                    return ToolResult.success("ok", metadata);
                }
            });
            var manager = manager();
            manager.getToolsForScope(null, null);

            ToolResult result = null;
            for (int i = 0; i < 3; i++) {
                result = manager.callTool("trace", Map.of());
            }

            assertFalse(result.isError());
            assertEquals("ok", result.content());
            assertTrue(result.metadata().containsKey("trace"));
            assertNull(result.metadata().get("trace"));
            assertFalse(manager.isBroken("meta"));
            assertEquals(0, manager.consecutiveErrors("meta"));
        }

        @Test
        @DisplayName("breaking one handler leaves the others callable")
        void breakerIsPerHandler() {
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("bad"), "broken")
                    .respondWith(ToolResult.error("no")));
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("good"), "working"));
            var manager = manager();
            manager.getToolsForScope(null, null);

            for (int i = 0; i < 4; i++) {
                manager.callTool("broken", Map.of());
            }

            assertFalse(manager.callTool("working", Map.of()).isError());
            assertFalse(manager.isBroken("good"));
        }

        @Test
        @DisplayName("broken handler is skipped by later discovery")
        void brokenHandlerSkipped() {
            registry.registerBuiltin(new FakeToolHandler(ToolHandlerConfig.of("bad"), "broken")
                    .respondWith(ToolResult.error("no")));
            var manager = manager();
            manager.getToolsForScope(null, null);
            for (int i = 0; i < 3; i++) {
                manager.callTool("broken", Map.of());
            }

            assertTrue(manager.getToolsForScope(null, null).isEmpty());
        }

        @Test
        @DisplayName("configurable threshold")
        void customThreshold() {
            var docs = new FakeToolHandler(ToolHandlerConfig.of("docs"), "search")
                    .respondWith(ToolResult.error("no"));
            registry.registerBuiltin(docs);
            var manager = new ToolConnectionManager(registry, eventBus, null, 1);
            manager.getToolsForScope(null, null);

            manager.callTool("search", Map.of());

            assertTrue(manager.isBroken("docs"));
            assertEquals(1, manager.circuitBreakerThreshold());
        }

        @Test
        @DisplayName("threshold below 1 is rejected")
        void invalidThreshold() {
            assertThrows(IllegalArgumentException.class, () -> new ToolConnectionManager(registry, eventBus, null, 0));
        }

        @Test
        @DisplayName("concurrent calls are counted exactly")
        void concurrentCalls() throws Exception {
            var docs = new FakeToolHandler(ToolHandlerConfig.of("docs"), "search");
            registry.registerBuiltin(docs);
            var manager = manager();
            manager.getToolsForScope(null, null);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                var futures = new ArrayList<Future<ToolResult>>();
                for (int i = 0; i < 100; i++) {
                    futures.add(pool.submit(() -> manager.callTool("search", Map.of())));
                }
                for (var f : futures) {
                    assertFalse(f.get().isError());
                }
            } finally {
                pool.shutdown();
            }

            assertEquals(100, docs.callCount());
            assertEquals(100.0, meterRegistry.find("switchboard.tool.calls").tag("result", "success").counter().count());
        }
    }

    // -- Shutdown -------------------------------------------------------------

    @Nested
    @DisplayName("shutdownAll")
    class Shutdown {

        @Test
        @DisplayName("disconnects connected handlers only")
        void disconnectsConnected() {
            var used = new FakeToolHandler(ToolHandlerConfig.of("used"), "a");
            var unused = new FakeToolHandler(ToolHandlerConfig.of("unused").withStages(List.of("deploy")), "b");
            registry.registerBuiltin(used);
            registry.registerBuiltin(unused);
            var manager = manager();
            manager.getToolsForScope("build", null);

            manager.shutdownAll();

            assertEquals(1, used.disconnectCalls());
            assertEquals(0, unused.disconnectCalls());
            assertFalse(manager.isConnected("used"));
        }

        @Test
        @DisplayName("a failing disconnect does not stop the others and state is cleared")
        void disconnectErrorsIsolated() {
            var first = new FakeToolHandler(ToolHandlerConfig.of("first"), "a")
                    .failDisconnectWith(new IOException("already closed"));
            var second = new FakeToolHandler(ToolHandlerConfig.of("second"), "b");
            registry.registerBuiltin(first);
            registry.registerBuiltin(second);
            var manager = manager();
            manager.getToolsForScope(null, null);

            assertDoesNotThrow(manager::shutdownAll);

            assertEquals(1, second.disconnectCalls());
            assertTrue(manager.handlerForTool("a").isEmpty());
            assertEquals(ErrorKind.UNKNOWN_TOOL, manager.callTool("b", Map.of()).errorKind());
        }

        @Test
        @DisplayName("shutdown forgets broken marks so handlers reconnect on next discovery")
        void shutdownResetsBreaker() {
            var docs = new FakeToolHandler(ToolHandlerConfig.of("docs"), "search")
                    .respondWith(ToolResult.error("no"));
            registry.registerBuiltin(docs);
            var manager = manager();
            manager.getToolsForScope(null, null);
            for (int i = 0; i < 3; i++) {
                manager.callTool("search", Map.of());
            }

            manager.shutdownAll();

            assertFalse(manager.isBroken("docs"));
            assertEquals(0, manager.consecutiveErrors("docs"));
            assertEquals(List.of("search"), names(manager.getToolsForScope(null, null)));
            assertEquals(2, docs.connectCalls());
        }

        @Test
        @DisplayName("try-with-resources shuts down on exit")
        void tryWithResources() {
            var docs = new FakeToolHandler(ToolHandlerConfig.of("docs"), "search");
            registry.registerBuiltin(docs);

            try (var manager = manager()) {
                manager.getToolsForScope(null, null);
                manager.callTool("search", Map.of());
            }

            assertEquals(1, docs.disconnectCalls());
            assertFalse(docs.isConnected());
        }
    }

    private static List<String> names(List<ToolDefinition> tools) {
        return tools.stream().map(ToolDefinition::name).toList();
    }
}
