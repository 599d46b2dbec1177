package com.switchboard.dispatch.cli;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.tools.ToolConnectionManager;
import com.switchboard.tools.ToolDefinition;
import com.switchboard.tools.ToolProperties;
import com.switchboard.tools.ToolRegistry;
import com.switchboard.tools.ToolResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: switchboard tools [--stage S] [--agent A] [--call TOOL --arg k=v ...]
 * <p>
 * Discovers the tools visible to a scope and optionally calls one of them. Handlers are
 * connected for the duration of the command only.
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "List or call tools")
@Component
public class ToolsCommand implements Runnable {

    @Option(names = {"--stage", "-s"}, description = "Stage to scope tool discovery to")
    private String stage;

    @Option(names = {"--agent", "-a"}, description = "Agent to scope tool discovery to")
    private String agent;

    @Option(names = "--call", description = "Name of a tool to call after discovery")
    private String call;

    @Option(names = "--arg", description = "Tool argument as key=value (repeatable)")
    private Map<String, String> args = new LinkedHashMap<>();

    private final ToolRegistry registry;
    private final EventBus eventBus;
    private final SwitchboardMetrics metrics;
    private final ToolProperties properties;

    public ToolsCommand(ToolRegistry registry, EventBus eventBus,
                        @Autowired(required = false) SwitchboardMetrics metrics,
                        ToolProperties properties) {
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (registry.size() == 0) {
            ConsoleOutput.info("No tool handlers registered.");
            return;
        }

        var subscription = eventBus.subscribe(SwitchboardEvent.TOOLS_SCOPE, ConsoleOutput::event);
        try (var manager = new ToolConnectionManager(registry, eventBus, metrics,
                properties.getCircuitBreakerThreshold())) {
            List<ToolDefinition> tools = manager.getToolsForScope(stage, agent);
            if (tools.isEmpty()) {
                ConsoleOutput.info("No tools available for this scope.");
            }
            for (ToolDefinition tool : tools) {
                System.out.printf("  %-30s %-15s %s%n", tool.name(), tool.handlerName(), tool.description());
            }

            if (call != null) {
                ToolResult result = manager.callTool(call, new LinkedHashMap<>(args));
                if (result.isError()) {
                    ConsoleOutput.error(result.errorKind() + ": " + result.errorMessage());
                } else {
                    ConsoleOutput.success(call + " returned:");
                    System.out.println(result.content());
                }
            }
        } finally {
            subscription.unsubscribe();
        }
    }
}
