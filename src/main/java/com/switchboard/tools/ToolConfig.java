package com.switchboard.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.events.EventBus;
import com.switchboard.core.metrics.SwitchboardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolConfig {

    private static final Logger log = LoggerFactory.getLogger(ToolConfig.class);

    /**
     * Registers every {@link ToolHandler} bean as built-in, then one MCP handler per
     * configured server. Handlers only connect on first discovery.
     */
    @Bean
    public ToolRegistry toolRegistry(ToolProperties properties,
                                     ObjectProvider<ToolHandler> handlerBeans,
                                     ObjectProvider<ObjectMapper> objectMapper) {
        var registry = new ToolRegistry();
        handlerBeans.orderedStream().forEach(registry::registerBuiltin);

        if (!properties.isConfigured()) {
            log.info("Tool servers disabled or not configured");
            return registry;
        }

        ObjectMapper mapper = objectMapper.getIfAvailable(ObjectMapper::new);
        for (var entry : properties.getServers().entrySet()) {
            var server = entry.getValue();
            if (!server.hasUrl()) continue;

            var handler = new McpToolHandler(server.toHandlerConfig(entry.getKey()),
                    server.getUrl(), server.getToken(), mapper);
            if (server.isCustom()) {
                registry.registerCustom(handler);
            } else {
                registry.registerBuiltin(handler);
            }
            log.info("Tool server '{}' configured at {}", entry.getKey(), server.getUrl());
        }
        return registry;
    }

    @Bean(destroyMethod = "close")
    public ToolConnectionManager toolConnectionManager(ToolRegistry registry,
                                                       EventBus eventBus,
                                                       @Autowired(required = false) SwitchboardMetrics metrics,
                                                       ToolProperties properties) {
        return new ToolConnectionManager(registry, eventBus, metrics, properties.getCircuitBreakerThreshold());
    }
}
