package com.switchboard.tools;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for tool handlers.
 * <p>
 * Each named server with a URL becomes an MCP handler. Servers marked {@code custom}
 * take precedence over built-in handlers of the same name.
 *
 * <pre>
 * switchboard:
 *   tools:
 *     enabled: true
 *     circuit-breaker-threshold: 3
 *     servers:
 *       docs:
 *         url: https://docs.example.com/mcp
 *         token: secret
 *         stages: [design, build]
 *         agents: [architect]
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "switchboard.tools")
public class ToolProperties {

    private boolean enabled = true;
    private int circuitBreakerThreshold = ToolConnectionManager.DEFAULT_CIRCUIT_BREAKER_THRESHOLD;
    private Map<String, ServerConfig> servers = new LinkedHashMap<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getCircuitBreakerThreshold() { return circuitBreakerThreshold; }
    public void setCircuitBreakerThreshold(int circuitBreakerThreshold) { this.circuitBreakerThreshold = circuitBreakerThreshold; }
    public Map<String, ServerConfig> getServers() { return servers; }
    public void setServers(Map<String, ServerConfig> servers) { this.servers = servers; }

    /**
     * Returns {@code true} when tools are enabled and at least one server has a URL.
     */
    public boolean isConfigured() {
        return enabled && servers.values().stream().anyMatch(ServerConfig::hasUrl);
    }

    public static class ServerConfig {
        private String url = "";
        private String token = "";
        private List<String> stages;
        private List<String> agents;
        private boolean enabled = true;
        private boolean custom = false;
        private int timeoutSeconds = ToolHandlerConfig.DEFAULT_TIMEOUT_SECONDS;
        private int maxRetries = ToolHandlerConfig.DEFAULT_MAX_RETRIES;
        private int maxResultBytes = ToolHandlerConfig.DEFAULT_MAX_RESULT_BYTES;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public List<String> getStages() { return stages; }
        public void setStages(List<String> stages) { this.stages = stages; }
        public List<String> getAgents() { return agents; }
        public void setAgents(List<String> agents) { this.agents = agents; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isCustom() { return custom; }
        public void setCustom(boolean custom) { this.custom = custom; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getMaxResultBytes() { return maxResultBytes; }
        public void setMaxResultBytes(int maxResultBytes) { this.maxResultBytes = maxResultBytes; }

        public boolean hasUrl() {
            return url != null && !url.isBlank();
        }

        public ToolHandlerConfig toHandlerConfig(String name) {
            return new ToolHandlerConfig(name, stages, agents, enabled,
                    timeoutSeconds, maxRetries, maxResultBytes, Map.of("url", url));
        }
    }
}
