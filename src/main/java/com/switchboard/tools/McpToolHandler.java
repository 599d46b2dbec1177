package com.switchboard.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Tool handler backed by a remote MCP server over streamable HTTP.
 * <p>
 * Authenticates with an optional bearer token. Failed calls are retried up to
 * {@link ToolHandlerConfig#maxRetries()} times and then reported as error results;
 * result text longer than {@link ToolHandlerConfig#maxResultBytes()} is truncated.
 */
public class McpToolHandler extends AbstractToolHandler {

    private static final Logger log = LoggerFactory.getLogger(McpToolHandler.class);
    private static final TypeReference<Map<String, Object>> SCHEMA_TYPE = new TypeReference<>() {};

    static final String TRUNCATION_MARKER = "\n... [truncated]";

    private final String url;
    private final String token;
    private final ObjectMapper objectMapper;

    private volatile McpSyncClient client;

    public McpToolHandler(ToolHandlerConfig config, String url, String token, ObjectMapper objectMapper) {
        super(config);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("MCP server URL must not be blank for handler " + config.name());
        }
        this.url = url;
        this.token = token;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void connect() {
        if (isConnected()) {
            return;
        }
        var transportBuilder = HttpClientStreamableHttpTransport.builder(url);
        if (token != null && !token.isBlank()) {
            transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
        }
        var newClient = McpClient.sync(transportBuilder.build())
                .requestTimeout(Duration.ofSeconds(config().timeoutSeconds()))
                .build();
        try {
            newClient.initialize();
        } catch (RuntimeException e) {
            newClient.close();
            throw e;
        }
        client = newClient;
        setConnected(true);
        log.info("MCP handler '{}' connected to {}", name(), url);
    }

    @Override
    public List<ToolDefinition> listTools() {
        McpSyncClient current = client;
        if (current == null) {
            return List.of();
        }
        var listed = current.listTools();
        if (listed.tools() == null) {
            return List.of();
        }
        return listed.tools().stream()
                .filter(tool -> {
                    if (tool.name() == null || tool.name().isBlank()) {
                        log.warn("MCP handler '{}' listed a tool without a name; skipping it", name());
                        return false;
                    }
                    return true;
                })
                .map(this::toDefinition)
                .toList();
    }

    @Override
    public ToolResult callTool(String toolName, Map<String, Object> arguments) {
        McpSyncClient current = client;
        if (current == null) {
            return ToolResult.error("MCP handler '" + name() + "' is not connected");
        }

        int attempts = config().maxRetries() + 1;
        String lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                McpSchema.CallToolResult result = current.callTool(new McpSchema.CallToolRequest(toolName, arguments));
                String text = truncate(joinText(result.content()));
                if (Boolean.TRUE.equals(result.isError())) {
                    return ToolResult.error(text.isEmpty() ? "Tool " + toolName + " reported an error" : text);
                }
                return ToolResult.success(text, Map.of("handler", name(), "attempts", attempt));
            } catch (Exception e) {
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.debug("MCP call {} on '{}' failed (attempt {}/{}): {}",
                        toolName, name(), attempt, attempts, lastError);
            }
        }
        return ToolResult.error("MCP call " + toolName + " failed after " + attempts + " attempt(s): " + lastError);
    }

    @Override
    public synchronized void disconnect() {
        McpSyncClient current = client;
        client = null;
        setConnected(false);
        if (current != null) {
            current.closeGracefully();
        }
    }

    @Override
    public boolean healthCheck() {
        McpSyncClient current = client;
        if (current == null) {
            return false;
        }
        try {
            current.ping();
            return true;
        } catch (Exception e) {
            log.debug("MCP handler '{}' ping failed: {}", name(), e.getMessage());
            return false;
        }
    }

    public String url() {
        return url;
    }

    private ToolDefinition toDefinition(McpSchema.Tool tool) {
        Map<String, Object> schema = tool.inputSchema() != null
                ? objectMapper.convertValue(tool.inputSchema(), SCHEMA_TYPE)
                : Map.of();
        return new ToolDefinition(tool.name(), tool.description(), schema, name());
    }

    private static String joinText(List<McpSchema.Content> content) {
        if (content == null) {
            return "";
        }
        var sb = new StringBuilder();
        for (McpSchema.Content item : content) {
            if (item instanceof McpSchema.TextContent text) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(text.text());
            }
        }
        return sb.toString();
    }

    String truncate(String text) {
        int limit = config().maxResultBytes();
        if (limit <= 0 || text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit) + TRUNCATION_MARKER;
    }
}
