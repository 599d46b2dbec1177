package com.switchboard.tools;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool exposed by a handler.
 *
 * @param name        tool name, non-blank and unique across the manager's tool map
 * @param description human-readable description
 * @param inputSchema JSON schema of the arguments (may be empty)
 * @param handlerName the handler that serves this tool
 */
public record ToolDefinition(
    String name,
    String description,
    Map<String, Object> inputSchema,
    String handlerName
) {

    public ToolDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank (handler " + handlerName + ")");
        }
        description = description != null ? description : "";
        inputSchema = inputSchema != null ? inputSchema : Map.of();
    }

    /**
     * Function-calling form: {@code {type: function, function: {name, description, parameters}}}.
     */
    public Map<String, Object> toFunctionSchema() {
        Map<String, Object> parameters = inputSchema.isEmpty()
                ? Map.of("type", "object", "properties", Map.of())
                : inputSchema;
        var function = new LinkedHashMap<String, Object>();
        function.put("name", name);
        function.put("description", description);
        function.put("parameters", parameters);
        var schema = new LinkedHashMap<String, Object>();
        schema.put("type", "function");
        schema.put("function", function);
        return schema;
    }
}
