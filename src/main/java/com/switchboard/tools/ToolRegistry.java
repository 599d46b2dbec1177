package com.switchboard.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-process {@link ToolDirectory} with built-in and custom layers; custom wins by name.
 * <p>
 * {@link #listAll()} keeps registration order, which decides which handler wins a tool-name
 * collision. A custom handler replacing a built-in one takes over the built-in's position.
 */
public class ToolRegistry implements ToolDirectory {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolHandler> builtin = new LinkedHashMap<>();
    private final Map<String, ToolHandler> custom = new LinkedHashMap<>();

    public synchronized void registerBuiltin(ToolHandler handler) {
        log.debug("Registering built-in tool handler: {}", handler.name());
        builtin.put(handler.name(), handler);
    }

    public synchronized void registerCustom(ToolHandler handler) {
        log.info("Custom tool handler registered: {}", handler.name());
        custom.put(handler.name(), handler);
    }

    @Override
    public synchronized Optional<ToolHandler> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        ToolHandler handler = custom.get(name);
        return Optional.ofNullable(handler != null ? handler : builtin.get(name));
    }

    @Override
    public synchronized List<ToolHandler> listAll() {
        var resolved = new LinkedHashMap<String, ToolHandler>(builtin);
        resolved.putAll(custom);
        return new ArrayList<>(resolved.values());
    }

    public synchronized boolean contains(String name) {
        return custom.containsKey(name) || builtin.containsKey(name);
    }

    public int size() {
        return listAll().size();
    }
}
