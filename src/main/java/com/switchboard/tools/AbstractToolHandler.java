package com.switchboard.tools;

/**
 * Base handler carrying the configuration, the connected flag and the scope rule.
 */
public abstract class AbstractToolHandler implements ToolHandler {

    private final ToolHandlerConfig config;
    private volatile boolean connected;

    protected AbstractToolHandler(ToolHandlerConfig config) {
        this.config = config;
    }

    @Override
    public ToolHandlerConfig config() {
        return config;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    protected void setConnected(boolean connected) {
        this.connected = connected;
    }

    /**
     * Disabled handlers never match. A stage list excludes stages it does not name,
     * unless it names {@code all}; an agent list excludes agents it does not name.
     * A null stage or agent is not filtered.
     */
    @Override
    public boolean matchesScope(String stage, String agent) {
        if (!config.enabled()) {
            return false;
        }
        if (stage != null && config.stages() != null
                && !config.stages().contains(stage) && !config.stages().contains("all")) {
            return false;
        }
        if (agent != null && config.agents() != null && !config.agents().contains(agent)) {
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + config.name() + "]";
    }
}
