package com.switchboard.core.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one Switchboard component: the worker directory ({@link #WORKERS}) or the
 * tool handlers behind the connection manager ({@link #TOOLS}).
 *
 * @param component {@link #WORKERS} or {@link #TOOLS}
 * @param status    overall state of the component
 * @param detail    one-line summary for the console
 * @param metadata  per-item state, e.g. handler name to {@code broken}, {@code connected} or {@code idle}
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    public static final String WORKERS = "workers";
    public static final String TOOLS = "tools";

    /** {@code DEGRADED} means usable with reduced capacity, e.g. a circuit-broken tool handler. */
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
