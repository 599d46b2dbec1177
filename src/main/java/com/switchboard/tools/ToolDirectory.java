package com.switchboard.tools;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of tool handlers by name and scope.
 */
public interface ToolDirectory {

    Optional<ToolHandler> get(String name);

    /** Resolved handlers, one per name, in registration order. */
    List<ToolHandler> listAll();

    default List<ToolHandler> getForScope(String stage, String agent) {
        return listAll().stream()
                .filter(h -> h.matchesScope(stage, agent))
                .toList();
    }
}
