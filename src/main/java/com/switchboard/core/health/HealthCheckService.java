package com.switchboard.core.health;

import com.switchboard.core.worker.WorkerDirectory;
import com.switchboard.tools.ToolConnectionManager;
import com.switchboard.tools.ToolHandler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final WorkerDirectory workerDirectory;
    private final ToolConnectionManager toolManager;

    public HealthCheckService(
            @Autowired(required = false) WorkerDirectory workerDirectory,
            @Autowired(required = false) ToolConnectionManager toolManager) {
        this.workerDirectory = workerDirectory;
        this.toolManager = toolManager;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkWorkers());
        results.add(checkTools());
        return results;
    }

    private HealthStatus checkWorkers() {
        if (workerDirectory == null) {
            return HealthStatus.down(HealthStatus.WORKERS, "No worker directory configured");
        }
        List<String> names = workerDirectory.listNames();
        if (names.isEmpty()) {
            return HealthStatus.degraded(HealthStatus.WORKERS, "No workers registered", Map.of());
        }
        return HealthStatus.up(HealthStatus.WORKERS,
                names.size() + " worker(s) registered", Map.of("workers", String.join(", ", names)));
    }

    private HealthStatus checkTools() {
        if (toolManager == null) {
            return HealthStatus.down(HealthStatus.TOOLS, "No tool connection manager configured");
        }
        List<ToolHandler> handlers = toolManager.directory().listAll();
        var metadata = new LinkedHashMap<String, String>();
        int broken = 0;
        for (ToolHandler handler : handlers) {
            String name = handler.name();
            if (toolManager.isBroken(name)) {
                metadata.put(name, "broken");
                broken++;
            } else if (toolManager.isConnected(name)) {
                metadata.put(name, "connected");
            } else {
                metadata.put(name, "idle");
            }
        }
        if (broken > 0) {
            return HealthStatus.degraded(HealthStatus.TOOLS,
                    broken + " of " + handlers.size() + " tool handler(s) broken", metadata);
        }
        return HealthStatus.up(HealthStatus.TOOLS,
                handlers.size() + " tool handler(s) registered", metadata);
    }
}
