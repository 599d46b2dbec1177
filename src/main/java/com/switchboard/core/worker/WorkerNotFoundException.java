package com.switchboard.core.worker;

import java.util.List;

public class WorkerNotFoundException extends RuntimeException {

    private final String workerName;

    public WorkerNotFoundException(String workerName, List<String> available) {
        super("Agent '" + workerName + "' not found. Available: " + String.join(", ", available));
        this.workerName = workerName;
    }

    public String getWorkerName() {
        return workerName;
    }
}
