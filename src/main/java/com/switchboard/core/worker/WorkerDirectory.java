package com.switchboard.core.worker;

import java.util.List;
import java.util.Optional;

/**
 * Resolves workers by name, capability or best fit for a task.
 */
public interface WorkerDirectory {

    /**
     * @throws WorkerNotFoundException if no worker with that name is registered
     */
    Worker get(String name);

    List<Worker> findByCapability(String capability);

    Optional<Worker> findBestMatch(String taskText);

    List<String> listNames();
}
