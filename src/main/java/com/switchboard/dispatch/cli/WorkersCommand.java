package com.switchboard.dispatch.cli;

import com.switchboard.core.worker.Worker;
import com.switchboard.core.worker.WorkerRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: switchboard workers
 * <p>
 * Lists registered workers with their layer, capabilities and contract.
 */
@Command(name = "workers", mixinStandardHelpOptions = true, description = "List registered workers")
@Component
public class WorkersCommand implements Runnable {

    private final WorkerRegistry registry;

    public WorkersCommand(WorkerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var workers = registry.listAll();
        if (workers.isEmpty()) {
            ConsoleOutput.info("No workers registered.");
            return;
        }

        for (Worker worker : workers) {
            System.out.printf("  %-20s %-8s %s%n", worker.name(), registry.sourceOf(worker.name()), worker.description());
            if (!worker.capabilities().isEmpty()) {
                System.out.println("      capabilities: " + String.join(", ", worker.capabilities()));
            }
            var contract = worker.contract();
            if (!contract.inputs().isEmpty() || !contract.outputs().isEmpty()) {
                System.out.println("      inputs: " + contract.inputs() + "  outputs: " + contract.outputs());
            }
        }
        ConsoleOutput.info(workers.size() + " worker(s)");
    }
}
