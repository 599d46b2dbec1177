package com.switchboard.dispatch.cli;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.Plan;
import com.switchboard.core.model.Task;
import com.switchboard.core.model.TaskStatus;
import com.switchboard.core.scheduler.PlanParser;
import com.switchboard.core.scheduler.TaskSchedulerFactory;
import com.switchboard.core.worker.ExecutionContext;
import com.switchboard.core.worker.WorkerDirectory;
import com.switchboard.tools.ToolConnectionManager;
import com.switchboard.tools.ToolProperties;
import com.switchboard.tools.ToolRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: switchboard run &lt;plan-file&gt; [--parallel] [--max-workers N]
 * <p>
 * Parses a plan in the planner's numbered text format and executes it against the
 * registered workers, printing task events as they happen.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute a plan file")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", description = "Plan file, one task per line ([worker] description)")
    private Path planFile;

    @Option(names = {"--parallel", "-p"}, description = "Run independent tasks concurrently")
    private boolean parallel;

    @Option(names = {"--max-workers", "-w"}, description = "Pool size for --parallel (default from configuration)")
    private Integer maxWorkers;

    @Option(names = {"--objective", "-o"}, description = "Objective recorded on the plan")
    private String objective;

    @Option(names = {"--project-dir", "-d"}, description = "Project directory passed to workers", defaultValue = ".")
    private String projectDir;

    private final WorkerDirectory workers;
    private final TaskSchedulerFactory schedulerFactory;
    private final ToolRegistry toolRegistry;
    private final EventBus eventBus;
    private final SwitchboardMetrics metrics;
    private final ToolProperties toolProperties;

    public RunCommand(WorkerDirectory workers, TaskSchedulerFactory schedulerFactory,
                      ToolRegistry toolRegistry, EventBus eventBus,
                      @Autowired(required = false) SwitchboardMetrics metrics,
                      ToolProperties toolProperties) {
        this.workers = workers;
        this.schedulerFactory = schedulerFactory;
        this.toolRegistry = toolRegistry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.toolProperties = toolProperties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        String planText;
        try {
            planText = Files.readString(planFile);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read plan file " + planFile + ": " + e.getMessage());
            return;
        }

        String planObjective = objective != null ? objective : planFile.getFileName().toString();
        Plan plan = PlanParser.parse(planObjective, planText, workers.listNames());
        if (plan.tasks().isEmpty()) {
            ConsoleOutput.error("Plan file contains no tasks");
            return;
        }
        ConsoleOutput.info("Plan " + plan.id() + ": " + plan.tasks().size() + " task(s)");

        var planEvents = eventBus.subscribe(plan.id(), ConsoleOutput::event);
        var toolEvents = eventBus.subscribe(SwitchboardEvent.TOOLS_SCOPE, ConsoleOutput::event);
        try (var toolManager = new ToolConnectionManager(toolRegistry, eventBus, metrics,
                toolProperties.getCircuitBreakerThreshold())) {
            var scheduler = schedulerFactory.create(new ExecutionContext(null, projectDir, toolManager));
            scheduler.checkContracts(plan).forEach(ConsoleOutput::warning);

            List<Task> results;
            try {
                if (!parallel) {
                    results = scheduler.executePlan(plan);
                } else if (maxWorkers != null) {
                    results = scheduler.executePlanParallel(plan, maxWorkers);
                } else {
                    results = scheduler.executePlanParallel(plan);
                }
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
                return;
            }

            System.out.println();
            for (int i = 0; i < results.size(); i++) {
                ConsoleOutput.task(i, results.get(i));
            }
            long failed = results.stream().filter(t -> t.status() == TaskStatus.FAILED).count();
            System.out.println("──────────────────────────────────");
            if (failed == 0) {
                ConsoleOutput.success("Plan complete.");
            } else {
                ConsoleOutput.error(failed + " of " + results.size() + " task(s) failed.");
            }
        } finally {
            planEvents.unsubscribe();
            toolEvents.unsubscribe();
        }
    }
}
