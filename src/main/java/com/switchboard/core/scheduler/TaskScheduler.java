package com.switchboard.core.scheduler;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.ConversationMessage;
import com.switchboard.core.model.ExecutionError;
import com.switchboard.core.model.ExecutionLogEntry;
import com.switchboard.core.model.Plan;
import com.switchboard.core.model.Task;
import com.switchboard.core.model.TaskStatus;
import com.switchboard.core.model.WorkerContract;
import com.switchboard.core.model.WorkerResult;
import com.switchboard.core.worker.ExecutionContext;
import com.switchboard.core.worker.Worker;
import com.switchboard.core.worker.WorkerDirectory;
import com.switchboard.core.worker.WorkerNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes plans of worker-assigned tasks, sequentially or with bounded parallelism,
 * and lets workers delegate one-off sub-tasks to each other.
 * <p>
 * One instance is bound to one {@link ExecutionContext}; its execution log lives as long
 * as the instance. Failures of a single task are recorded on the task and never stop the
 * rest of the plan.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    static final String DELEGATION_SCOPE = "delegations";

    private final WorkerDirectory directory;
    private final ExecutionContext context;
    private final EventBus eventBus;
    private final SwitchboardMetrics metrics;
    private final int defaultMaxWorkers;
    private final ExecutionJournal journal;

    public TaskScheduler(WorkerDirectory directory, ExecutionContext context) {
        this(directory, context, new EventBus(), null, 4);
    }

    public TaskScheduler(WorkerDirectory directory, ExecutionContext context, EventBus eventBus,
                         SwitchboardMetrics metrics, int defaultMaxWorkers) {
        this.directory = directory;
        this.context = context;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.defaultMaxWorkers = defaultMaxWorkers;
        this.journal = new ExecutionJournal(context.conversationHistory());
    }

    // -- Planning -------------------------------------------------------------

    /**
     * Asks the context's AI provider to decompose an objective into worker-assigned tasks.
     *
     * @param workerNames candidate workers; all registered workers when null or empty
     */
    public Plan plan(String objective, List<String> workerNames) {
        if (context.aiProvider() == null) {
            throw new IllegalStateException("Planning requires an AI provider in the execution context");
        }
        List<String> available = workerNames == null || workerNames.isEmpty()
                ? directory.listNames() : workerNames;

        var descriptions = new ArrayList<String>();
        for (String name : available) {
            try {
                Worker worker = directory.get(name);
                descriptions.add("- " + worker.name() + ": " + worker.description());
            } catch (WorkerNotFoundException e) {
                log.debug("Skipping unknown planning candidate '{}'", name);
            }
        }

        String prompt = "You are a project planner. Decompose the following objective "
                + "into discrete tasks and assign each to exactly one agent.\n\n"
                + "Objective: " + objective + "\n\n"
                + "Available agents:\n"
                + String.join("\n", descriptions) + "\n\n"
                + "Respond as a numbered list. Prefix each task with the agent "
                + "name in square brackets.  Indent sub-tasks under their parent.\n"
                + "Example:\n"
                + "1. [cloud-architect] Design the overall architecture\n"
                + "   1a. [terraform] Generate networking module\n"
                + "2. [app-developer] Build the API service\n";

        WorkerResult response = context.aiProvider().chat(
                List.of(ConversationMessage.user(prompt)), 0.2, 2048);
        Plan plan = PlanParser.parse(objective, response.content(), available);
        log.info("Planned {} top-level task(s) for objective: {}", plan.tasks().size(), objective);
        return plan;
    }

    /**
     * Checks that each worker's declared inputs are produced by an earlier task or already
     * present in the context. Warnings are informational; execution may proceed regardless.
     */
    public List<String> checkContracts(Plan plan) {
        var warnings = new ArrayList<String>();
        Set<String> available = new HashSet<>(context.artifacts().keySet());

        for (Task task : plan.tasks()) {
            String name = task.assignedWorker();
            if (name == null) continue;
            WorkerContract contract;
            try {
                contract = directory.get(name).contract();
            } catch (WorkerNotFoundException e) {
                continue;
            }
            for (String input : new TreeSet<>(contract.inputs())) {
                if (!available.contains(input)) {
                    warnings.add("Agent '" + name + "' expects artifact '" + input
                            + "' which may not be available at execution time");
                }
            }
            available.addAll(contract.outputs());
        }
        return warnings;
    }

    // -- Execution ------------------------------------------------------------

    /** Plans and then executes sequentially. */
    public List<Task> runTeam(String objective, List<String> workerNames) {
        return executePlan(plan(objective, workerNames));
    }

    /**
     * Executes every top-level task in order, each followed by its sub-tasks.
     */
    public List<Task> executePlan(Plan plan) {
        MdcContext.setPlan(plan.id());
        try {
            var tasks = plan.tasks();
            for (int i = 0; i < tasks.size(); i++) {
                executeTaskSafely(plan.id(), i, tasks.get(i));
            }
            return tasks;
        } finally {
            MdcContext.clear();
        }
    }

    public List<Task> executePlanParallel(Plan plan) {
        return executePlanParallel(plan, defaultMaxWorkers);
    }

    /**
     * Executes top-level tasks concurrently as soon as every task they depend on has
     * finished. Dependencies come from worker contracts (see {@link DependencyGraph}).
     * <p>
     * When nothing is ready, nothing is running and tasks remain, the graph has a cycle;
     * the remaining tasks then run sequentially in plan order on the calling thread.
     *
     * @param maxWorkers size of the worker pool
     * @return the plan's top-level tasks, each in a terminal state
     */
    public List<Task> executePlanParallel(Plan plan, int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
        var tasks = plan.tasks();
        if (tasks.isEmpty()) {
            return tasks;
        }

        String planId = plan.id();
        MdcContext.setPlan(planId);
        DependencyGraph graph = DependencyGraph.fromContracts(resolveContracts(tasks));
        log.info("Executing plan {} in parallel: {} task(s), maxWorkers={}, dependencies={}",
                planId, tasks.size(), maxWorkers, graph.hasEdges());

        Set<Integer> completed = new HashSet<>();
        Set<Integer> remaining = new TreeSet<>();
        for (int i = 0; i < tasks.size(); i++) remaining.add(i);

        ExecutorService executor = Executors.newFixedThreadPool(maxWorkers, new PoolThreadFactory(planId));
        CompletionService<Integer> completion = new ExecutorCompletionService<>(executor);
        Map<Future<Integer>, Integer> inFlight = new HashMap<>();

        try {
            while (!remaining.isEmpty() || !inFlight.isEmpty()) {
                List<Integer> ready = graph.ready(remaining, completed);

                if (ready.isEmpty() && inFlight.isEmpty()) {
                    runCycleFallback(plan, remaining, completed);
                    break;
                }

                if (!ready.isEmpty()) {
                    log.debug("Submitting wave {} (completed so far: {})", ready, completed);
                    if (metrics != null) {
                        metrics.recordWave(ready.size());
                    }
                    for (int index : ready) {
                        remaining.remove(index);
                        Task task = tasks.get(index);
                        inFlight.put(completion.submit(() -> {
                            try {
                                executeTask(planId, index, task);
                            } finally {
                                MdcContext.clear();
                            }
                            return index;
                        }), index);
                    }
                }

                Future<Integer> done = completion.take();
                int index = inFlight.remove(done);
                try {
                    done.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Parallel task {} failed: {}", index, cause.getMessage(), cause);
                    Task task = tasks.get(index);
                    if (!task.status().isTerminal()) {
                        failTask(planId, task, ExecutionError.execution(task.assignedWorker(), describe(cause)));
                    }
                }
                completed.add(index);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while executing plan {}; {} task(s) not submitted, {} still running",
                    planId, remaining.size(), inFlight.size());
        } finally {
            executor.shutdown();
            MdcContext.clear();
        }
        return tasks;
    }

    /**
     * Runs a sub-task on another worker against a fork of this scheduler's context.
     * Never throws for an unknown worker; returns an error result instead.
     */
    public WorkerResult delegate(String fromWorker, String toWorker, String subTask) throws Exception {
        Worker worker;
        try {
            worker = directory.get(toWorker);
        } catch (WorkerNotFoundException e) {
            log.warn("Delegation from '{}' failed: agent '{}' not found", fromWorker, toWorker);
            return WorkerResult.error("agent '" + toWorker + "' not found.");
        }

        journal.recordDelegation(fromWorker, toWorker, subTask);
        eventBus.publish(SwitchboardEvent.of("worker.delegated", DELEGATION_SCOPE, subTask,
                Map.of("from", String.valueOf(fromWorker), "to", toWorker)));
        if (metrics != null) {
            metrics.recordDelegation(toWorker);
        }
        log.info("Delegating from '{}' to '{}': {}", fromWorker, toWorker, subTask);

        ExecutionContext forked = context.fork();
        return worker.execute(forked, subTask);
    }

    /** Snapshot of everything executed or delegated by this scheduler so far. */
    public List<ExecutionLogEntry> executionLog() {
        return journal.snapshot();
    }

    public ExecutionContext context() {
        return context;
    }

    // -- Internals ------------------------------------------------------------

    private List<WorkerContract> resolveContracts(List<Task> tasks) {
        var contracts = new ArrayList<WorkerContract>(tasks.size());
        for (Task task : tasks) {
            WorkerContract contract = WorkerContract.EMPTY;
            String name = task.assignedWorker();
            if (name != null && !name.isBlank()) {
                try {
                    contract = directory.get(name).contract();
                } catch (WorkerNotFoundException e) {
                    log.debug("No contract for '{}': {}", name, e.getMessage());
                }
            }
            contracts.add(contract);
        }
        return contracts;
    }

    private void runCycleFallback(Plan plan, Set<Integer> remaining, Set<Integer> completed) {
        var pending = new ArrayList<>(remaining);
        log.warn("Dependency cycle or unsatisfiable wait in plan {}; running {} remaining task(s) sequentially: {}",
                plan.id(), pending.size(), pending);
        eventBus.publish(SwitchboardEvent.of("plan.cycle_fallback", plan.id(), null,
                Map.of("remaining", pending)));
        if (metrics != null) {
            metrics.recordCycleFallback(pending.size());
        }
        for (int index : pending) {
            executeTaskSafely(plan.id(), index, plan.tasks().get(index));
            completed.add(index);
            remaining.remove(index);
        }
    }

    /**
     * Guards the caller's thread against a worker whose scoring or contract lookup throws.
     */
    private void executeTaskSafely(String planId, int index, Task task) {
        try {
            executeTask(planId, index, task);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing task {}: {}", index, describe(e), e);
            if (!task.status().isTerminal()) {
                failTask(planId, task, ExecutionError.execution(task.assignedWorker(), describe(e)));
            }
        }
    }

    /**
     * Resolves the worker, runs the task, then its sub-tasks. Every failure is recorded on
     * the task; nothing propagates to the caller.
     */
    private void executeTask(String planId, int index, Task task) {
        if (task.status().isTerminal()) {
            log.debug("Task already {}: {}", task.status(), task.description());
            return;
        }

        String workerName = task.assignedWorker();
        if (workerName == null || workerName.isBlank()) {
            workerName = directory.findBestMatch(task.description()).map(Worker::name).orElse(null);
            if (workerName != null) {
                task.assignWorker(workerName);
                log.info("Auto-assigned '{}' to: {}", workerName, task.description());
            }
        }

        MdcContext.setTask(planId, index, workerName);
        if (workerName == null) {
            log.warn("No agent could be assigned for: {}", task.description());
            failTask(planId, task, ExecutionError.workerLookup(null,
                    "No agent could be assigned for: " + task.description()));
            return;
        }

        Worker worker;
        try {
            worker = directory.get(workerName);
        } catch (WorkerNotFoundException e) {
            log.warn("Worker lookup failed for task '{}': {}", task.description(), e.getMessage());
            failTask(planId, task, ExecutionError.workerLookup(workerName, e.getMessage()));
            return;
        }

        task.markRunning();
        journal.recordExecution(workerName, task.description());
        eventBus.publish(SwitchboardEvent.of("task.started", planId, task.description(),
                Map.of("worker", workerName, "index", index)));

        long startMs = System.currentTimeMillis();
        try {
            String enriched = journal.enrichWithPriorWork(task.description());
            WorkerResult result = worker.execute(context, enriched);
            task.complete(result != null ? result : WorkerResult.of(""));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failTask(planId, task, ExecutionError.execution(workerName, "Interrupted: " + describe(e)));
            return;
        } catch (Exception e) {
            log.error("Agent '{}' failed: {}", workerName, describe(e), e);
            failTask(planId, task, ExecutionError.execution(workerName, describe(e)));
            return;
        } finally {
            if (metrics != null) {
                metrics.recordTaskExecution(workerName, System.currentTimeMillis() - startMs);
            }
        }

        journal.appendHistory(ConversationMessage.assistant("[" + workerName + "]: " + task.result().content()));
        eventBus.publish(SwitchboardEvent.of("task.completed", planId, task.description(),
                Map.of("worker", workerName, "index", index)));
        if (metrics != null) {
            metrics.recordTaskResult(TaskStatus.COMPLETED.name());
        }

        for (Task sub : task.subTasks()) {
            executeTask(planId, index, sub);
        }
    }

    private void failTask(String planId, Task task, ExecutionError error) {
        task.fail(error);
        var payload = new HashMap<String, Object>();
        payload.put("kind", error.kind().name());
        payload.put("message", error.message());
        if (error.worker() != null) {
            payload.put("worker", error.worker());
        }
        eventBus.publish(SwitchboardEvent.of("task.failed", planId, task.description(), payload));
        if (metrics != null) {
            metrics.recordTaskResult(TaskStatus.FAILED.name());
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static final class PoolThreadFactory implements ThreadFactory {
        private final String planId;
        private final AtomicInteger counter = new AtomicInteger();

        PoolThreadFactory(String planId) {
            this.planId = planId;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "scheduler-" + planId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
