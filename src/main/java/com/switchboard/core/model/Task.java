package com.switchboard.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A unit of work assigned to a worker, optionally with sub-tasks.
 * <p>
 * Owned by the {@link Plan} that contains it and mutated only by the scheduler while the
 * plan executes. Sub-tasks run after their parent completes, sequentially and depth-first.
 * Once a task reaches a terminal status it is never executed again.
 */
public class Task {

    private final String description;
    private final List<Task> subTasks = new ArrayList<>();
    private volatile String assignedWorker;
    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile WorkerResult result;
    private volatile ExecutionError error;

    public Task(String description) {
        this(description, null);
    }

    public Task(String description, String assignedWorker) {
        this.description = description;
        this.assignedWorker = assignedWorker;
    }

    public Task(String description, String assignedWorker, List<Task> subTasks) {
        this(description, assignedWorker);
        if (subTasks != null) {
            this.subTasks.addAll(subTasks);
        }
    }

    public String description() { return description; }
    public String assignedWorker() { return assignedWorker; }
    public List<Task> subTasks() { return subTasks; }
    public TaskStatus status() { return status; }
    public WorkerResult result() { return result; }
    public ExecutionError error() { return error; }

    public void addSubTask(Task subTask) {
        subTasks.add(subTask);
    }

    public void assignWorker(String worker) {
        this.assignedWorker = worker;
    }

    public void markRunning() {
        this.status = TaskStatus.RUNNING;
    }

    public void complete(WorkerResult result) {
        this.result = result;
        this.error = null;
        this.status = TaskStatus.COMPLETED;
    }

    public void fail(ExecutionError error) {
        this.error = error;
        this.result = WorkerResult.error(error.message());
        this.status = TaskStatus.FAILED;
    }

    @Override
    public String toString() {
        return "Task[" + (assignedWorker != null ? assignedWorker : "?") + ": " + description
                + " (" + status + ")]";
    }
}
