package com.switchboard.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * An objective decomposed into ordered top-level tasks.
 * Only top-level tasks take part in dependency analysis.
 */
public class Plan {

    private final String id;
    private final String objective;
    private final List<Task> tasks = new ArrayList<>();

    public Plan(String objective) {
        this(objective, List.of());
    }

    public Plan(String objective, List<Task> tasks) {
        this.id = "PLAN-" + UUID.randomUUID().toString().substring(0, 8);
        this.objective = objective;
        this.tasks.addAll(tasks);
    }

    public String id() { return id; }
    public String objective() { return objective; }
    public List<Task> tasks() { return tasks; }

    public void addTask(Task task) {
        tasks.add(task);
    }
}
