package com.switchboard.core.scheduler;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.worker.ExecutionContext;
import com.switchboard.core.worker.WorkerDirectory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Creates a {@link TaskScheduler} per execution context, wired with the application's
 * worker directory, event bus, metrics and configured pool size.
 */
@Component
public class TaskSchedulerFactory {

    private final WorkerDirectory directory;
    private final EventBus eventBus;
    private final SwitchboardMetrics metrics;
    private final SchedulerProperties properties;

    public TaskSchedulerFactory(WorkerDirectory directory, EventBus eventBus,
                                @Autowired(required = false) SwitchboardMetrics metrics,
                                SchedulerProperties properties) {
        this.directory = directory;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    public TaskScheduler create(ExecutionContext context) {
        return new TaskScheduler(directory, context, eventBus, metrics, properties.getMaxWorkers());
    }
}
