package com.switchboard.core.worker;

import com.switchboard.core.model.WorkerContract;
import com.switchboard.core.model.WorkerResult;

import java.util.Set;

/**
 * A specialized agent that can execute a natural-language task.
 * <p>
 * Implementations own their prompting and provider calls. {@link #execute} may block for
 * a long time and may throw; the scheduler catches failures at the task boundary.
 */
public interface Worker {

    String name();

    default String description() {
        return "";
    }

    /** Capability names used by {@link WorkerDirectory#findByCapability(String)}. */
    default Set<String> capabilities() {
        return Set.of();
    }

    default WorkerContract contract() {
        return WorkerContract.EMPTY;
    }

    /**
     * Scores how well this worker fits a task.
     *
     * @return a confidence in {@code [0, 1]}; 0 means "cannot handle"
     */
    double canHandle(String taskText);

    WorkerResult execute(ExecutionContext context, String taskText) throws Exception;
}
