package com.switchboard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for plan execution and tool dispatch.
 */
@Service
public class SwitchboardMetrics {

    private final MeterRegistry registry;

    public SwitchboardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String worker, long ms) {
        Timer.builder("switchboard.task.duration")
                .tag("worker", worker)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskResult(String status) {
        Counter.builder("switchboard.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records a wave of ready tasks submitted together to the worker pool.
     *
     * @param size number of tasks in the wave
     */
    public void recordWave(int size) {
        DistributionSummary.builder("switchboard.wave.size")
                .description("Ready tasks submitted per wave")
                .register(registry)
                .record(size);
    }

    /**
     * Records a fallback to sequential execution after the ready set came up empty.
     *
     * @param remaining tasks that were still waiting when the fallback kicked in
     */
    public void recordCycleFallback(int remaining) {
        Counter.builder("switchboard.scheduler.cycle_fallbacks")
                .description("Sequential fallbacks caused by dependency cycles")
                .register(registry)
                .increment();
        DistributionSummary.builder("switchboard.scheduler.cycle_fallback_tasks")
                .register(registry)
                .record(remaining);
    }

    public void recordDelegation(String to) {
        Counter.builder("switchboard.delegations.total")
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordToolCall(String handler, boolean success) {
        Counter.builder("switchboard.tool.calls")
                .tag("handler", handler)
                .tag("result", success ? "success" : "error")
                .register(registry)
                .increment();
    }

    public void recordCircuitBreak(String handler, String reason) {
        Counter.builder("switchboard.tool.circuit_breaks")
                .description("Tool handlers disabled by the circuit breaker")
                .tag("handler", handler)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
