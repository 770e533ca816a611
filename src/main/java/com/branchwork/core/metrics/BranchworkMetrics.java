package com.branchwork.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for epic and sub-task execution.
 */
@Service
public class BranchworkMetrics {

    private final MeterRegistry registry;

    public BranchworkMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Metrics backed by a private in-memory registry, for use outside a Spring context. */
    public static BranchworkMetrics inMemory() {
        return new BranchworkMetrics(new SimpleMeterRegistry());
    }

    public void recordEpicRegistered(int subTaskCount) {
        Counter.builder("branchwork.epics.registered")
                .register(registry)
                .increment();
        DistributionSummary.builder("branchwork.epic.sub_tasks")
                .description("Sub-tasks per registered epic")
                .register(registry)
                .record(subTaskCount);
    }

    /**
     * Records a finished sub-task execution.
     *
     * @param outcome "completed", "failed", "cancelled" or "denied"
     */
    public void recordSubTaskExecution(String outcome, long ms) {
        Timer.builder("branchwork.subtask.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSubTaskResult(String status) {
        Counter.builder("branchwork.subtask.results")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordPermissionDenial(String level) {
        Counter.builder("branchwork.permission.denials")
                .description("Work functions rejected before running")
                .tag("level", level)
                .register(registry)
                .increment();
    }

    public void recordBatch(int size, int maxConcurrent) {
        DistributionSummary.builder("branchwork.batch.size")
                .description("Sub-tasks per concurrent batch")
                .tag("max_concurrent", String.valueOf(maxConcurrent))
                .register(registry)
                .record(size);
    }
}
