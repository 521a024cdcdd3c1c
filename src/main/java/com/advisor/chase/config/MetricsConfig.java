package com.advisor.chase.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeItems;
    private final AtomicInteger schedulerHalted;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeItems = registry.gauge("chase.items.active", new AtomicInteger(0));
        this.schedulerHalted = registry.gauge("chase.scheduler.halted", new AtomicInteger(0));
    }

    public void recordTick(int dueCount, int processedCount) {
        Counter.builder("chase.tick.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("chase.tick.due_items")
                .register(registry)
                .record(dueCount);

        Counter.builder("chase.items.processed")
                .register(registry)
                .increment(processedCount);
    }

    public void recordTransition(String fromStatus, String toStatus) {
        Counter.builder("chase.transition.count")
                .tag("from", fromStatus)
                .tag("to", toStatus)
                .register(registry)
                .increment();
    }

    public void recordDispatch(String channel, String outcome) {
        Counter.builder("chase.dispatch.count")
                .tag("channel", channel)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordConflict(String reason) {
        Counter.builder("chase.conflict.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordLeaseSkipped() {
        Counter.builder("chase.lease.skipped")
                .register(registry)
                .increment();
    }

    public void recordDroppedEvent() {
        Counter.builder("chase.events.dropped")
                .register(registry)
                .increment();
    }

    public void recordRiskScore(String riskLevel, double score) {
        DistributionSummary.builder("chase.risk.score")
                .tag("level", riskLevel)
                .register(registry)
                .record(score);
    }

    public void updateActiveItemCount(int count) {
        activeItems.set(count);
    }

    public void updateSchedulerHalted(boolean halted) {
        schedulerHalted.set(halted ? 1 : 0);
    }
}
