package com.advisor.chase.service;

import com.advisor.chase.config.MetricsConfig;
import com.advisor.chase.engine.DelayPredictor;
import com.advisor.chase.exception.PersistenceUnavailableException;
import com.advisor.chase.model.AgentStatus;
import com.advisor.chase.model.AgentType;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ProcessOutcome;
import com.advisor.chase.model.TickSummary;
import com.advisor.chase.registry.ChaseItemRegistry;
import com.advisor.chase.registry.Lease;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives chase items through their lifecycle.
 *
 * Each tick selects the due items, ranks them (overdue and escalated first, then priority,
 * fresh risk, due time), leases them in that order and hands them to the worker pool.
 * A persistence failure halts scheduling until {@link #resume()} is called.
 */
@Service
public class ChaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChaseOrchestrator.class);

    private final ChaseItemRegistry registry;
    private final ChaseItemProcessor processor;
    private final DelayPredictor predictor;
    private final ProviderProfileService profileService;
    private final ExecutorService workerPool;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private final AtomicLong itemsProcessed = new AtomicLong();
    private volatile String lastAction;
    private volatile long lastActionAt;

    public ChaseOrchestrator(ChaseItemRegistry registry, ChaseItemProcessor processor, DelayPredictor predictor,
                             ProviderProfileService profileService,
                             @Qualifier("chaseWorkerPool") ExecutorService workerPool,
                             Tracer tracer, MetricsConfig metricsConfig, Clock clock) {
        this.registry = registry;
        this.processor = processor;
        this.predictor = predictor;
        this.profileService = profileService;
        this.workerPool = workerPool;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "chase.tick", contextualName = "orchestrator-tick")
    public TickSummary tick() {
        long now = clock.millis();
        if (halted.get()) {
            log.warn("Tick skipped: scheduling is halted after a persistence failure");
            return TickSummary.builder().startedAt(now).halted(true).build();
        }
        if (!ticking.compareAndSet(false, true)) {
            log.warn("Tick skipped: previous tick still running");
            return TickSummary.builder().startedAt(now).build();
        }

        try {
            List<ChaseItem> due = rank(registry.findDue(now), now);
            List<Lease> leases = new ArrayList<>();
            int skipped = 0;
            for (ChaseItem item : due) {
                Optional<Lease> lease = registry.tryLease(item.getId());
                if (lease.isPresent()) {
                    leases.add(lease.get());
                } else {
                    skipped++;
                }
            }

            int processed = 0;
            int conflicts = 0;
            try {
                List<Callable<ProcessOutcome>> tasks = new ArrayList<>();
                for (Lease lease : leases) {
                    tasks.add(() -> runLeased(lease));
                }
                for (Future<ProcessOutcome> future : workerPool.invokeAll(tasks)) {
                    ProcessOutcome outcome = outcomeOf(future);
                    if (outcome == null) continue;
                    if (outcome.getResult() == ProcessOutcome.Result.PROCESSED) processed++;
                    if (outcome.getResult() == ProcessOutcome.Result.CONFLICT) conflicts++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Tick interrupted with {} items leased", leases.size());
            } finally {
                leases.forEach(registry::release);
            }

            itemsProcessed.addAndGet(processed);
            lastAction = "tick: " + processed + "/" + due.size() + " processed";
            lastActionAt = now;
            metricsConfig.recordTick(due.size(), processed);
            if (!due.isEmpty()) {
                log.info("Tick complete: due={}, leased={}, processed={}, conflicts={}, skipped={}",
                        due.size(), leases.size(), processed, conflicts, skipped);
            }

            return TickSummary.builder()
                    .startedAt(now)
                    .dueCount(due.size())
                    .leasedCount(leases.size())
                    .processedCount(processed)
                    .conflictCount(conflicts)
                    .skippedCount(skipped)
                    .halted(halted.get())
                    .build();
        } finally {
            ticking.set(false);
        }
    }

    /**
     * Evaluate one item now, regardless of its next action time, under the same leasing
     * rules as a tick.
     *
     * @throws IllegalStateException when scheduling is halted
     */
    public ProcessOutcome processNow(String itemId) {
        if (halted.get()) {
            throw new IllegalStateException("Orchestrator is halted after a persistence failure; resume it first");
        }
        Optional<ChaseItem> current = registry.get(itemId);
        if (current.isEmpty()) {
            return ProcessOutcome.builder().itemId(itemId).result(ProcessOutcome.Result.NOT_FOUND).build();
        }
        if (current.get().isTerminal()) {
            return ProcessOutcome.builder().itemId(itemId)
                    .result(ProcessOutcome.Result.NOOP_TERMINAL).item(current.get()).build();
        }

        Optional<Lease> lease = registry.tryLease(itemId);
        if (lease.isEmpty()) {
            return ProcessOutcome.builder().itemId(itemId)
                    .result(ProcessOutcome.Result.SKIPPED_LEASED).item(current.get()).build();
        }
        try {
            ProcessOutcome outcome = runLeased(lease.get());
            if (outcome.getResult() == ProcessOutcome.Result.PROCESSED) {
                itemsProcessed.incrementAndGet();
            }
            return outcome;
        } finally {
            registry.release(lease.get());
        }
    }

    public void resume() {
        if (halted.compareAndSet(true, false)) {
            metricsConfig.updateSchedulerHalted(false);
            log.info("Orchestrator resumed");
        }
    }

    public boolean isHalted() {
        return halted.get();
    }

    public AgentStatus getStatus() {
        String status = halted.get() ? "halted" : ticking.get() ? "busy" : "idle";
        return AgentStatus.builder()
                .agentType(AgentType.ORCHESTRATOR)
                .status(status)
                .lastAction(lastAction)
                .lastActionAt(lastActionAt)
                .itemsProcessed(itemsProcessed.get())
                .build();
    }

    /**
     * Processing order within a tick. Risk is recomputed here so ordering reflects the
     * current time rather than the score stored at the last evaluation.
     */
    List<ChaseItem> rank(List<ChaseItem> due, long now) {
        Map<String, Double> risk = new HashMap<>();
        for (ChaseItem item : due) {
            double score = predictor.assess(item, profileService.getProfile(item.getProviderRef()), now).getScore();
            risk.put(item.getId(), score);
        }

        Comparator<ChaseItem> order = Comparator
                .comparing((ChaseItem i) -> i.getStatus().isUrgent()).reversed()
                .thenComparing(Comparator.comparing(ChaseItem::getPriority).reversed())
                .thenComparing(Comparator.comparingDouble((ChaseItem i) -> risk.get(i.getId())).reversed())
                .thenComparingLong(ChaseItem::getNextActionAt)
                .thenComparing(ChaseItem::getId);

        List<ChaseItem> ranked = new ArrayList<>(due);
        ranked.sort(order);
        return ranked;
    }

    private ProcessOutcome runLeased(Lease lease) {
        if (halted.get()) {
            return ProcessOutcome.builder().itemId(lease.itemId())
                    .result(ProcessOutcome.Result.SKIPPED_LEASED).build();
        }

        Span span = tracer.nextSpan()
                .name("chase.process")
                .tag("chase.item.id", lease.itemId())
                .tag("chase.item.status", lease.snapshot().getStatus().name())
                .tag("chase.lease.seq", String.valueOf(lease.seq()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            ProcessOutcome outcome = processor.process(lease);
            span.tag("chase.result", outcome.getResult().name());
            return outcome;
        } catch (PersistenceUnavailableException e) {
            span.error(e);
            halt(e);
            throw e;
        } catch (RuntimeException e) {
            span.error(e);
            log.error("Error processing chase item {}: {}", lease.itemId(), e.getMessage(), e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void halt(PersistenceUnavailableException e) {
        if (halted.compareAndSet(false, true)) {
            metricsConfig.updateSchedulerHalted(true);
            log.error("Persistence unavailable, halting chase scheduling: {}", e.getMessage(), e);
        }
    }

    private ProcessOutcome outcomeOf(Future<ProcessOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.debug("Item task failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return null;
        }
    }
}
