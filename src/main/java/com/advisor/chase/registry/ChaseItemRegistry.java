package com.advisor.chase.registry;

import com.advisor.chase.config.ChaseEngineConfig;
import com.advisor.chase.config.MetricsConfig;
import com.advisor.chase.engine.ChaseStateMachine;
import com.advisor.chase.model.Activity;
import com.advisor.chase.model.ActivityEvent;
import com.advisor.chase.model.ActivityOutcome;
import com.advisor.chase.model.AgentType;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseItemFilter;
import com.advisor.chase.model.ChaseStatus;
import com.advisor.chase.repository.ActivityRepository;
import com.advisor.chase.repository.ChaseItemRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Authoritative store of chase items, their leases and the activity log.
 *
 * All state changes go through {@link #register}, {@link #commit} or {@link #applyExternal}
 * under the write lock: the item update and its activities are persisted, then made
 * visible together, then published. Readers take the read lock and so never observe an
 * item without the activities that produced it. Callers only ever receive snapshots.
 */
@Component
public class ChaseItemRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChaseItemRegistry.class);

    private final Map<String, ChaseItem> items = new ConcurrentHashMap<>();
    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final AtomicLong leaseSequence = new AtomicLong();

    private final ChaseItemRepository itemRepository;
    private final ActivityRepository activityRepository;
    private final ActivityLog activityLog;
    private final ActivityEventBus eventBus;
    private final ChaseEngineConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ChaseItemRegistry(ChaseItemRepository itemRepository, ActivityRepository activityRepository,
                             ActivityLog activityLog, ActivityEventBus eventBus, ChaseEngineConfig config,
                             MetricsConfig metricsConfig, Clock clock) {
        this.itemRepository = itemRepository;
        this.activityRepository = activityRepository;
        this.activityLog = activityLog;
        this.eventBus = eventBus;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Reload persisted items and activities after a restart.
     *
     * Activities are written before the item record that lists them in its history, so an
     * activity is only restored when its item's history names it. Activities left behind by
     * an item write that failed are skipped.
     */
    @PostConstruct
    public void hydrate() {
        stateLock.writeLock().lock();
        try {
            for (ChaseItem item : itemRepository.findAll()) {
                items.put(item.getId(), item);
            }
            List<Activity> restored = new ArrayList<>();
            int orphaned = 0;
            for (Activity activity : activityRepository.findAll()) {
                ChaseItem owner = items.get(activity.getItemId());
                if (owner != null && owner.getHistory() != null && owner.getHistory().contains(activity.getId())) {
                    restored.add(activity);
                } else {
                    orphaned++;
                }
            }
            activityLog.appendAll(restored);
            refreshActiveGauge();
            if (orphaned > 0) {
                log.warn("Skipped {} stored activities not referenced by their item's history", orphaned);
            }
            log.info("Chase registry hydrated: {} items, {} activities", items.size(), activityLog.size());
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    /**
     * Store a new item and move it straight from CREATED to PENDING. It is due on the next tick.
     */
    public ChaseItem register(ChaseItem draft) {
        long now = clock.millis();
        stateLock.writeLock().lock();
        try {
            String id = draft.getId();
            if (id == null || id.isBlank()) {
                do {
                    id = "CHASE-" + UUID.randomUUID().toString().substring(0, 8);
                } while (items.containsKey(id));
            } else if (items.containsKey(id)) {
                throw new IllegalArgumentException("Chase item already exists: " + id);
            }

            Activity registered = Activity.builder()
                    .id(UUID.randomUUID().toString())
                    .itemId(id)
                    .agentType(AgentType.ORCHESTRATOR)
                    .action("registered")
                    .fromStatus(ChaseStatus.CREATED)
                    .toStatus(ChaseStatus.PENDING)
                    .outcome(ActivityOutcome.SUCCESS)
                    .detail("Chase registered for " + draft.getTarget().getName())
                    .timestamp(now)
                    .build();

            ChaseItem item = draft.toBuilder()
                    .id(id)
                    .status(ChaseStatus.PENDING)
                    .attempts(0)
                    .createdAt(now)
                    .lastActionAt(0)
                    .nextActionAt(0)
                    .history(new ArrayList<>(List.of(registered.getId())))
                    .version(1)
                    .build();

            // Activities first: the item record is what makes them visible on hydrate
            activityRepository.save(registered);
            itemRepository.save(item);
            items.put(id, item);
            activityLog.append(registered);
            metricsConfig.recordTransition(ChaseStatus.CREATED.name(), ChaseStatus.PENDING.name());
            publish(registered, item, now);
            refreshActiveGauge();
            log.info("Registered chase item {} ({} {}, priority {})", id, item.getType(),
                    item.getTarget().getName(), item.getPriority());
            return item.snapshot();
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    public Optional<ChaseItem> get(String itemId) {
        stateLock.readLock().lock();
        try {
            ChaseItem item = items.get(itemId);
            return item == null ? Optional.empty() : Optional.of(item.snapshot());
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Non-terminal items whose next action time has been reached or was never set.
     */
    public List<ChaseItem> findDue(long now) {
        stateLock.readLock().lock();
        try {
            List<ChaseItem> due = new ArrayList<>();
            for (ChaseItem item : items.values()) {
                if (isDue(item, now)) {
                    due.add(item.snapshot());
                }
            }
            return due;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<ChaseItem> find(ChaseItemFilter filter) {
        long now = clock.millis();
        stateLock.readLock().lock();
        try {
            return items.values().stream()
                    .filter(i -> filter.getStatus() == null || i.getStatus() == filter.getStatus())
                    .filter(i -> filter.getType() == null || i.getType() == filter.getType())
                    .filter(i -> filter.getPriority() == null || i.getPriority() == filter.getPriority())
                    .filter(i -> filter.getClientId() == null || filter.getClientId().equals(i.getClientId()))
                    .filter(i -> filter.getProviderRef() == null || filter.getProviderRef().equals(i.getProviderRef()))
                    .filter(i -> !filter.isDueOnly() || isDue(i, now))
                    .sorted(Comparator.comparingLong(ChaseItem::getCreatedAt).reversed()
                            .thenComparing(ChaseItem::getId))
                    .limit(Math.max(0, filter.getLimit()))
                    .map(ChaseItem::snapshot)
                    .toList();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<Activity> activitiesFor(String itemId) {
        stateLock.readLock().lock();
        try {
            return activityLog.forItem(itemId);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<Activity> recentActivities(int limit) {
        stateLock.readLock().lock();
        try {
            return activityLog.recent(limit);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Items and activities read under one lock so aggregates are mutually consistent.
     */
    public RegistrySnapshot snapshotAll() {
        stateLock.readLock().lock();
        try {
            List<ChaseItem> copy = items.values().stream().map(ChaseItem::snapshot).toList();
            return new RegistrySnapshot(copy, activityLog.all());
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Take the exclusive lease on an item. Empty when the item is unknown, terminal or
     * already leased.
     */
    public Optional<Lease> tryLease(String itemId) {
        // Snapshot and claim under one read lock: no commit can interleave
        stateLock.readLock().lock();
        try {
            ChaseItem current = items.get(itemId);
            if (current == null || current.isTerminal()) {
                return Optional.empty();
            }
            Lease lease = new Lease(itemId, leaseSequence.incrementAndGet(), current.getVersion(),
                    current.snapshot(), clock.millis());
            if (leases.putIfAbsent(itemId, lease) != null) {
                metricsConfig.recordLeaseSkipped();
                log.debug("Item {} already leased, skipping", itemId);
                return Optional.empty();
            }
            return Optional.of(lease);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public void release(Lease lease) {
        leases.remove(lease.itemId(), lease);
    }

    public boolean isLeased(String itemId) {
        return leases.containsKey(itemId);
    }

    /**
     * Apply the planned update of a leased item. The plan is discarded, with no activity
     * recorded, when the item changed since the lease was taken.
     *
     * @throws IllegalStateException if the activities describe a transition outside the lifecycle
     * @throws com.advisor.chase.exception.PersistenceUnavailableException if the store rejects the write;
     *         in-memory state is left unchanged
     */
    public CommitResult commit(Lease lease, ChaseItem updated, List<Activity> activities) {
        stateLock.writeLock().lock();
        try {
            ChaseItem current = items.get(lease.itemId());
            if (current == null) {
                throw new IllegalStateException("Leased item disappeared: " + lease.itemId());
            }
            if (!leases.containsKey(lease.itemId()) || leases.get(lease.itemId()) != lease) {
                throw new IllegalStateException("Commit without holding the lease on " + lease.itemId());
            }
            if (current.getVersion() != lease.version() || current.isTerminal()) {
                metricsConfig.recordConflict("version");
                log.warn("Discarding plan for {}: version {} observed, now {} ({})",
                        lease.itemId(), lease.version(), current.getVersion(), current.getStatus());
                return CommitResult.conflict(current.snapshot());
            }

            validate(current, updated, activities);

            List<String> history = new ArrayList<>(current.getHistory());
            activities.forEach(a -> history.add(a.getId()));
            ChaseItem next = updated.toBuilder()
                    .id(current.getId())
                    .createdAt(current.getCreatedAt())
                    .history(history)
                    .version(current.getVersion() + 1)
                    .build();

            activityRepository.saveAll(activities);
            itemRepository.save(next);

            items.put(next.getId(), next);
            activityLog.appendAll(activities);
            long now = clock.millis();
            for (Activity activity : activities) {
                if (activity.isTransition()) {
                    metricsConfig.recordTransition(activity.getFromStatus().name(), activity.getToStatus().name());
                }
                publish(activity, next, now);
            }
            refreshActiveGauge();
            return CommitResult.applied(next.snapshot());
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    /**
     * Record a response or completion arriving from outside the engine. Leases are ignored:
     * an in-flight plan for the same item fails its version check at commit.
     * A terminal item is left untouched and reported as a conflict.
     *
     * @return empty when the item does not exist
     * @throws IllegalStateException when the item's current status cannot move to {@code target}
     */
    public Optional<CommitResult> applyExternal(String itemId, ChaseStatus target, String action, String detail) {
        long now = clock.millis();
        stateLock.writeLock().lock();
        try {
            ChaseItem current = items.get(itemId);
            if (current == null) {
                return Optional.empty();
            }
            if (current.isTerminal()) {
                metricsConfig.recordConflict("terminal");
                log.warn("Ignoring {} for {}: already {}", target, itemId, current.getStatus());
                return Optional.of(CommitResult.conflict(current.snapshot()));
            }
            if (!ChaseStateMachine.isAllowed(current.getStatus(), target)) {
                throw new IllegalStateException(
                        "Cannot move chase item " + itemId + " from " + current.getStatus() + " to " + target);
            }

            Activity activity = Activity.builder()
                    .id(UUID.randomUUID().toString())
                    .itemId(itemId)
                    .agentType(AgentType.EXTERNAL)
                    .action(action)
                    .fromStatus(current.getStatus())
                    .toStatus(target)
                    .channel(current.getChannel())
                    .outcome(ActivityOutcome.SUCCESS)
                    .detail(detail)
                    .attempts(current.getAttempts())
                    .riskScore(current.getRiskScore())
                    .timestamp(now)
                    .build();

            List<String> history = new ArrayList<>(current.getHistory());
            history.add(activity.getId());
            ChaseItem next = current.toBuilder()
                    .status(target)
                    .resolvedAt(now)
                    .history(history)
                    .version(current.getVersion() + 1)
                    .build();

            activityRepository.save(activity);
            itemRepository.save(next);

            items.put(itemId, next);
            activityLog.append(activity);
            metricsConfig.recordTransition(current.getStatus().name(), target.name());
            publish(activity, next, now);
            refreshActiveGauge();
            log.info("Chase item {} {} externally ({} -> {})", itemId, action, current.getStatus(), target);
            return Optional.of(CommitResult.applied(next.snapshot()));
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    private void validate(ChaseItem current, ChaseItem updated, List<Activity> activities) {
        ChaseStatus status = current.getStatus();
        for (Activity activity : activities) {
            if (activity.getFromStatus() != status) {
                throw new IllegalStateException("Activity " + activity.getAction() + " starts from "
                        + activity.getFromStatus() + " but item " + current.getId() + " is " + status);
            }
            if (activity.isTransition()) {
                if (!ChaseStateMachine.isAllowed(status, activity.getToStatus())) {
                    throw new IllegalStateException("Illegal transition " + status + " -> "
                            + activity.getToStatus() + " for " + current.getId());
                }
                status = activity.getToStatus();
            }
        }
        if (status != updated.getStatus()) {
            throw new IllegalStateException("Planned status " + updated.getStatus()
                    + " does not match activities ending in " + status + " for " + current.getId());
        }
        if (updated.getAttempts() < current.getAttempts() || updated.getAttempts() > config.getHardAttemptCap()) {
            throw new IllegalStateException("Attempt count " + updated.getAttempts() + " out of range for "
                    + current.getId());
        }
        if (updated.getPriority().ordinal() < current.getPriority().ordinal()) {
            throw new IllegalStateException("Priority of " + current.getId() + " cannot be lowered");
        }
    }

    private void publish(Activity activity, ChaseItem item, long now) {
        eventBus.publish(ActivityEvent.builder()
                .type("agent_activity")
                .activity(activity)
                .itemStatus(item.getStatus())
                .itemPriority(item.getPriority())
                .publishedAt(now)
                .build());
    }

    private void refreshActiveGauge() {
        int active = 0;
        for (ChaseItem item : items.values()) {
            if (!item.isTerminal()) active++;
        }
        metricsConfig.updateActiveItemCount(active);
    }

    private static boolean isDue(ChaseItem item, long now) {
        return !item.isTerminal() && (item.getNextActionAt() == 0 || item.getNextActionAt() <= now);
    }
}
