package com.advisor.chase.service;

import com.advisor.chase.engine.agent.AgentRegistry;
import com.advisor.chase.model.Activity;
import com.advisor.chase.model.ActivityOutcome;
import com.advisor.chase.model.AnalyticsSnapshot;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseStatus;
import com.advisor.chase.registry.ActivityEventBus;
import com.advisor.chase.registry.ChaseItemRegistry;
import com.advisor.chase.registry.RegistrySnapshot;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class AnalyticsService {

    private static final long DAY_MILLIS = 86_400_000L;
    // Advisor time a manual chase would have taken
    private static final int MINUTES_SAVED_PER_ATTEMPT = 15;
    private static final int TREND_DAYS = 7;

    private static final Set<ChaseStatus> PENDING =
            EnumSet.of(ChaseStatus.CREATED, ChaseStatus.PENDING, ChaseStatus.SENT, ChaseStatus.AWAITING_RESPONSE);
    private static final Set<ChaseStatus> RESOLVED = EnumSet.of(ChaseStatus.RECEIVED, ChaseStatus.COMPLETED);

    private final ChaseItemRegistry registry;
    private final AgentRegistry agentRegistry;
    private final ActivityEventBus eventBus;
    private final Clock clock;

    public AnalyticsService(ChaseItemRegistry registry, AgentRegistry agentRegistry,
                            ActivityEventBus eventBus, Clock clock) {
        this.registry = registry;
        this.agentRegistry = agentRegistry;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Observed(name = "analytics.snapshot", contextualName = "build-analytics-snapshot")
    public AnalyticsSnapshot getSnapshot() {
        RegistrySnapshot snapshot = registry.snapshotAll();
        List<ChaseItem> items = snapshot.items();
        List<Activity> activities = snapshot.activities();

        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        long startOfToday = today.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();

        int pending = 0;
        int overdue = 0;
        int completedToday = 0;
        long totalAttempts = 0;
        double completionDaysSum = 0;
        int completionCount = 0;
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, Integer> byPriority = new LinkedHashMap<>();

        for (ChaseItem item : items) {
            byStatus.merge(item.getStatus().name(), 1, Integer::sum);
            byType.merge(item.getType().name(), 1, Integer::sum);
            byPriority.merge(item.getPriority().name(), 1, Integer::sum);
            totalAttempts += item.getAttempts();

            if (PENDING.contains(item.getStatus())) pending++;
            if (item.getStatus().isUrgent()) overdue++;
            if (RESOLVED.contains(item.getStatus())) {
                if (item.getResolvedAt() >= startOfToday) completedToday++;
                if (item.getFirstContactAt() > 0 && item.getResolvedAt() >= item.getFirstContactAt()) {
                    completionDaysSum += (item.getResolvedAt() - item.getFirstContactAt()) / (double) DAY_MILLIS;
                    completionCount++;
                }
            }
        }

        long successful = activities.stream().filter(a -> a.getOutcome() == ActivityOutcome.SUCCESS).count();
        double automationRate = activities.isEmpty() ? 0.0 : successful * 100.0 / activities.size();

        return AnalyticsSnapshot.builder()
                .totalChaseItems(items.size())
                .pendingItems(pending)
                .overdueItems(overdue)
                .completedToday(completedToday)
                .avgCompletionDays(round1(completionCount == 0 ? 0.0 : completionDaysSum / completionCount))
                .timeSavedHours(round1(totalAttempts * MINUTES_SAVED_PER_ATTEMPT / 60.0))
                .automationRate(round1(automationRate))
                .activeAgents(agentRegistry.getStatuses().size() + 1)
                .droppedEvents(eventBus.getDroppedCount())
                .statusDistribution(byStatus)
                .typeDistribution(byType)
                .priorityDistribution(byPriority)
                .dailyActivityTrend(dailyTrend(activities, today))
                .build();
    }

    private List<AnalyticsSnapshot.DailyCount> dailyTrend(List<Activity> activities, LocalDate today) {
        Map<LocalDate, Long> counts = new LinkedHashMap<>();
        for (int i = TREND_DAYS - 1; i >= 0; i--) {
            counts.put(today.minusDays(i), 0L);
        }
        for (Activity activity : activities) {
            LocalDate day = LocalDate.ofInstant(Instant.ofEpochMilli(activity.getTimestamp()), ZoneOffset.UTC);
            counts.computeIfPresent(day, (k, v) -> v + 1);
        }

        List<AnalyticsSnapshot.DailyCount> trend = new ArrayList<>();
        counts.forEach((day, count) -> trend.add(new AnalyticsSnapshot.DailyCount(day.toString(), count)));
        return trend;
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
