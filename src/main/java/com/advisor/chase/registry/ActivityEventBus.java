package com.advisor.chase.registry;

import com.advisor.chase.config.ChaseEngineConfig;
import com.advisor.chase.config.MetricsConfig;
import com.advisor.chase.model.ActivityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out of committed activities to live observers. Publishing never blocks: a slow
 * observer loses events rather than holding up the orchestrator.
 */
@Component
public class ActivityEventBus {

    private static final Logger log = LoggerFactory.getLogger(ActivityEventBus.class);

    private final List<ActivitySubscription> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong droppedTotal = new AtomicLong();
    private final ChaseEngineConfig config;
    private final MetricsConfig metricsConfig;

    public ActivityEventBus(ChaseEngineConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public ActivitySubscription subscribe() {
        ActivitySubscription subscription = new ActivitySubscription(this, config.getEventBufferSize());
        subscribers.add(subscription);
        log.debug("Activity subscriber added, {} active", subscribers.size());
        return subscription;
    }

    public void publish(ActivityEvent event) {
        for (ActivitySubscription subscription : subscribers) {
            if (!subscription.offer(event)) {
                droppedTotal.incrementAndGet();
                metricsConfig.recordDroppedEvent();
                log.debug("Dropped activity event {} for a slow subscriber", event.getActivity().getId());
            }
        }
    }

    void unsubscribe(ActivitySubscription subscription) {
        subscribers.remove(subscription);
        log.debug("Activity subscriber removed, {} active", subscribers.size());
    }

    public long getDroppedCount() {
        return droppedTotal.get();
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }
}
