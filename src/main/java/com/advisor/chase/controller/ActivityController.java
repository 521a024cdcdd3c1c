package com.advisor.chase.controller;

import com.advisor.chase.model.Activity;
import com.advisor.chase.model.ActivityEvent;
import com.advisor.chase.registry.ActivityEventBus;
import com.advisor.chase.registry.ActivitySubscription;
import com.advisor.chase.registry.ChaseItemRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

@RestController
@RequestMapping("/api/v1/activity")
@Tag(name = "Activity", description = "Live and recent agent activity")
public class ActivityController {

    private static final Logger log = LoggerFactory.getLogger(ActivityController.class);
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final ActivityEventBus eventBus;
    private final ChaseItemRegistry registry;
    private final ExecutorService streamExecutor;

    public ActivityController(ActivityEventBus eventBus, ChaseItemRegistry registry,
                              @Qualifier("activityStreamExecutor") ExecutorService streamExecutor) {
        this.eventBus = eventBus;
        this.registry = registry;
        this.streamExecutor = streamExecutor;
    }

    @Operation(summary = "Subscribe to activity events",
            description = "Server-Sent Events stream of 'agent_activity' events from the moment of subscription. " +
                    "A subscriber that falls behind loses events rather than slowing the engine.")
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamActivity() {
        SseEmitter emitter = new SseEmitter(0L);
        ActivitySubscription subscription = eventBus.subscribe();
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());

        streamExecutor.execute(() -> forward(subscription, emitter));
        return emitter;
    }

    @Operation(summary = "Recent activity", description = "Most recent activities across all items, newest first.")
    @GetMapping("/recent")
    public ResponseEntity<List<Activity>> recentActivity(
            @Parameter(description = "Maximum activities to return (1-500)", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(registry.recentActivities(Math.max(1, Math.min(limit, 500))));
    }

    private void forward(ActivitySubscription subscription, SseEmitter emitter) {
        try {
            while (!subscription.isClosed()) {
                ActivityEvent event = subscription.poll(POLL_INTERVAL);
                if (event != null) {
                    emitter.send(SseEmitter.event().name(event.getType()).data(event));
                }
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Activity stream closed: {}", e.getMessage());
            subscription.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.close();
            emitter.complete();
        }
    }
}
