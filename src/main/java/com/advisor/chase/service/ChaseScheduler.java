package com.advisor.chase.service;

import com.advisor.chase.config.ChaseEngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class ChaseScheduler {

    private static final Logger log = LoggerFactory.getLogger(ChaseScheduler.class);

    private final ChaseOrchestrator orchestrator;
    private final ChaseEngineConfig config;

    public ChaseScheduler(ChaseOrchestrator orchestrator, ChaseEngineConfig config) {
        this.orchestrator = orchestrator;
        this.config = config;
    }

    @Scheduled(fixedRateString = "${chase.tick-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${chase.initial-delay-seconds:10}")
    public void runTick() {
        if (!config.isSchedulerEnabled()) {
            return;
        }
        try {
            orchestrator.tick();
        } catch (RuntimeException e) {
            log.error("Chase tick failed: {}", e.getMessage(), e);
        }
    }
}
