package com.advisor.chase.config;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineBeansConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineBeansConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random jitterRandom(ChaseEngineConfig config) {
        Long seed = config.getBackoff().getJitterSeed();
        if (seed != null) {
            log.info("Backoff jitter seeded with {}", seed);
            return new Random(seed);
        }
        return new Random();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService chaseWorkerPool(ChaseEngineConfig config) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(config.getWorkerPoolSize(), r -> {
            Thread t = new Thread(r, "chase-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService activityStreamExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "activity-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
