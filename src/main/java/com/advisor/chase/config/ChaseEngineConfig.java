package com.advisor.chase.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "chase")
public class ChaseEngineConfig {

    // Scheduler tick period. Ticks are skipped entirely when the scheduler is disabled.
    private int tickIntervalSeconds = 60;
    private boolean schedulerEnabled = true;

    // Parallel workers evaluating leased items within one tick.
    private int workerPoolSize = 4;

    // Attempts at which an overdue item is escalated instead of re-chased.
    private int escalationThreshold = 3;

    // Absolute attempt ceiling; reaching it without resolution fails the item.
    private int hardAttemptCap = 8;

    // Escalate once elapsed time exceeds expectedResponseTime * overdueMultiplier.
    private double overdueMultiplier = 1.5;

    // Expected response times used when no provider profile has been learned yet.
    private int defaultClientResponseDays = 7;
    private int defaultProviderResponseDays = 15;

    // Prior knowledge of provider turnaround (provider name -> days), used until a profile exists.
    private Map<String, Integer> providerBaselineDays = new HashMap<>();

    // Per-subscriber buffer of the activity event bus; events beyond it are dropped.
    private int eventBufferSize = 256;

    private Backoff backoff = new Backoff();

    private Predictor predictor = new Predictor();

    private Profile profile = new Profile();

    @Data
    public static class Backoff {
        private long baseDelayMinutes = 1440;
        private double growthFactor = 2.0;
        // Exponent ceiling: attempts beyond this stop growing the delay.
        private int capAttempts = 5;
        private long minDelayMinutes = 60;
        private long maxDelayMinutes = 20160;
        // Uniform jitter of +/- jitterPct percent applied after clamping.
        private double jitterPct = 10.0;
        // Fixed seed for reproducible jitter; random when unset.
        private Long jitterSeed;
        private double highPriorityFactor = 0.5;
        private double mediumPriorityFactor = 1.0;
        private double lowPriorityFactor = 1.5;
    }

    @Data
    public static class Predictor {
        // Slope of the logistic over elapsed / expected response time.
        private double steepness = 4.0;
        // Gentler slope when the provider is unknown (wider uncertainty).
        private double unknownProfileSteepness = 2.0;
        // History risk assumed for providers with no profile.
        private double unknownProfileBaselineRisk = 0.2;
        // Maximum contribution of attempts and of provider failure history.
        private double attemptRiskWeight = 0.5;
        private double historyRiskWeight = 0.5;
    }

    @Data
    public static class Profile {
        // EWMA smoothing factor for provider latency (0 < alpha <= 1).
        private double ewmaAlpha = 0.2;
        // Recent latencies retained for the percentile estimate.
        private int percentileWindow = 50;
    }
}
