package com.advisor.chase.engine;

import com.advisor.chase.config.ChaseEngineConfig;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseType;
import com.advisor.chase.model.ProviderProfile;
import com.advisor.chase.model.RiskAssessment;
import com.advisor.chase.model.RiskLevel;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores the risk that a chase item will be delayed or fail.
 *
 * Three independent factors are combined as a noisy-OR, so any one of them alone can
 * push the score up while the result stays in [0, 1]:
 * <ul>
 *   <li>time: logistic over elapsed / expected response time, centred on 1.0. The slope is
 *       reduced when the provider's p90 is far above its mean, and halved again for unknown
 *       providers.</li>
 *   <li>attempts: attempts / escalation threshold, capped at 1, scaled by attemptRiskWeight.</li>
 *   <li>history: the provider's failure rate scaled by historyRiskWeight, or a baseline
 *       risk when nothing has been learned.</li>
 * </ul>
 * Stateless; profiles are passed in by the caller.
 */
@Component
public class DelayPredictor {

    private static final long DAY_MILLIS = 86_400_000L;

    private final ChaseEngineConfig config;

    public DelayPredictor(ChaseEngineConfig config) {
        this.config = config;
    }

    @Observed(name = "chase.predict", contextualName = "predict-delay-risk")
    public RiskAssessment assess(ChaseItem item, ProviderProfile profile, long now) {
        ChaseEngineConfig.Predictor p = config.getPredictor();
        boolean known = profile != null && profile.hasLatencyHistory();

        long expected = expectedResponseMillis(item, profile);
        long elapsed = Math.max(0, now - item.getCreatedAt());
        double ratio = expected > 0 ? elapsed / (double) expected : 0.0;

        double steepness;
        if (known) {
            double p90 = profile.getP90LatencyMillis();
            double spread = p90 > profile.getEwmaLatencyMillis() ? profile.getEwmaLatencyMillis() / p90 : 1.0;
            steepness = p.getSteepness() * Math.max(0.5, spread);
        } else {
            steepness = p.getUnknownProfileSteepness();
        }
        double timeRisk = 1.0 / (1.0 + Math.exp(-steepness * (ratio - 1.0)));

        double attemptRisk = p.getAttemptRiskWeight()
                * Math.min(1.0, item.getAttempts() / (double) Math.max(1, config.getEscalationThreshold()));

        double historyRisk = known
                ? p.getHistoryRiskWeight() * Math.max(profile.getFailureRate(), profile.getOverdueRate())
                : p.getHistoryRiskWeight() * p.getUnknownProfileBaselineRisk();

        double score = 1.0 - (1.0 - timeRisk) * (1.0 - attemptRisk) * (1.0 - historyRisk);
        score = Math.max(0.0, Math.min(1.0, score));
        score = Math.round(score * 10_000.0) / 10_000.0;
        RiskLevel level = RiskLevel.fromScore(score);

        return RiskAssessment.builder()
                .itemId(item.getId())
                .score(score)
                .level(level)
                .expectedResponseMillis(expected)
                .defaultProfile(!known)
                .riskFactors(identifyRiskFactors(item, profile, known, ratio, expected))
                .recommendation(recommend(level))
                .assessedAt(now)
                .build();
    }

    /**
     * Learned mean latency when available, else the configured provider baseline, else the
     * default for the chase type.
     */
    public long expectedResponseMillis(ChaseItem item, ProviderProfile profile) {
        if (profile != null && profile.hasLatencyHistory()) {
            return Math.round(profile.getEwmaLatencyMillis());
        }
        String providerRef = item.getProviderRef();
        if (providerRef != null) {
            Integer baselineDays = config.getProviderBaselineDays().get(providerRef);
            if (baselineDays != null && baselineDays > 0) {
                return baselineDays * DAY_MILLIS;
            }
        }
        if (item.getType() == ChaseType.LOA || providerRef != null) {
            return config.getDefaultProviderResponseDays() * DAY_MILLIS;
        }
        return config.getDefaultClientResponseDays() * DAY_MILLIS;
    }

    private List<String> identifyRiskFactors(ChaseItem item, ProviderProfile profile, boolean known,
                                             double ratio, long expected) {
        List<String> factors = new ArrayList<>();
        if (ratio > 1.0) {
            factors.add(String.format("Open for %.1f days, beyond the expected %.1f days",
                    ratio * expected / DAY_MILLIS, expected / (double) DAY_MILLIS));
        }
        if (item.getAttempts() >= 2) {
            factors.add(item.getAttempts() + " chase attempts without response");
        }
        if (known && profile.getFailureRate() > 0.1) {
            factors.add(String.format("Provider failure rate %.0f%%", profile.getFailureRate() * 100));
        }
        if (known && profile.getOverdueRate() > 0.25) {
            factors.add(String.format("Provider overdue rate %.0f%%", profile.getOverdueRate() * 100));
        }
        if (!known && item.getProviderRef() != null) {
            factors.add("No learned response profile for " + item.getProviderRef());
        }
        if (factors.isEmpty()) {
            factors.add("Low risk - tracking normally");
        }
        return factors;
    }

    private String recommend(RiskLevel level) {
        return switch (level) {
            case HIGH -> "High risk: escalate now and contact the provider or client directly by phone.";
            case MEDIUM -> "Moderate risk: chase proactively and follow up by phone if nothing arrives within 48 hours.";
            default -> "Low risk: keep monitoring, the item is within its expected timeline.";
        };
    }
}
