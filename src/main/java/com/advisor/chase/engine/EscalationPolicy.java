package com.advisor.chase.engine;

import com.advisor.chase.config.ChaseEngineConfig;
import com.advisor.chase.model.ChaseStatus;
import com.advisor.chase.model.Channel;
import com.advisor.chase.model.PolicyDecision;
import com.advisor.chase.model.Priority;
import com.advisor.chase.model.RiskLevel;
import com.advisor.chase.model.Tone;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Decides when an item is looked at again and how the next contact is made.
 *
 * Backoff: delay = base * priorityFactor * growth^min(attempts, capAttempts), clamped to
 * [minDelay, maxDelay], then jittered by +/- jitterPct.
 *
 * Tone ladder: attempts 0-1 FRIENDLY, 2 GENTLE, 3+ URGENT. An item that is OVERDUE or
 * ESCALATED, or escalating now, is always contacted URGENT.
 * Channel ladder: EMAIL, SMS once the tone is URGENT or risk is HIGH, PHONE once attempts
 * reach the escalation threshold or the item escalates. Never below the item's current channel.
 */
@Component
public class EscalationPolicy {

    private final ChaseEngineConfig config;
    private final Random jitterRandom;

    public EscalationPolicy(ChaseEngineConfig config, @Qualifier("jitterRandom") Random jitterRandom) {
        this.config = config;
        this.jitterRandom = jitterRandom;
    }

    public PolicyDecision decide(PolicyContext ctx) {
        boolean escalate = ctx.isAlreadyEscalated() || (!ctx.isFirstContact() && isEscalationDue(ctx));
        Tone tone = toneFor(ctx.getAttempts(), escalate, ctx.getStatus());
        Channel channel = channelFor(tone, ctx.getRiskLevel(), ctx.getAttempts(), escalate, ctx.getCurrentChannel());
        long delay = jitter(baseDelayMillis(ctx.getAttempts(), ctx.getPriority()));

        return PolicyDecision.builder()
                .delayMillis(delay)
                .tone(tone)
                .channel(channel)
                .escalate(escalate)
                .build();
    }

    /**
     * Escalation fires on the attempt threshold or when the item has been open longer
     * than the expected response time times the overdue multiplier.
     */
    public boolean isEscalationDue(PolicyContext ctx) {
        if (ctx.getAttempts() >= config.getEscalationThreshold()) {
            return true;
        }
        double cap = ctx.getExpectedResponseMillis() * config.getOverdueMultiplier();
        return ctx.getExpectedResponseMillis() > 0 && ctx.getElapsedSinceCreatedMillis() > cap;
    }

    /**
     * Delay before jitter. Non-decreasing in attempts up to the exponent cap.
     */
    public long baseDelayMillis(int attempts, Priority priority) {
        ChaseEngineConfig.Backoff backoff = config.getBackoff();
        int exponent = Math.min(Math.max(attempts, 0), backoff.getCapAttempts());
        double raw = backoff.getBaseDelayMinutes() * 60_000.0
                * priorityFactor(priority)
                * Math.pow(backoff.getGrowthFactor(), exponent);

        double min = backoff.getMinDelayMinutes() * 60_000.0;
        double max = backoff.getMaxDelayMinutes() * 60_000.0;
        return Math.round(Math.max(min, Math.min(max, raw)));
    }

    public Tone toneFor(int attempts, boolean escalating) {
        return toneFor(attempts, escalating, null);
    }

    public Tone toneFor(int attempts, boolean escalating, ChaseStatus status) {
        if (escalating || attempts >= 3) return Tone.URGENT;
        if (status != null && status.isUrgent()) return Tone.URGENT;
        if (attempts == 2) return Tone.GENTLE;
        return Tone.FRIENDLY;
    }

    public Channel channelFor(Tone tone, RiskLevel riskLevel, int attempts,
                              boolean escalating, Channel currentChannel) {
        Channel channel = Channel.EMAIL;
        if (tone == Tone.URGENT || riskLevel == RiskLevel.HIGH) {
            channel = Channel.SMS;
        }
        if (escalating || attempts >= config.getEscalationThreshold()) {
            channel = Channel.PHONE;
        }
        return Channel.mostUrgent(channel, currentChannel);
    }

    private long jitter(long delay) {
        double pct = config.getBackoff().getJitterPct() / 100.0;
        if (pct <= 0) {
            return delay;
        }
        double factor;
        synchronized (jitterRandom) {
            factor = 1.0 + (jitterRandom.nextDouble() * 2.0 - 1.0) * pct;
        }
        return Math.max(1L, Math.round(delay * factor));
    }

    private double priorityFactor(Priority priority) {
        if (priority == null) return config.getBackoff().getMediumPriorityFactor();
        return switch (priority) {
            case HIGH -> config.getBackoff().getHighPriorityFactor();
            case LOW -> config.getBackoff().getLowPriorityFactor();
            default -> config.getBackoff().getMediumPriorityFactor();
        };
    }
}
