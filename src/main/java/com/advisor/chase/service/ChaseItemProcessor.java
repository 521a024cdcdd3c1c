package com.advisor.chase.service;

import com.advisor.chase.channel.CommunicationDispatcher;
import com.advisor.chase.config.ChaseEngineConfig;
import com.advisor.chase.config.MetricsConfig;
import com.advisor.chase.engine.DelayPredictor;
import com.advisor.chase.engine.EscalationPolicy;
import com.advisor.chase.engine.PolicyContext;
import com.advisor.chase.engine.agent.AgentRegistry;
import com.advisor.chase.engine.agent.ChaseAgent;
import com.advisor.chase.exception.PersistenceUnavailableException;
import com.advisor.chase.model.ActionKind;
import com.advisor.chase.model.Activity;
import com.advisor.chase.model.ActivityOutcome;
import com.advisor.chase.model.AgentType;
import com.advisor.chase.model.ChaseAction;
import com.advisor.chase.model.ChaseErrorKind;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseStatus;
import com.advisor.chase.model.Channel;
import com.advisor.chase.model.DispatchResult;
import com.advisor.chase.model.PolicyDecision;
import com.advisor.chase.model.ProcessOutcome;
import com.advisor.chase.model.ProviderProfile;
import com.advisor.chase.model.RiskAssessment;
import com.advisor.chase.model.SendOutcome;
import com.advisor.chase.model.Tone;
import com.advisor.chase.registry.ChaseItemRegistry;
import com.advisor.chase.registry.CommitResult;
import com.advisor.chase.registry.Lease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Evaluates one leased item: predict, decide, act, then commit every resulting transition
 * and its activities in a single registry commit.
 *
 * Time-driven transitions (SENT to AWAITING_RESPONSE, AWAITING_RESPONSE to OVERDUE) are
 * applied first and kept even when the contact attempt that follows fails. A failed
 * attempt leaves the status where it was before the attempt and counts as an attempt.
 */
@Component
public class ChaseItemProcessor {

    private static final Logger log = LoggerFactory.getLogger(ChaseItemProcessor.class);

    private final ChaseItemRegistry registry;
    private final DelayPredictor predictor;
    private final EscalationPolicy policy;
    private final AgentRegistry agentRegistry;
    private final CommunicationDispatcher dispatcher;
    private final ProviderProfileService profileService;
    private final ChaseEngineConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ChaseItemProcessor(ChaseItemRegistry registry, DelayPredictor predictor, EscalationPolicy policy,
                              AgentRegistry agentRegistry, CommunicationDispatcher dispatcher,
                              ProviderProfileService profileService, ChaseEngineConfig config,
                              MetricsConfig metricsConfig, Clock clock) {
        this.registry = registry;
        this.predictor = predictor;
        this.policy = policy;
        this.agentRegistry = agentRegistry;
        this.dispatcher = dispatcher;
        this.profileService = profileService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Process the item held by {@code lease}. The caller owns the lease and releases it.
     */
    public ProcessOutcome process(Lease lease) {
        long now = clock.millis();
        ChaseItem original = lease.snapshot();

        ProviderProfile profile = profileService.getProfile(original.getProviderRef());
        RiskAssessment risk = predictor.assess(original, profile, now);
        metricsConfig.recordRiskScore(risk.getLevel().name(), risk.getScore());

        Plan plan = new Plan(original.toBuilder()
                .riskScore(risk.getScore())
                .riskLevel(risk.getLevel())
                .build(), lease, risk, now);

        evaluate(plan);

        CommitResult result = registry.commit(lease, plan.item, plan.activities);
        if (!result.applied()) {
            return ProcessOutcome.builder()
                    .itemId(original.getId())
                    .result(ProcessOutcome.Result.CONFLICT)
                    .item(result.item())
                    .build();
        }

        if (plan.item.getStatus() == ChaseStatus.FAILED) {
            profileService.recordFailure(result.item());
        }
        log.debug("Processed {}: {} -> {} (attempts={}, risk={}, next={})", original.getId(),
                original.getStatus(), plan.item.getStatus(), plan.item.getAttempts(),
                risk.getScore(), plan.item.getNextActionAt());

        return ProcessOutcome.builder()
                .itemId(original.getId())
                .result(ProcessOutcome.Result.PROCESSED)
                .item(result.item())
                .build();
    }

    private void evaluate(Plan plan) {
        ChaseItem item = plan.item;

        if (item.getStatus() == ChaseStatus.CREATED) {
            transition(plan, AgentType.ORCHESTRATOR, "registered", ChaseStatus.PENDING, null, null, "Queued for first contact");
        }

        if (item.getStatus() == ChaseStatus.SENT) {
            transition(plan, AgentType.ORCHESTRATOR, "awaiting_response", ChaseStatus.AWAITING_RESPONSE, null, null,
                    "Waiting for a response");
        }

        if (item.getStatus() == ChaseStatus.AWAITING_RESPONSE) {
            long deadline = item.getLastActionAt() + plan.risk.getExpectedResponseMillis();
            if (plan.now <= deadline) {
                item.setNextActionAt(Math.max(deadline + 1, item.getLastActionAt()));
                return;
            }
            transition(plan, AgentType.ORCHESTRATOR, "marked_overdue", ChaseStatus.OVERDUE, null, null,
                    String.format("No response %.1f days after last contact (expected %.1f)",
                            (plan.now - item.getLastActionAt()) / 86_400_000.0,
                            plan.risk.getExpectedResponseMillis() / 86_400_000.0));
            item.setWentOverdue(true);
        }

        switch (item.getStatus()) {
            case PENDING, OVERDUE, ESCALATED -> contact(plan);
            default -> log.debug("Nothing to do for {} in {}", item.getId(), item.getStatus());
        }
    }

    private void contact(Plan plan) {
        ChaseItem item = plan.item;
        ChaseStatus before = item.getStatus();

        if (item.getAttempts() >= config.getHardAttemptCap()) {
            fail(plan, AgentType.ORCHESTRATOR, ChaseErrorKind.ATTEMPT_CAP_EXCEEDED, null, null,
                    "Attempt cap of " + config.getHardAttemptCap() + " reached without a response");
            return;
        }

        PolicyDecision decision = policy.decide(PolicyContext.builder()
                .status(before)
                .attempts(item.getAttempts())
                .priority(item.getPriority())
                .elapsedSinceCreatedMillis(plan.now - item.getCreatedAt())
                .riskScore(plan.risk.getScore())
                .riskLevel(plan.risk.getLevel())
                .expectedResponseMillis(plan.risk.getExpectedResponseMillis())
                .currentChannel(item.getChannel())
                .alreadyEscalated(before == ChaseStatus.ESCALATED)
                .firstContact(before == ChaseStatus.PENDING)
                .build());

        ChaseAgent agent = agentRegistry.forType(item.getType());
        ChaseAction action;
        DispatchResult dispatched;
        try (ChaseAgent.Busy ignored = agent.busy()) {
            action = agent.decide(item.snapshot(), decision);
            if (action.getKind() == ActionKind.MARK_FAILED) {
                fail(plan, agent.getAgentType(), action.getFailureReason(), null, null, action.getDetail());
                return;
            }
            dispatched = dispatcher.dispatch(item, action, plan.now);
        } catch (PersistenceUnavailableException e) {
            // Store outage, not an agent fault: no attempt is spent, the orchestrator halts
            throw e;
        } catch (RuntimeException e) {
            log.warn("Agent {} failed on {}: {}", agent.getAgentType(), item.getId(), e.getMessage(), e);
            failedAttempt(plan, agent.getAgentType(), ChaseErrorKind.AGENT_ERROR, decision,
                    decision.getChannel(), decision.getTone(), e.getClass().getSimpleName() + ": " + e.getMessage());
            return;
        }

        if (dispatched.getOutcome() == SendOutcome.PERMANENT_CHANNEL_ERROR) {
            fail(plan, agent.getAgentType(), ChaseErrorKind.PERMANENT_CHANNEL_ERROR,
                    dispatched.getChannel(), dispatched.getTone(), dispatched.getDetail());
            return;
        }
        if (dispatched.getOutcome() == SendOutcome.TRANSIENT_CHANNEL_ERROR) {
            failedAttempt(plan, agent.getAgentType(), ChaseErrorKind.TRANSIENT_CHANNEL_ERROR, decision,
                    dispatched.getChannel(), dispatched.getTone(), dispatched.getDetail());
            return;
        }

        Channel used = dispatched.getChannel();
        Tone tone = dispatched.getTone();
        item.setLastActionAt(plan.now);
        item.setNextActionAt(plan.now + decision.getDelayMillis());
        item.setChannel(Channel.mostUrgent(item.getChannel(), used));

        if (before == ChaseStatus.PENDING) {
            item.setAttempts(item.getAttempts() + 1);
            item.setFirstContactAt(plan.now);
            transition(plan, agent.getAgentType(), "first_contact_sent", ChaseStatus.SENT, used, tone,
                    dispatched.getDetail());
        } else if (before == ChaseStatus.OVERDUE && action.getKind() == ActionKind.ESCALATE) {
            item.setPriority(item.getPriority().raise());
            transition(plan, agent.getAgentType(), "escalated", ChaseStatus.ESCALATED, used, tone,
                    "Escalated after " + item.getAttempts() + " attempts, priority now " + item.getPriority());
            item.setAttempts(item.getAttempts() + 1);
            transition(plan, agent.getAgentType(), "escalation_sent", ChaseStatus.AWAITING_RESPONSE, used, tone,
                    dispatched.getDetail());
        } else if (before == ChaseStatus.ESCALATED) {
            item.setAttempts(item.getAttempts() + 1);
            transition(plan, agent.getAgentType(), "escalation_sent", ChaseStatus.AWAITING_RESPONSE, used, tone,
                    dispatched.getDetail());
        } else {
            item.setAttempts(item.getAttempts() + 1);
            transition(plan, agent.getAgentType(), "reminder_sent", ChaseStatus.SENT, used, tone,
                    dispatched.getDetail());
        }
    }

    private void fail(Plan plan, AgentType agentType, ChaseErrorKind reason, Channel channel, Tone tone, String detail) {
        ChaseItem item = plan.item;
        item.setFailureReason(reason);
        item.setResolvedAt(plan.now);
        plan.activities.add(activity(plan, agentType, "failed", item.getStatus(), ChaseStatus.FAILED,
                channel, tone, ActivityOutcome.FAILURE, reason, detail));
        item.setStatus(ChaseStatus.FAILED);
        log.warn("Chase item {} failed: {} ({})", item.getId(), reason, detail);
    }

    private void failedAttempt(Plan plan, AgentType agentType, ChaseErrorKind kind, PolicyDecision decision,
                               Channel channel, Tone tone, String detail) {
        ChaseItem item = plan.item;
        item.setAttempts(item.getAttempts() + 1);
        item.setLastActionAt(plan.now);
        item.setNextActionAt(plan.now + decision.getDelayMillis());
        plan.activities.add(activity(plan, agentType, "send_failed", item.getStatus(), item.getStatus(),
                channel, tone, ActivityOutcome.FAILURE, kind, detail));
    }

    private void transition(Plan plan, AgentType agentType, String action, ChaseStatus to,
                            Channel channel, Tone tone, String detail) {
        ChaseItem item = plan.item;
        plan.activities.add(activity(plan, agentType, action, item.getStatus(), to,
                channel, tone, ActivityOutcome.SUCCESS, null, detail));
        item.setStatus(to);
    }

    private Activity activity(Plan plan, AgentType agentType, String action, ChaseStatus from, ChaseStatus to,
                              Channel channel, Tone tone, ActivityOutcome outcome, ChaseErrorKind errorKind,
                              String detail) {
        return Activity.builder()
                .id(UUID.randomUUID().toString())
                .itemId(plan.item.getId())
                .agentType(agentType)
                .action(action)
                .fromStatus(from)
                .toStatus(to)
                .channel(channel)
                .tone(tone)
                .outcome(outcome)
                .errorKind(errorKind)
                .detail(detail)
                .attempts(plan.item.getAttempts())
                .riskScore(plan.risk.getScore())
                .leaseSeq(plan.lease.seq())
                .timestamp(plan.now)
                .build();
    }

    /**
     * Working state of one evaluation.
     */
    private static final class Plan {
        final ChaseItem item;
        final Lease lease;
        final RiskAssessment risk;
        final long now;
        final List<Activity> activities = new ArrayList<>();

        Plan(ChaseItem item, Lease lease, RiskAssessment risk, long now) {
            this.item = item;
            this.lease = lease;
            this.risk = risk;
            this.now = now;
        }
    }
}
