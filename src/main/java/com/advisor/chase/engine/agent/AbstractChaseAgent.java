package com.advisor.chase.engine.agent;

import com.advisor.chase.model.ActionKind;
import com.advisor.chase.model.AgentStatus;
import com.advisor.chase.model.ChaseAction;
import com.advisor.chase.model.ChaseErrorKind;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.Channel;
import com.advisor.chase.model.PolicyDecision;
import com.advisor.chase.model.Recipient;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Status bookkeeping shared by the concrete agents.
 */
public abstract class AbstractChaseAgent implements ChaseAgent {

    private final Clock clock;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong processed = new AtomicLong();
    private volatile String lastAction;
    private volatile long lastActionAt;

    protected AbstractChaseAgent(Clock clock) {
        this.clock = clock;
    }

    @Override
    public final ChaseAction decide(ChaseItem item, PolicyDecision decision) {
        try (Busy ignored = busy()) {
            ChaseAction action = plan(item, decision);
            lastAction = describe(action);
            lastActionAt = clock.millis();
            processed.incrementAndGet();
            return action;
        }
    }

    @Override
    public Busy busy() {
        inFlight.incrementAndGet();
        AtomicBoolean open = new AtomicBoolean(true);
        return () -> {
            if (open.compareAndSet(true, false)) {
                inFlight.decrementAndGet();
            }
        };
    }

    protected abstract ChaseAction plan(ChaseItem item, PolicyDecision decision);

    protected abstract String templateFamily();

    @Override
    public AgentStatus getStatus() {
        return AgentStatus.builder()
                .agentType(getAgentType())
                .status(inFlight.get() > 0 ? "busy" : "idle")
                .lastAction(lastAction)
                .lastActionAt(lastActionAt)
                .itemsProcessed(processed.get())
                .build();
    }

    /**
     * Picks the address for the requested channel, falling back to the other contact
     * point when that one is missing. The fallback never drops below {@code usedChannel},
     * the most urgent channel the item has already been chased on; with no reachable
     * channel the action is a MISSING_REQUIRED_FIELD failure.
     */
    protected ChaseAction contact(PolicyDecision decision, Channel usedChannel, String targetId, String name,
                                  String email, String phone) {
        Channel channel = decision.getChannel();
        String address;
        if (channel == Channel.EMAIL) {
            address = present(email) ? email : phone;
            if (!present(email) && present(phone)) channel = Channel.SMS;
        } else if (present(phone)) {
            address = phone;
        } else if (present(email) && Channel.mostUrgent(usedChannel, Channel.EMAIL) == Channel.EMAIL) {
            address = email;
            channel = Channel.EMAIL;
        } else {
            return ChaseAction.markFailed(ChaseErrorKind.MISSING_REQUIRED_FIELD,
                    "No phone on record for " + targetId + ", already chased by " + usedChannel);
        }
        if (!present(address)) {
            return ChaseAction.markFailed(ChaseErrorKind.MISSING_REQUIRED_FIELD,
                    "No email or phone on record for " + targetId);
        }

        Recipient recipient = new Recipient(targetId, name, address);
        if (decision.isEscalate()) {
            return ChaseAction.escalate(channel, decision.getTone(), templateFamily() + ".escalation", recipient);
        }
        return ChaseAction.send(channel, decision.getTone(),
                templateFamily() + "." + decision.getTone().name().toLowerCase(), recipient);
    }

    protected static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static String describe(ChaseAction action) {
        if (action.getKind() == ActionKind.MARK_FAILED) {
            return "mark_failed:" + action.getFailureReason();
        }
        return action.getKind().name().toLowerCase() + ":" + action.getChannel();
    }
}
