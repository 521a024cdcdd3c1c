package com.advisor.chase.engine.agent;

import com.advisor.chase.model.AgentType;
import com.advisor.chase.model.ChaseAction;
import com.advisor.chase.model.ChaseErrorKind;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseTarget;
import com.advisor.chase.model.ChaseType;
import com.advisor.chase.model.PolicyDecision;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Chases pension providers for Letter of Authority responses, quoting the provider's
 * reference number.
 */
@Component
public class LoaChaserAgent extends AbstractChaseAgent {

    public LoaChaserAgent(Clock clock) {
        super(clock);
    }

    @Override
    public ChaseType getSupportedType() {
        return ChaseType.LOA;
    }

    @Override
    public AgentType getAgentType() {
        return AgentType.LOA_CHASER;
    }

    @Override
    protected String templateFamily() {
        return "loa";
    }

    @Override
    protected ChaseAction plan(ChaseItem item, PolicyDecision decision) {
        if (!present(item.getProviderRef())) {
            return ChaseAction.markFailed(ChaseErrorKind.INVALID_TARGET, "LOA chase has no provider reference");
        }
        ChaseTarget target = item.getTarget();
        if (target == null) {
            return ChaseAction.markFailed(ChaseErrorKind.MISSING_REQUIRED_FIELD,
                    "No contact details for provider " + item.getProviderRef());
        }
        String name = present(target.getName()) ? target.getName() : item.getProviderRef();
        return contact(decision, item.getChannel(), item.getProviderRef(), name, target.getEmail(), target.getPhone());
    }
}
