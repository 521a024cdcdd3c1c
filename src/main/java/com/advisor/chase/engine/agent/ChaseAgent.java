package com.advisor.chase.engine.agent;

import com.advisor.chase.model.AgentStatus;
import com.advisor.chase.model.AgentType;
import com.advisor.chase.model.ChaseAction;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseType;
import com.advisor.chase.model.PolicyDecision;

/**
 * Strategy interface for chase agents. One implementation per {@link ChaseType}; the
 * agent validates the target and turns the policy decision into a concrete action.
 */
public interface ChaseAgent {

    ChaseType getSupportedType();

    AgentType getAgentType();

    /**
     * @param item     leased snapshot of the item being processed
     * @param decision tone, channel and escalation chosen by the escalation policy
     * @return the action to perform; never null
     */
    ChaseAction decide(ChaseItem item, PolicyDecision decision);

    AgentStatus getStatus();

    /**
     * Reports the agent busy until the handle is closed. Held by the caller across
     * {@link #decide} and the dispatch of the resulting action.
     */
    Busy busy();

    interface Busy extends AutoCloseable {
        @Override
        void close();
    }
}
