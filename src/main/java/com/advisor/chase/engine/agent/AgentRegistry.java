package com.advisor.chase.engine.agent;

import com.advisor.chase.model.AgentStatus;
import com.advisor.chase.model.ChaseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<ChaseType, ChaseAgent> agents = new EnumMap<>(ChaseType.class);

    public AgentRegistry(List<ChaseAgent> chaseAgents) {
        for (ChaseAgent agent : chaseAgents) {
            agents.put(agent.getSupportedType(), agent);
            log.info("Registered chase agent: {} -> {}",
                    agent.getSupportedType(), agent.getClass().getSimpleName());
        }
    }

    /**
     * @throws IllegalStateException when no agent handles the type
     */
    public ChaseAgent forType(ChaseType type) {
        ChaseAgent agent = agents.get(type);
        if (agent == null) {
            throw new IllegalStateException("No chase agent registered for type " + type);
        }
        return agent;
    }

    public List<AgentStatus> getStatuses() {
        List<AgentStatus> statuses = new ArrayList<>();
        for (ChaseAgent agent : agents.values()) {
            statuses.add(agent.getStatus());
        }
        return statuses;
    }
}
