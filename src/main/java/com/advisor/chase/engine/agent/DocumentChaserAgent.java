package com.advisor.chase.engine.agent;

import com.advisor.chase.model.AgentType;
import com.advisor.chase.model.ChaseAction;
import com.advisor.chase.model.ChaseErrorKind;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseType;
import com.advisor.chase.model.Client;
import com.advisor.chase.model.PolicyDecision;
import com.advisor.chase.repository.ClientRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Chases clients for outstanding documents. Contact details come from the client
 * directory rather than the item, so corrections made there take effect on the next chase.
 */
@Component
public class DocumentChaserAgent extends AbstractChaseAgent {

    private final ClientRepository clientRepository;

    public DocumentChaserAgent(ClientRepository clientRepository, Clock clock) {
        super(clock);
        this.clientRepository = clientRepository;
    }

    @Override
    public ChaseType getSupportedType() {
        return ChaseType.DOCUMENT;
    }

    @Override
    public AgentType getAgentType() {
        return AgentType.DOCUMENT_CHASER;
    }

    @Override
    protected String templateFamily() {
        return "document";
    }

    @Override
    protected ChaseAction plan(ChaseItem item, PolicyDecision decision) {
        String clientId = present(item.getClientId()) ? item.getClientId()
                : item.getTarget() != null ? item.getTarget().getId() : null;
        if (!present(clientId)) {
            return ChaseAction.markFailed(ChaseErrorKind.INVALID_TARGET, "Document chase has no client");
        }

        Client client = clientRepository.findByClientId(clientId);
        if (client == null) {
            return ChaseAction.markFailed(ChaseErrorKind.INVALID_TARGET, "Unknown client " + clientId);
        }
        return contact(decision, item.getChannel(), client.getClientId(), client.getName(), client.getEmail(), client.getPhone());
    }
}
