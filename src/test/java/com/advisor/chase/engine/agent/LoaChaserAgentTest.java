package com.advisor.chase.engine.agent;

import com.advisor.chase.model.*;
import com.advisor.chase.repository.ClientRepository;
import com.advisor.chase.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static com.advisor.chase.engine.agent.DocumentChaserAgentTest.decision;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class LoaChaserAgentTest {

    private LoaChaserAgent agent;

    @BeforeEach
    void setUp() {
        agent = new LoaChaserAgent(Clock.systemUTC());
    }

    @Test
    void send_addressesProviderWithLoaTemplate() {
        ChaseItem item = TestDataFactory.createItem("CHASE-2", ChaseType.LOA, ChaseStatus.OVERDUE, Priority.MEDIUM);

        ChaseAction action = agent.decide(item, decision(Channel.EMAIL, Tone.GENTLE, false));

        assertThat(action.getKind()).isEqualTo(ActionKind.SEND);
        assertThat(action.getTemplateKey()).isEqualTo("loa.gentle");
        assertThat(action.getRecipient().getTargetId()).isEqualTo("Aviva");
        assertThat(action.getRecipient().getAddress()).isEqualTo("loa@aviva.example");
    }

    @Test
    void missingProviderRef_marksInvalidTarget() {
        ChaseItem item = TestDataFactory.createItem("CHASE-3", ChaseType.LOA, ChaseStatus.PENDING, Priority.MEDIUM)
                .toBuilder().providerRef(null).build();

        ChaseAction action = agent.decide(item, decision(Channel.EMAIL, Tone.FRIENDLY, false));

        assertThat(action.getFailureReason()).isEqualTo(ChaseErrorKind.INVALID_TARGET);
    }

    @Test
    void providerWithoutContact_marksMissingRequiredField() {
        ChaseItem item = TestDataFactory.createItem("CHASE-4", ChaseType.LOA, ChaseStatus.PENDING, Priority.MEDIUM);
        item.setTarget(ChaseTarget.builder().kind(TargetKind.PROVIDER).id("Aviva").name("Aviva").build());

        ChaseAction action = agent.decide(item, decision(Channel.EMAIL, Tone.FRIENDLY, false));

        assertThat(action.getKind()).isEqualTo(ActionKind.MARK_FAILED);
        assertThat(action.getFailureReason()).isEqualTo(ChaseErrorKind.MISSING_REQUIRED_FIELD);
    }

    @Test
    void registry_routesByChaseType() {
        DocumentChaserAgent documentAgent = new DocumentChaserAgent(mock(ClientRepository.class), Clock.systemUTC());
        AgentRegistry registry = new AgentRegistry(List.of(documentAgent, agent));

        assertThat(registry.forType(ChaseType.LOA)).isSameAs(agent);
        assertThat(registry.forType(ChaseType.DOCUMENT)).isSameAs(documentAgent);
        assertThat(registry.getStatuses()).extracting(AgentStatus::getAgentType)
                .containsExactlyInAnyOrder(AgentType.DOCUMENT_CHASER, AgentType.LOA_CHASER);
    }

    @Test
    void registry_withoutMatchingAgent_throws() {
        AgentRegistry registry = new AgentRegistry(List.of(agent));

        assertThatThrownBy(() -> registry.forType(ChaseType.DOCUMENT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DOCUMENT");
    }
}
