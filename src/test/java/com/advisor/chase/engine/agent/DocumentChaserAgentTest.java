package com.advisor.chase.engine.agent;

import com.advisor.chase.model.*;
import com.advisor.chase.repository.ClientRepository;
import com.advisor.chase.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentChaserAgentTest {

    @Mock private ClientRepository clientRepository;

    private DocumentChaserAgent agent;
    private ChaseItem item;

    @BeforeEach
    void setUp() {
        agent = new DocumentChaserAgent(clientRepository,
                Clock.fixed(Instant.parse("2025-03-03T09:00:00Z"), ZoneOffset.UTC));
        item = TestDataFactory.createItem("CHASE-1", ChaseType.DOCUMENT, ChaseStatus.PENDING, Priority.MEDIUM);
    }

    @Test
    void send_usesClientDirectoryContact() {
        when(clientRepository.findByClientId("CLIENT-001")).thenReturn(TestDataFactory.createClient("CLIENT-001"));

        ChaseAction action = agent.decide(item, decision(Channel.EMAIL, Tone.FRIENDLY, false));

        assertThat(action.getKind()).isEqualTo(ActionKind.SEND);
        assertThat(action.getTemplateKey()).isEqualTo("document.friendly");
        assertThat(action.getChannel()).isEqualTo(Channel.EMAIL);
        assertThat(action.getRecipient().getAddress()).isEqualTo("sarah.thompson@example.com");
        assertThat(action.getRecipient().getName()).isEqualTo("Sarah Thompson");
    }

    @Test
    void escalate_usesEscalationTemplateAndPhone() {
        when(clientRepository.findByClientId("CLIENT-001")).thenReturn(TestDataFactory.createClient("CLIENT-001"));

        ChaseAction action = agent.decide(item, decision(Channel.PHONE, Tone.URGENT, true));

        assertThat(action.getKind()).isEqualTo(ActionKind.ESCALATE);
        assertThat(action.getTemplateKey()).isEqualTo("document.escalation");
        assertThat(action.getRecipient().getAddress()).isEqualTo("+447700900456");
    }

    @Test
    void missingEmail_fallsBackToSms() {
        Client phoneOnly = TestDataFactory.createClient("CLIENT-001");
        phoneOnly.setEmail(null);
        when(clientRepository.findByClientId("CLIENT-001")).thenReturn(phoneOnly);

        ChaseAction action = agent.decide(item, decision(Channel.EMAIL, Tone.GENTLE, false));

        assertThat(action.getChannel()).isEqualTo(Channel.SMS);
        assertThat(action.getRecipient().getAddress()).isEqualTo("+447700900456");
    }

    @Test
    void missingPhone_fallsBackToEmail() {
        Client emailOnly = TestDataFactory.createClient("CLIENT-001");
        emailOnly.setPhone(" ");
        when(clientRepository.findByClientId("CLIENT-001")).thenReturn(emailOnly);

        ChaseAction action = agent.decide(item, decision(Channel.PHONE, Tone.URGENT, false));

        assertThat(action.getChannel()).isEqualTo(Channel.EMAIL);
        assertThat(action.getTemplateKey()).isEqualTo("document.urgent");
    }

    @Test
    void missingPhone_afterSmsContact_failsRatherThanDowngradingToEmail() {
        Client emailOnly = TestDataFactory.createClient("CLIENT-001");
        emailOnly.setPhone(null);
        when(clientRepository.findByClientId("CLIENT-001")).thenReturn(emailOnly);
        ChaseItem chasedBySms = item.toBuilder().channel(Channel.SMS).attempts(2).build();

        ChaseAction action = agent.decide(chasedBySms, decision(Channel.SMS, Tone.URGENT, false));

        assertThat(action.getKind()).isEqualTo(ActionKind.MARK_FAILED);
        assertThat(action.getFailureReason()).isEqualTo(ChaseErrorKind.MISSING_REQUIRED_FIELD);
        assertThat(action.getDetail()).contains("SMS");
    }

    @Test
    void missingEmail_afterEmailContact_stillClimbsToSms() {
        Client phoneOnly = TestDataFactory.createClient("CLIENT-001");
        phoneOnly.setEmail(null);
        when(clientRepository.findByClientId("CLIENT-001")).thenReturn(phoneOnly);
        ChaseItem chasedByEmail = item.toBuilder().channel(Channel.EMAIL).attempts(1).build();

        ChaseAction action = agent.decide(chasedByEmail, decision(Channel.EMAIL, Tone.GENTLE, false));

        assertThat(action.getKind()).isEqualTo(ActionKind.SEND);
        assertThat(action.getChannel()).isEqualTo(Channel.SMS);
    }

    @Test
    void noContactAtAll_marksMissingRequiredField() {
        Client noContact = Client.builder().clientId("CLIENT-001").name("Sarah Thompson").build();
        when(clientRepository.findByClientId("CLIENT-001")).thenReturn(noContact);

        ChaseAction action = agent.decide(item, decision(Channel.EMAIL, Tone.FRIENDLY, false));

        assertThat(action.getKind()).isEqualTo(ActionKind.MARK_FAILED);
        assertThat(action.getFailureReason()).isEqualTo(ChaseErrorKind.MISSING_REQUIRED_FIELD);
    }

    @Test
    void unknownClient_marksInvalidTarget() {
        when(clientRepository.findByClientId("CLIENT-001")).thenReturn(null);

        ChaseAction action = agent.decide(item, decision(Channel.EMAIL, Tone.FRIENDLY, false));

        assertThat(action.getKind()).isEqualTo(ActionKind.MARK_FAILED);
        assertThat(action.getFailureReason()).isEqualTo(ChaseErrorKind.INVALID_TARGET);
    }

    @Test
    void status_tracksLastActionAndCount() {
        when(clientRepository.findByClientId("CLIENT-001")).thenReturn(TestDataFactory.createClient("CLIENT-001"));

        agent.decide(item, decision(Channel.EMAIL, Tone.FRIENDLY, false));
        agent.decide(item, decision(Channel.SMS, Tone.URGENT, false));

        AgentStatus status = agent.getStatus();
        assertThat(status.getAgentType()).isEqualTo(AgentType.DOCUMENT_CHASER);
        assertThat(status.getStatus()).isEqualTo("idle");
        assertThat(status.getItemsProcessed()).isEqualTo(2);
        assertThat(status.getLastAction()).isEqualTo("send:SMS");
        assertThat(status.getLastActionAt()).isEqualTo(Instant.parse("2025-03-03T09:00:00Z").toEpochMilli());
    }

    @Test
    void busyHandle_coversWorkOutsideDecide() {
        try (ChaseAgent.Busy ignored = agent.busy()) {
            assertThat(agent.getStatus().getStatus()).isEqualTo("busy");
        }
        assertThat(agent.getStatus().getStatus()).isEqualTo("idle");
    }

    @Test
    void busyHandle_closedTwice_releasesOnce() {
        ChaseAgent.Busy outer = agent.busy();
        ChaseAgent.Busy inner = agent.busy();

        inner.close();
        inner.close();
        assertThat(agent.getStatus().getStatus()).isEqualTo("busy");

        outer.close();
        assertThat(agent.getStatus().getStatus()).isEqualTo("idle");
    }

    static PolicyDecision decision(Channel channel, Tone tone, boolean escalate) {
        return PolicyDecision.builder()
                .delayMillis(86_400_000L)
                .channel(channel)
                .tone(tone)
                .escalate(escalate)
                .build();
    }
}
