package com.advisor.chase.channel;

import com.advisor.chase.config.MetricsConfig;
import com.advisor.chase.model.*;
import com.advisor.chase.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommunicationDispatcherTest {

    @Mock private ChannelSender channelSender;

    private SimpleMeterRegistry meterRegistry;
    private CommunicationDispatcher dispatcher;
    private ChaseItem item;
    private ChaseAction action;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new CommunicationDispatcher(new MessageTemplateRenderer(), channelSender,
                new MetricsConfig(meterRegistry));
        item = TestDataFactory.createItem("CHASE-1", ChaseType.DOCUMENT, ChaseStatus.PENDING, Priority.MEDIUM);
        action = ChaseAction.send(Channel.EMAIL, Tone.FRIENDLY, "document.friendly",
                new Recipient("CLIENT-001", "Sarah Thompson", "sarah.thompson@example.com"));
    }

    @Test
    void dispatch_sendsRenderedMessageOnce() {
        when(channelSender.send(any(), eq(Channel.EMAIL), eq(Tone.FRIENDLY), anyString())).thenReturn(SendOutcome.SUCCESS);

        DispatchResult result = dispatcher.dispatch(item, action, item.getCreatedAt());

        assertThat(result.getOutcome()).isEqualTo(SendOutcome.SUCCESS);
        assertThat(result.getDetail()).isEqualTo("Sent FRIENDLY EMAIL to Sarah Thompson");
        assertThat(result.getRenderedMessage()).startsWith("Hi Sarah,");
        verify(channelSender, times(1)).send(eq(action.getRecipient()), eq(Channel.EMAIL), eq(Tone.FRIENDLY),
                eq(result.getRenderedMessage()));
        assertThat(meterRegistry.counter("chase.dispatch.count", "channel", "EMAIL", "outcome", "SUCCESS").count())
                .isEqualTo(1.0);
    }

    @Test
    void dispatch_reportsChannelFailureWithoutRetrying() {
        when(channelSender.send(any(), any(), any(), anyString())).thenReturn(SendOutcome.TRANSIENT_CHANNEL_ERROR);

        DispatchResult result = dispatcher.dispatch(item, action, item.getCreatedAt());

        assertThat(result.getOutcome()).isEqualTo(SendOutcome.TRANSIENT_CHANNEL_ERROR);
        assertThat(result.getDetail()).endsWith("failed: TRANSIENT_CHANNEL_ERROR");
        verify(channelSender, times(1)).send(any(), any(), any(), anyString());
    }

    @Test
    void dispatch_propagatesSenderExceptions() {
        when(channelSender.send(any(), any(), any(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> dispatcher.dispatch(item, action, item.getCreatedAt()))
                .isInstanceOf(IllegalStateException.class);
    }
}
