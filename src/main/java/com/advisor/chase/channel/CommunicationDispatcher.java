package com.advisor.chase.channel;

import com.advisor.chase.config.MetricsConfig;
import com.advisor.chase.model.ChaseAction;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.DispatchResult;
import com.advisor.chase.model.SendOutcome;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders the message for a send or escalate action and hands it to the channel sender.
 * Exactly one send per call; exceptions from the sender propagate to the caller.
 */
@Component
public class CommunicationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommunicationDispatcher.class);

    private final MessageTemplateRenderer renderer;
    private final ChannelSender channelSender;
    private final MetricsConfig metricsConfig;

    public CommunicationDispatcher(MessageTemplateRenderer renderer, ChannelSender channelSender,
                                   MetricsConfig metricsConfig) {
        this.renderer = renderer;
        this.channelSender = channelSender;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "chase.dispatch", contextualName = "dispatch-communication")
    public DispatchResult dispatch(ChaseItem item, ChaseAction action, long now) {
        String message = renderer.render(item, action, now);
        SendOutcome outcome = channelSender.send(action.getRecipient(), action.getChannel(), action.getTone(), message);
        metricsConfig.recordDispatch(action.getChannel().name(), outcome.name());

        log.debug("Dispatched {} {} {} for item {} -> {}",
                action.getTemplateKey(), action.getChannel(), action.getTone(), item.getId(), outcome);

        return DispatchResult.builder()
                .outcome(outcome)
                .channel(action.getChannel())
                .tone(action.getTone())
                .renderedMessage(message)
                .detail(outcome == SendOutcome.SUCCESS
                        ? "Sent " + action.getTone() + " " + action.getChannel() + " to " + action.getRecipient().getName()
                        : action.getChannel() + " delivery to " + action.getRecipient().getAddress() + " failed: " + outcome)
                .build();
    }
}
