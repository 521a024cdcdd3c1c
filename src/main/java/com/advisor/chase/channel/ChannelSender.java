package com.advisor.chase.channel;

import com.advisor.chase.model.Channel;
import com.advisor.chase.model.Recipient;
import com.advisor.chase.model.SendOutcome;
import com.advisor.chase.model.Tone;

/**
 * Delivers one rendered message over one channel. Implementations must not retry;
 * retries are scheduled by the orchestrator through the escalation policy.
 */
public interface ChannelSender {

    SendOutcome send(Recipient recipient, Channel channel, Tone tone, String message);
}
