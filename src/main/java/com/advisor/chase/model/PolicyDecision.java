package com.advisor.chase.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of the escalation policy: when to look again, and how to contact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyDecision {
    private long delayMillis;
    private Tone tone;
    private Channel channel;
    private boolean escalate;       // escalation trigger fired
}
