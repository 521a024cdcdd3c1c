package com.advisor.chase.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Concrete step an agent decided on for one chase item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChaseAction {

    private ActionKind kind;
    private Channel channel;
    private Tone tone;
    private String templateKey;
    private Recipient recipient;
    private ChaseErrorKind failureReason;
    private String detail;

    public static ChaseAction send(Channel channel, Tone tone, String templateKey, Recipient recipient) {
        return new ChaseAction(ActionKind.SEND, channel, tone, templateKey, recipient, null, null);
    }

    public static ChaseAction escalate(Channel channel, Tone tone, String templateKey, Recipient recipient) {
        return new ChaseAction(ActionKind.ESCALATE, channel, tone, templateKey, recipient, null, null);
    }

    public static ChaseAction markFailed(ChaseErrorKind reason, String detail) {
        return new ChaseAction(ActionKind.MARK_FAILED, null, null, null, null, reason, detail);
    }
}
