package com.advisor.chase.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchResult {
    private SendOutcome outcome;
    private Channel channel;
    private Tone tone;
    private String renderedMessage;
    private String detail;

    public boolean isSuccess() {
        return outcome == SendOutcome.SUCCESS;
    }
}
