package com.advisor.chase.engine;

import com.advisor.chase.model.ChaseStatus;
import com.advisor.chase.model.Channel;
import com.advisor.chase.model.Priority;
import com.advisor.chase.model.RiskLevel;
import lombok.Builder;
import lombok.Data;

/**
 * Inputs to the escalation policy, captured from a leased item snapshot and its risk assessment.
 */
@Data
@Builder
public class PolicyContext {
    // Status the item is contacted from
    private ChaseStatus status;
    private int attempts;
    private Priority priority;
    private long elapsedSinceCreatedMillis;
    private double riskScore;
    private RiskLevel riskLevel;
    private long expectedResponseMillis;
    private Channel currentChannel;
    // Item already sits in ESCALATED (an interrupted escalation being resumed)
    private boolean alreadyEscalated;
    // No contact made yet; the first message is never an escalation
    private boolean firstContact;
}
