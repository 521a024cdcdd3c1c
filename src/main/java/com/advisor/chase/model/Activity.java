package com.advisor.chase.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable audit record of one action taken on a chase item.
 */
@Value
@Builder
@Schema(description = "Audit record of an action taken on a chase item")
public class Activity {

    @Schema(description = "Activity identifier")
    String id;

    @Schema(description = "Chase item the action was taken on", example = "CHASE-3f1c2a")
    String itemId;

    @Schema(description = "Who acted", example = "LOA_CHASER")
    AgentType agentType;

    @Schema(description = "Action name", example = "reminder_sent")
    String action;

    @Schema(description = "Status before the action", example = "OVERDUE")
    ChaseStatus fromStatus;

    @Schema(description = "Status after the action", example = "SENT")
    ChaseStatus toStatus;

    @Schema(description = "Channel used, when a communication was attempted", example = "EMAIL")
    Channel channel;

    @Schema(description = "Tone used, when a communication was attempted", example = "GENTLE")
    Tone tone;

    @Schema(description = "Outcome of the action", example = "SUCCESS")
    ActivityOutcome outcome;

    @Schema(description = "Failure kind when the outcome is FAILURE")
    ChaseErrorKind errorKind;

    @Schema(description = "Human readable detail or failure reason")
    String detail;

    @Schema(description = "Attempt count after the action", example = "2")
    int attempts;

    @Schema(description = "Risk score at the time of the action", example = "0.41")
    double riskScore;

    @Schema(description = "Sequence number of the lease under which the action was committed; 0 for external events")
    long leaseSeq;

    @Schema(description = "Timestamp (epoch millis)", example = "1739886764000")
    long timestamp;

    public boolean isTransition() {
        return fromStatus != toStatus;
    }
}
