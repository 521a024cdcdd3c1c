package com.advisor.chase.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One outstanding document or LOA request tracked through its chase lifecycle")
public class ChaseItem {

    @Schema(description = "Chase item identifier", example = "CHASE-3f1c2a")
    private String id;

    @Schema(description = "Client or provider being chased")
    private ChaseTarget target;

    @Schema(description = "Chase type", example = "LOA")
    private ChaseType type;

    @Schema(description = "Lifecycle status", example = "AWAITING_RESPONSE")
    private ChaseStatus status;

    @Schema(description = "Priority; raised by escalation, never lowered automatically", example = "MEDIUM")
    private Priority priority;

    @Schema(description = "Number of contact attempts made so far", example = "2")
    private int attempts;

    @Schema(description = "Creation timestamp (epoch millis)", example = "1739886764000")
    private long createdAt;

    @Schema(description = "Last contact attempt (epoch millis), 0 before the first attempt")
    private long lastActionAt;

    @Schema(description = "Next scheduled evaluation (epoch millis), 0 when due immediately")
    private long nextActionAt;

    @Schema(description = "First successful contact (epoch millis), 0 until the first send succeeds")
    private long firstContactAt;

    @Schema(description = "Time the item reached a terminal state (epoch millis)")
    private long resolvedAt;

    @Schema(description = "Last computed delay risk in [0, 1]", example = "0.42")
    private double riskScore;

    @Schema(description = "Band of the last computed risk score", example = "MEDIUM")
    private RiskLevel riskLevel;

    @Schema(description = "Provider profile reference for provider-side chases", example = "Aviva")
    private String providerRef;

    @Schema(description = "Client whose advice depends on this item", example = "CLIENT-001")
    private String clientId;

    @Schema(description = "What is being chased", example = "Pension statement 2024")
    private String description;

    @Schema(description = "Provider reference quoted in LOA chases", example = "AV-778812")
    private String referenceNumber;

    @Schema(description = "Most urgent channel used so far", example = "EMAIL")
    private Channel channel;

    @Schema(description = "Whether the item went overdue at any point; folded into the provider profile on resolution")
    private boolean wentOverdue;

    @Schema(description = "Reason recorded when the item failed")
    private ChaseErrorKind failureReason;

    @Schema(description = "Activity ids in the order they were recorded")
    @Builder.Default
    private List<String> history = new ArrayList<>();

    @Schema(description = "Optimistic concurrency version, incremented on every commit", example = "7")
    private long version;

    /**
     * Deep enough copy for callers outside the registry: the history list is not shared.
     */
    public ChaseItem snapshot() {
        return toBuilder()
                .target(target == null ? null : target.toBuilder().build())
                .history(new ArrayList<>(history))
                .build();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
