package com.advisor.chase.model;

public enum ChaseStatus {
    CREATED,
    PENDING,
    SENT,
    AWAITING_RESPONSE,
    OVERDUE,
    ESCALATED,
    RECEIVED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == RECEIVED || this == COMPLETED || this == FAILED;
    }

    /**
     * Overdue and escalated items jump the queue within a tick.
     */
    public boolean isUrgent() {
        return this == OVERDUE || this == ESCALATED;
    }
}
