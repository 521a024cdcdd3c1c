package com.advisor.chase.model;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * One step up, saturating at HIGH.
     */
    public Priority raise() {
        return this == LOW ? MEDIUM : HIGH;
    }
}
