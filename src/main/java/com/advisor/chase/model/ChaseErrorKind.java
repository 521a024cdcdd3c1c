package com.advisor.chase.model;

/**
 * Failure kinds recorded on activities. Concurrency conflicts and missing provider
 * profiles are never recorded as failures.
 */
public enum ChaseErrorKind {
    TRANSIENT_CHANNEL_ERROR,
    PERMANENT_CHANNEL_ERROR,
    INVALID_TARGET,
    MISSING_REQUIRED_FIELD,
    ATTEMPT_CAP_EXCEEDED,
    AGENT_ERROR;

    public boolean isTerminal() {
        return this != TRANSIENT_CHANNEL_ERROR && this != AGENT_ERROR;
    }
}
