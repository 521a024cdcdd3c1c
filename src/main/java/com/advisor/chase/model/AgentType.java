package com.advisor.chase.model;

public enum AgentType {
    DOCUMENT_CHASER,
    LOA_CHASER,
    ORCHESTRATOR,
    EXTERNAL
}
