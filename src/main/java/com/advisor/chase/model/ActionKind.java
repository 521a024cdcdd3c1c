package com.advisor.chase.model;

public enum ActionKind {
    SEND,
    ESCALATE,
    MARK_FAILED
}
