package com.advisor.chase.model;

public enum SendOutcome {
    SUCCESS,
    TRANSIENT_CHANNEL_ERROR,
    PERMANENT_CHANNEL_ERROR
}
