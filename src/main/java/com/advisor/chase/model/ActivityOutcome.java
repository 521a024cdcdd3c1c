package com.advisor.chase.model;

public enum ActivityOutcome {
    SUCCESS,
    FAILURE
}
