package com.advisor.chase.model;

public enum TargetKind {
    CLIENT,
    PROVIDER
}
