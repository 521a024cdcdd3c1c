package com.advisor.chase.model;

public enum ChaseType {
    DOCUMENT,
    LOA
}
