package com.advisor.chase.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel fromScore(double score) {
        if (score >= 0.66) return HIGH;
        if (score >= 0.33) return MEDIUM;
        return LOW;
    }
}
