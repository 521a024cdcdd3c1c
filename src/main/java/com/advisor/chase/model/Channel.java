package com.advisor.chase.model;

/**
 * Contact channels ordered from least to most urgent.
 */
public enum Channel {
    EMAIL,
    SMS,
    PHONE;

    public static Channel mostUrgent(Channel a, Channel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
