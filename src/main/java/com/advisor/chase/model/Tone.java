package com.advisor.chase.model;

public enum Tone {
    FRIENDLY,
    GENTLE,
    URGENT
}
