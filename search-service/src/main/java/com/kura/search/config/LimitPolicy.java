package com.kura.search.config;

public enum LimitPolicy {
    REJECT,
    CLAMP
}
