package com.xammer.iamrisk.dto.risk;

/**
 * Discrete severity band, declared from most to least severe.
 */
public enum RiskLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    public boolean isAtLeast(RiskLevel other) {
        return this.ordinal() <= other.ordinal();
    }
}
