package com.fraud.analytics.domain;

/**
 * Severity band of a 0-100 risk score. Drives alerting (HIGH and CRITICAL become alerts).
 */
public enum RiskLevel {
    MINIMAL,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(double score) {
        if (score >= 80) return CRITICAL;
        if (score >= 60) return HIGH;
        if (score >= 40) return MEDIUM;
        if (score >= 20) return LOW;
        return MINIMAL;
    }

    public boolean isAlert() {
        return this == HIGH || this == CRITICAL;
    }
}
