package com.fraud.analytics.domain;

public enum OutlierSeverity {
    NONE,
    MILD,
    MODERATE,
    SEVERE;

    public static OutlierSeverity fromScore(double score) {
        if (score <= 0.0) return NONE;
        if (score < 0.5) return MILD;
        if (score < 0.8) return MODERATE;
        return SEVERE;
    }
}
