package com.fraud.analytics.domain;

/**
 * Outcome of the first-digit chi-square test (8 degrees of freedom).
 */
public enum BenfordCompliance {
    /** chi-square below 15.51 (p &lt; 0.05 critical value). */
    GOOD,
    /** chi-square below 20.09 (p &lt; 0.01 critical value). */
    ACCEPTABLE,
    POOR,
    /** Fewer than 10 usable leading digits; the statistic is reported but not classified. */
    INSUFFICIENT_DATA
}
