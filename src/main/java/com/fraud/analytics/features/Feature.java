package com.fraud.analytics.features;

/**
 * Layout of the feature vector. The ordinal is the index in the vector and the classifier's
 * input layer, so entries must never be reordered.
 */
public enum Feature {
    LOG_AMOUNT,
    MICRO_AMOUNT,
    MAGNITUDE_DEVIATION,
    ROUND_NUMBER,
    FRACTIONAL_MANIPULATION,
    HOUR_OF_DAY,
    DAY_OF_WEEK,
    WEEKEND,
    HOLIDAY,
    BUSINESS_HOURS,
    MONTH_END,
    QUARTER_END,
    UNUSUAL_HOUR,
    ACCOUNT_FREQUENCY,
    ACCOUNT_VELOCITY,
    DUPLICATE_AMOUNT,
    DESCRIPTION_RISK,
    AMOUNT_Z_SCORE,
    AMOUNT_PERCENTILE_RANK,
    THRESHOLD_PROXIMITY;

    public static final int COUNT = values().length;
}
