package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A validated, immutable transaction. Created by the record validator, read-only afterwards.
 */
@Value
@Builder
public class Transaction {

    String id;
    BigDecimal amount;
    /** Always UTC; temporal features are computed in UTC. */
    Instant timestamp;
    String account;
    String vendor;
    String description;

    public double amountValue() {
        return amount.doubleValue();
    }

    /**
     * Grouping key for frequency and velocity: account when present, else vendor.
     */
    public String entityKey() {
        if (account != null && !account.isBlank()) return "account_" + account.trim();
        if (vendor != null && !vendor.isBlank()) return "vendor_" + vendor.trim().toLowerCase();
        return "unknown";
    }
}
