package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class RiskVerdict {

    String transactionId;
    /** 0-100. */
    int riskScore;
    RiskLevel riskLevel;
    RiskSignals signals;
    List<String> reasoning;
}
