package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class BatchSummary {

    BenfordAnalysis benfordsAnalysis;
    int outlierCount;
    /** Every band is present, in ascending severity. */
    Map<RiskLevel, Integer> severityCounts;
    /** HIGH and CRITICAL verdicts, highest score first, capped at the configured N. */
    List<RiskVerdict> topAlerts;
}
