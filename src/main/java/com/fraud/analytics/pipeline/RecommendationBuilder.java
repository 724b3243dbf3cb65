package com.fraud.analytics.pipeline;

import com.fraud.analytics.domain.BatchProfile;
import com.fraud.analytics.domain.BenfordAnalysis;
import com.fraud.analytics.domain.BenfordCompliance;
import com.fraud.analytics.domain.RiskLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Batch-level follow-up actions for the report, most urgent first.
 */
public class RecommendationBuilder {

    /** A transaction counts towards a micro-amount cluster at this MICRO_AMOUNT feature value. */
    static final double MICRO_INDICATOR = 0.5;
    /** Share of the batch that makes micro amounts a cluster rather than noise. */
    static final double MICRO_CLUSTER_SHARE = 0.05;
    static final int MICRO_CLUSTER_MIN = 3;

    public List<String> build(BatchProfile profile, Map<RiskLevel, Integer> severityCounts,
                              int outlierCount, int microCount, int batchSize) {
        List<String> out = new ArrayList<>();
        int critical = severityCounts.getOrDefault(RiskLevel.CRITICAL, 0);
        int high = severityCounts.getOrDefault(RiskLevel.HIGH, 0);
        if (critical > 0) {
            out.add(String.format(Locale.ROOT,
                    "Place %d CRITICAL transaction(s) on immediate hold pending investigation", critical));
        }
        if (high > 0) {
            out.add(String.format(Locale.ROOT, "Escalate %d HIGH risk transaction(s) for manual review", high));
        }
        if (microCount >= MICRO_CLUSTER_MIN && microCount >= MICRO_CLUSTER_SHARE * batchSize) {
            out.add(String.format(Locale.ROOT,
                    "%d micro-amount transaction(s) detected; investigate possible micro-skimming", microCount));
        }
        BenfordAnalysis benford = profile.getBenfordsAnalysis();
        if (benford != null && benford.getCompliance() == BenfordCompliance.POOR) {
            out.add(String.format(Locale.ROOT,
                    "Leading digits deviate from Benford's Law (chi-square %.2f); schedule a forensic review of vendor invoices",
                    benford.getChiSquare()));
        }
        if (outlierCount > 0) {
            out.add(String.format(Locale.ROOT, "Review %d statistical outlier(s) against supporting documents", outlierCount));
        }
        if (benford != null && benford.getCompliance() == BenfordCompliance.INSUFFICIENT_DATA) {
            out.add("Batch is too small for a reliable Benford's Law test; analyse a larger period");
        }
        if (out.isEmpty()) {
            out.add("No immediate action required; continue routine monitoring");
        }
        return List.copyOf(out);
    }
}
