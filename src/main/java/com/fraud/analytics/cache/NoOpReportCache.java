package com.fraud.analytics.cache;

import com.fraud.analytics.domain.AnalysisReport;

import java.util.Optional;

public class NoOpReportCache implements ReportCache {

    @Override
    public Optional<AnalysisReport> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, AnalysisReport report) {
        // caching disabled
    }
}
