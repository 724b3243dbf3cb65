package com.fraud.analytics.cache;

import com.fraud.analytics.domain.AnalysisReport;

import java.util.Optional;

/**
 * Memoises analysis reports by a key derived from the batch and the configuration
 * (see {@link ReportCacheKeys}). Implementations treat their own failures as misses.
 */
public interface ReportCache {

    Optional<AnalysisReport> get(String key);

    void put(String key, AnalysisReport report);
}
