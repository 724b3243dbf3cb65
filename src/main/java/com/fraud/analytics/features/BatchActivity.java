package com.fraud.analytics.features;

import com.fraud.analytics.domain.Transaction;
import com.fraud.analytics.profile.Percentiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-batch behavioural context: how often each account/vendor appears, over what time span,
 * and how often each exact amount repeats. Built once per batch and read-only afterwards.
 */
public final class BatchActivity {

    private final int batchSize;
    private final Map<String, EntityStats> byEntity;
    private final Map<BigDecimal, Integer> amountOccurrences;
    private final double[] sortedAmounts;

    private BatchActivity(int batchSize, Map<String, EntityStats> byEntity,
                          Map<BigDecimal, Integer> amountOccurrences, double[] sortedAmounts) {
        this.batchSize = batchSize;
        this.byEntity = byEntity;
        this.amountOccurrences = amountOccurrences;
        this.sortedAmounts = sortedAmounts;
    }

    public static BatchActivity of(List<Transaction> transactions) {
        Map<String, EntityStats> byEntity = new HashMap<>();
        Map<BigDecimal, Integer> occurrences = new HashMap<>();
        double[] amounts = new double[transactions.size()];
        for (int i = 0; i < transactions.size(); i++) {
            Transaction tx = transactions.get(i);
            byEntity.computeIfAbsent(tx.entityKey(), k -> new EntityStats()).add(tx.getTimestamp());
            occurrences.merge(tx.getAmount().stripTrailingZeros(), 1, Integer::sum);
            amounts[i] = tx.amountValue();
        }
        Arrays.sort(amounts);
        return new BatchActivity(transactions.size(), Collections.unmodifiableMap(byEntity),
                Collections.unmodifiableMap(occurrences), amounts);
    }

    public int batchSize() {
        return batchSize;
    }

    public int entityCount(String entityKey) {
        EntityStats stats = byEntity.get(entityKey);
        return stats == null ? 0 : stats.count;
    }

    /**
     * Span between the first and last transaction of the entity, in hours.
     */
    public double entitySpanHours(String entityKey) {
        EntityStats stats = byEntity.get(entityKey);
        if (stats == null || stats.count < 2) return 0.0;
        return (stats.last.toEpochMilli() - stats.first.toEpochMilli()) / 3_600_000.0;
    }

    public int amountOccurrences(BigDecimal amount) {
        return amountOccurrences.getOrDefault(amount.stripTrailingZeros(), 0);
    }

    public double percentileRank(double amount) {
        return Percentiles.rankOfSorted(sortedAmounts, amount);
    }

    private static final class EntityStats {
        int count;
        Instant first;
        Instant last;

        void add(Instant ts) {
            count++;
            if (first == null || ts.isBefore(first)) first = ts;
            if (last == null || ts.isAfter(last)) last = ts;
        }
    }
}
