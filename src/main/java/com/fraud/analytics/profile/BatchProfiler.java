package com.fraud.analytics.profile;

import com.fraud.analytics.domain.BatchProfile;
import com.fraud.analytics.error.InsufficientBatchSizeException;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the distributional profile of a batch of amounts. Mean, variance and standard
 * deviation are population statistics. Skewness and kurtosis are the adjusted Fisher-Pearson
 * estimators (as spreadsheet SKEW/KURT compute them): values are standardised with the sample
 * standard deviation and need at least 4 amounts.
 */
@Slf4j
public class BatchProfiler {

    public static final int MIN_MOMENT_SAMPLE_SIZE = 4;
    private static final int[] PERCENTILES = {10, 25, 50, 75, 90, 95, 99};

    private final BenfordAnalyzer benfordAnalyzer;

    public BatchProfiler() {
        this(new BenfordAnalyzer());
    }

    public BatchProfiler(BenfordAnalyzer benfordAnalyzer) {
        this.benfordAnalyzer = benfordAnalyzer;
    }

    public BatchProfile profile(List<Double> amounts) {
        if (amounts == null || amounts.isEmpty()) {
            throw new InsufficientBatchSizeException("Batch profiling needs at least 1 amount");
        }
        int n = amounts.size();
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = amounts.get(i);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double sum = 0.0;
        int positive = 0;
        int negative = 0;
        for (double v : values) {
            sum += v;
            if (v > 0) positive++;
            else if (v < 0) negative++;
        }
        double mean = sum / n;
        double variance = 0.0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        variance /= n;
        double stdDev = Math.sqrt(variance);

        boolean insufficient = n < MIN_MOMENT_SAMPLE_SIZE;
        double sampleStdDev = n > 1 ? Math.sqrt(variance * n / (n - 1)) : 0.0;
        double skewness = insufficient ? 0.0 : skewness(values, mean, sampleStdDev);
        double kurtosis = insufficient ? 0.0 : kurtosis(values, mean, sampleStdDev);
        if (insufficient) {
            log.debug("Batch of {} amounts is too small for skewness/kurtosis", n);
        }

        Map<String, Double> percentiles = new LinkedHashMap<>();
        for (int p : PERCENTILES) {
            percentiles.put("p" + p, Percentiles.ofSorted(sorted, p));
        }

        double[] absSorted = new double[n];
        for (int i = 0; i < n; i++) {
            absSorted[i] = Math.abs(values[i]);
        }
        Arrays.sort(absSorted);

        return BatchProfile.builder()
                .count(n)
                .sum(sum)
                .min(sorted[0])
                .max(sorted[n - 1])
                .mean(mean)
                .median(Percentiles.ofSorted(sorted, 50))
                .variance(variance)
                .standardDeviation(stdDev)
                .coefficientOfVariation(mean != 0.0 ? stdDev / mean : 0.0)
                .skewness(skewness)
                .kurtosis(kurtosis)
                .sampleSizeInsufficient(insufficient)
                .positiveCount(positive)
                .negativeCount(negative)
                .percentiles(percentiles)
                .absoluteQ1(Percentiles.ofSorted(absSorted, 25))
                .absoluteQ3(Percentiles.ofSorted(absSorted, 75))
                .benfordsAnalysis(benfordAnalyzer.analyze(amounts))
                .build();
    }

    static double skewness(double[] values, double mean, double stdDev) {
        int n = values.length;
        if (stdDev == 0.0 || n < 3) return 0.0;
        double sum = 0.0;
        for (double v : values) {
            sum += Math.pow((v - mean) / stdDev, 3);
        }
        return ((double) n / ((n - 1.0) * (n - 2.0))) * sum;
    }

    static double kurtosis(double[] values, double mean, double stdDev) {
        int n = values.length;
        if (stdDev == 0.0 || n < 4) return 0.0;
        double sum = 0.0;
        for (double v : values) {
            sum += Math.pow((v - mean) / stdDev, 4);
        }
        double nd = n;
        return (nd * (nd + 1)) / ((nd - 1) * (nd - 2) * (nd - 3)) * sum
                - (3 * Math.pow(nd - 1, 2)) / ((nd - 2) * (nd - 3));
    }
}
