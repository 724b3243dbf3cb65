package com.fraud.analytics.profile;

import com.fraud.analytics.domain.BenfordAnalysis;
import com.fraud.analytics.domain.BenfordCompliance;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * First-digit test against Benford's Law. The sign is stripped before the leading significant
 * digit is read, so a refund of -45.10 contributes a 4; zero amounts contribute nothing.
 */
public class BenfordAnalyzer {

    /** Critical value of chi-square with 8 degrees of freedom at p = 0.05. */
    public static final double CRITICAL_P05 = 15.51;
    /** Critical value of chi-square with 8 degrees of freedom at p = 0.01. */
    public static final double CRITICAL_P01 = 20.09;
    public static final int MIN_SAMPLE_SIZE = 10;

    private static final double[] EXPECTED = new double[10];

    static {
        for (int d = 1; d <= 9; d++) {
            EXPECTED[d] = Math.log10(1.0 + 1.0 / d);
        }
    }

    public static double expectedFrequency(int digit) {
        if (digit < 1 || digit > 9) throw new IllegalArgumentException("Digit must be 1..9, got " + digit);
        return EXPECTED[digit];
    }

    /**
     * Leading significant digit of |amount|, or 0 for zero and non-finite values.
     */
    public static int leadingDigit(double amount) {
        if (amount == 0.0 || Double.isNaN(amount) || Double.isInfinite(amount)) return 0;
        String unscaled = BigDecimal.valueOf(Math.abs(amount)).stripTrailingZeros().unscaledValue().toString();
        return unscaled.charAt(0) - '0';
    }

    public BenfordAnalysis analyze(List<Double> amounts) {
        long[] counts = new long[10];
        int n = 0;
        for (Double amount : amounts) {
            if (amount == null) continue;
            int digit = leadingDigit(amount);
            if (digit == 0) continue;
            counts[digit]++;
            n++;
        }

        Map<Integer, Long> observedCounts = new LinkedHashMap<>();
        Map<Integer, Double> observed = new LinkedHashMap<>();
        Map<Integer, Double> expected = new LinkedHashMap<>();
        double chiSquare = 0.0;
        double deviation = 0.0;
        for (int d = 1; d <= 9; d++) {
            double observedFreq = n > 0 ? (double) counts[d] / n : 0.0;
            observedCounts.put(d, counts[d]);
            observed.put(d, observedFreq);
            expected.put(d, EXPECTED[d]);
            double expectedCount = EXPECTED[d] * n;
            if (expectedCount > 0) {
                chiSquare += Math.pow(counts[d] - expectedCount, 2) / expectedCount;
            }
            if (n > 0) deviation += Math.abs(observedFreq - EXPECTED[d]);
        }

        boolean lowConfidence = n < MIN_SAMPLE_SIZE;
        BenfordCompliance compliance;
        if (lowConfidence) compliance = BenfordCompliance.INSUFFICIENT_DATA;
        else if (chiSquare < CRITICAL_P05) compliance = BenfordCompliance.GOOD;
        else if (chiSquare < CRITICAL_P01) compliance = BenfordCompliance.ACCEPTABLE;
        else compliance = BenfordCompliance.POOR;

        return BenfordAnalysis.builder()
                .sampleSize(n)
                .observedCounts(observedCounts)
                .observedDistribution(observed)
                .expectedDistribution(expected)
                .chiSquare(chiSquare)
                .deviationScore(deviation)
                .compliance(compliance)
                .lowConfidence(lowConfidence)
                .build();
    }
}
