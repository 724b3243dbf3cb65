package com.fraud.analytics.features;

import com.fraud.analytics.domain.BatchProfile;
import com.fraud.analytics.domain.FeatureVector;
import com.fraud.analytics.domain.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.MonthDay;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns one transaction into a fixed-length {@link FeatureVector}. Every feature is a
 * deterministic function of the transaction, the optional batch profile and the optional
 * batch activity; behavioural and distributional features are 0 when their context is absent.
 */
@Slf4j
public class FeatureExtractor {

    private static final double[] MAGNITUDE_ANCHORS = {1, 10, 100, 1_000, 10_000};
    private static final double LOG_FLOOR = 1e-4;
    private static final double LOG_RANGE_DECADES = 9.0;
    private static final int DESCRIPTION_TERM_SATURATION = 3;
    private static final Pattern NON_WORD = Pattern.compile("\\W+");

    private final FeatureSettings settings;
    private final Set<MonthDay> holidays;

    public FeatureExtractor(FeatureSettings settings) {
        this.settings = settings;
        this.holidays = new HashSet<>(settings.getHolidays());
    }

    public FeatureVector extract(Transaction tx) {
        return extract(tx, null, null);
    }

    public FeatureVector extract(Transaction tx, BatchProfile profile, BatchActivity activity) {
        if (tx.getAmount() == null || tx.getTimestamp() == null) {
            throw new IllegalArgumentException("Transaction " + tx.getId() + " has no amount or timestamp");
        }
        double[] f = new double[Feature.COUNT];
        BigDecimal amount = tx.getAmount();
        double value = amount.doubleValue();
        double abs = Math.abs(value);

        f[Feature.LOG_AMOUNT.ordinal()] = clamp((Math.log10(Math.max(abs, LOG_FLOOR)) + 4) / LOG_RANGE_DECADES);
        f[Feature.MICRO_AMOUNT.ordinal()] = microAmountScore(abs);
        f[Feature.MAGNITUDE_DEVIATION.ordinal()] = magnitudeDeviation(abs);
        f[Feature.ROUND_NUMBER.ordinal()] = roundNumberScore(amount);
        f[Feature.FRACTIONAL_MANIPULATION.ordinal()] = fractionalManipulationScore(amount);

        ZonedDateTime time = tx.getTimestamp().atZone(ZoneOffset.UTC);
        int hour = time.getHour();
        DayOfWeek dow = time.getDayOfWeek();
        boolean weekend = dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
        boolean monthEnd = time.getDayOfMonth() == time.toLocalDate().lengthOfMonth();
        f[Feature.HOUR_OF_DAY.ordinal()] = hour / 23.0;
        f[Feature.DAY_OF_WEEK.ordinal()] = (dow.getValue() - 1) / 6.0;
        f[Feature.WEEKEND.ordinal()] = weekend ? 1.0 : 0.0;
        f[Feature.HOLIDAY.ordinal()] = holidays.contains(MonthDay.from(time)) ? 1.0 : 0.0;
        f[Feature.BUSINESS_HOURS.ordinal()] = !weekend && hour >= 9 && hour <= 17 ? 1.0 : 0.0;
        f[Feature.MONTH_END.ordinal()] = monthEnd ? 1.0 : 0.0;
        f[Feature.QUARTER_END.ordinal()] = monthEnd && time.getMonthValue() % 3 == 0 ? 1.0 : 0.0;
        f[Feature.UNUSUAL_HOUR.ordinal()] = unusualHourScore(hour);

        if (activity != null && activity.batchSize() > 0) {
            String key = tx.entityKey();
            int entityCount = activity.entityCount(key);
            f[Feature.ACCOUNT_FREQUENCY.ordinal()] = clamp((double) entityCount / activity.batchSize());
            f[Feature.ACCOUNT_VELOCITY.ordinal()] = velocityScore(entityCount, activity.entitySpanHours(key));
            f[Feature.DUPLICATE_AMOUNT.ordinal()] =
                    clamp((activity.amountOccurrences(amount) - 1) / (double) settings.getDuplicateCeiling());
            f[Feature.AMOUNT_PERCENTILE_RANK.ordinal()] = activity.percentileRank(value);
        }
        f[Feature.DESCRIPTION_RISK.ordinal()] = descriptionRisk(tx.getDescription());

        if (profile != null && profile.getStandardDeviation() > 0.0) {
            double z = Math.abs(value - profile.getMean()) / profile.getStandardDeviation();
            f[Feature.AMOUNT_Z_SCORE.ordinal()] = clamp(z / (2 * settings.getZScoreThreshold()));
        }
        f[Feature.THRESHOLD_PROXIMITY.ordinal()] = thresholdProximity(amount);

        FeatureVector vector = new FeatureVector(tx.getId(), f);
        log.debug("Extracted features for transaction {}", tx.getId());
        return vector;
    }

    /**
     * 1.0 at or below a tenth of the micro threshold, falling to 0.5 at the threshold and
     * to 0 at ten times the threshold.
     */
    double microAmountScore(double abs) {
        double t = settings.getMicroThreshold();
        if (abs <= t / 10) return 1.0;
        if (abs < t) return 1.0 - 0.5 * (abs - t / 10) / (t - t / 10);
        if (abs < 10 * t) return 0.5 * (1.0 - (abs - t) / (9 * t));
        return 0.0;
    }

    static double magnitudeDeviation(double abs) {
        double min = Double.MAX_VALUE;
        for (double anchor : MAGNITUDE_ANCHORS) {
            min = Math.min(min, Math.abs(abs - anchor) / anchor);
        }
        return Math.min(min, 1.0);
    }

    static double roundNumberScore(BigDecimal amount) {
        if (amount.signum() == 0) return 0.0;
        BigDecimal stripped = amount.abs().stripTrailingZeros();
        if (stripped.scale() > 0) return 0.0;
        int trailingZeros = -stripped.scale();
        if (trailingZeros >= 3) return 0.9;
        if (trailingZeros == 2) return 0.7;
        if (trailingZeros == 1) return 0.3;
        return 0.1;
    }

    static double fractionalManipulationScore(BigDecimal amount) {
        BigDecimal abs = amount.abs();
        double fraction = abs.remainder(BigDecimal.ONE).doubleValue();
        double score = 0.0;
        if (fraction > 0 && fraction < 0.01) score = 0.8;
        else if (fraction > 0.99) score = 0.6;
        if (abs.stripTrailingZeros().scale() > 2) score = Math.max(score, 0.5);
        return score;
    }

    static double unusualHourScore(int hour) {
        if (hour >= 2 && hour <= 6) return 0.8;
        if (hour >= 23 || hour <= 1) return 0.6;
        return 0.0;
    }

    double velocityScore(int entityCount, double spanHours) {
        if (entityCount < 2) return 0.0;
        if (spanHours <= 0.0) return 1.0;
        double perHour = entityCount / spanHours;
        return clamp(perHour / settings.getVelocityCeilingPerHour());
    }

    /**
     * Distinct suspicious terms that start a word of the description ("loans" matches "loan",
     * "latest" does not match "test"). A word matching several terms counts once, for the longest.
     */
    double descriptionRisk(String description) {
        if (description == null || description.isBlank()) return 0.0;
        Set<String> matched = new HashSet<>();
        for (String word : NON_WORD.split(description.toLowerCase(Locale.ROOT))) {
            if (word.isEmpty()) continue;
            String best = null;
            for (String term : settings.getSuspiciousTerms()) {
                String t = term.trim().toLowerCase(Locale.ROOT);
                if (!t.isEmpty() && word.startsWith(t) && (best == null || t.length() > best.length())) {
                    best = t;
                }
            }
            if (best != null) matched.add(best);
        }
        return clamp((double) matched.size() / DESCRIPTION_TERM_SATURATION);
    }

    double thresholdProximity(BigDecimal amount) {
        BigDecimal abs = amount.abs();
        BigDecimal band = BigDecimal.valueOf(settings.getThresholdProximityBand());
        List<BigDecimal> thresholds = settings.getApprovalThresholds();
        for (BigDecimal threshold : thresholds) {
            if (abs.compareTo(threshold) < 0 && abs.compareTo(threshold.subtract(band)) >= 0) {
                return 1.0;
            }
        }
        return 0.0;
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
