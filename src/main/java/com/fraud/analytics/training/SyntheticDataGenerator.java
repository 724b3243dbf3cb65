package com.fraud.analytics.training;

import com.fraud.analytics.classifier.FraudLabel;
import com.fraud.analytics.domain.TransactionRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Seeded generator of labelled transactions for bootstrapping and demos:
 * <ul>
 *   <li>legitimate: ordinary amounts, mostly weekday business hours</li>
 *   <li>suspicious: amounts just under an approval threshold (threshold evasion)</li>
 *   <li>fraudulent: sub-cent amounts skimmed by a few accounts at any hour</li>
 * </ul>
 * Same seed and count, same records.
 */
public class SyntheticDataGenerator {

    static final double LEGITIMATE_SHARE = 0.6;
    static final double SUSPICIOUS_SHARE = 0.2;

    private static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");
    private static final int SPAN_DAYS = 90;
    private static final int[] APPROVAL_THRESHOLDS = {1_000, 2_500, 5_000, 10_000};
    private static final String[] VENDORS = {
            "Acme Office Supply", "Northwind Logistics", "Contoso Travel", "Globex Utilities",
            "Initech Software", "Umbrella Catering", "Stark Hardware", "Wayne Facilities"};
    private static final String[] ORDINARY_DESCRIPTIONS = {
            "office supplies", "monthly subscription", "travel booking", "utility bill",
            "software licence", "catering order", "hardware purchase", "facility maintenance"};
    private static final String[] EVASION_DESCRIPTIONS = {
            "consulting services", "miscellaneous expenses", "advance payment", "vendor adjustment"};
    private static final String[] SKIM_DESCRIPTIONS = {
            "rounding adjustment", "service fee", "fx correction", "processing fee"};

    private final long seed;

    public SyntheticDataGenerator(long seed) {
        this.seed = seed;
    }

    public SyntheticDataGenerator() {
        this(42L);
    }

    public List<LabeledRecord> generate(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0, got " + count);
        }
        Random random = new Random(seed);
        List<LabeledRecord> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double roll = random.nextDouble();
            FraudLabel label = roll < LEGITIMATE_SHARE ? FraudLabel.LEGITIMATE
                    : roll < LEGITIMATE_SHARE + SUSPICIOUS_SHARE ? FraudLabel.SUSPICIOUS
                    : FraudLabel.FRAUDULENT;
            out.add(LabeledRecord.builder()
                    .transaction(record(i, label, random))
                    .label(label)
                    .build());
        }
        return out;
    }

    private TransactionRecord record(int index, FraudLabel label, Random random) {
        String vendor = VENDORS[random.nextInt(VENDORS.length)];
        switch (label) {
            case SUSPICIOUS: {
                int threshold = APPROVAL_THRESHOLDS[random.nextInt(APPROVAL_THRESHOLDS.length)];
                BigDecimal amount = BigDecimal.valueOf(threshold - 1 - random.nextInt(95))
                        .add(cents(random));
                return TransactionRecord.builder()
                        .id(String.format("syn-%05d", index))
                        .amount(amount.toPlainString())
                        .timestamp(timestamp(random, random.nextDouble() < 0.5).toString())
                        .account("acct-" + (1 + random.nextInt(40)))
                        .vendor(vendor)
                        .description(EVASION_DESCRIPTIONS[random.nextInt(EVASION_DESCRIPTIONS.length)])
                        .build();
            }
            case FRAUDULENT: {
                BigDecimal amount = BigDecimal.valueOf(1 + random.nextInt(99), 4);
                return TransactionRecord.builder()
                        .id(String.format("syn-%05d", index))
                        .amount(amount.toPlainString())
                        .timestamp(timestamp(random, false).toString())
                        .account("acct-skim-" + (1 + random.nextInt(3)))
                        .vendor(vendor)
                        .description(SKIM_DESCRIPTIONS[random.nextInt(SKIM_DESCRIPTIONS.length)])
                        .build();
            }
            default: {
                BigDecimal amount = BigDecimal.valueOf(5 + random.nextInt(990)).add(cents(random));
                return TransactionRecord.builder()
                        .id(String.format("syn-%05d", index))
                        .amount(amount.toPlainString())
                        .timestamp(timestamp(random, random.nextDouble() < 0.8).toString())
                        .account("acct-" + (1 + random.nextInt(40)))
                        .vendor(vendor)
                        .description(ORDINARY_DESCRIPTIONS[random.nextInt(ORDINARY_DESCRIPTIONS.length)])
                        .build();
            }
        }
    }

    private static BigDecimal cents(Random random) {
        return BigDecimal.valueOf(random.nextInt(100)).divide(BigDecimal.valueOf(100), 2, RoundingMode.UNNECESSARY);
    }

    /**
     * A timestamp within the generation window; business hours means 09:00-16:59 on a weekday.
     */
    private static Instant timestamp(Random random, boolean businessHours) {
        int day = random.nextInt(SPAN_DAYS);
        Instant midnight = EPOCH.plus(Duration.ofDays(day));
        if (businessHours) {
            // 2024-01-01 is a Monday
            int weekday = day % 7;
            if (weekday >= 5) {
                midnight = midnight.minus(Duration.ofDays(weekday - 4L));
            }
            return midnight.plus(Duration.ofMinutes(9 * 60 + random.nextInt(8 * 60)));
        }
        return midnight.plus(Duration.ofMinutes(random.nextInt(24 * 60)));
    }

    /**
     * CSV with one row per record: id, amount, timestamp, account, vendor, description, label.
     */
    public static String toCsv(List<LabeledRecord> records) {
        StringBuilder csv = new StringBuilder("id,amount,timestamp,account,vendor,description,label\n");
        for (LabeledRecord r : records) {
            TransactionRecord t = r.getTransaction();
            csv.append(escapeCsv(t.getId())).append(',')
                    .append(escapeCsv(t.getAmount())).append(',')
                    .append(escapeCsv(t.getTimestamp())).append(',')
                    .append(escapeCsv(t.getAccount())).append(',')
                    .append(escapeCsv(t.getVendor())).append(',')
                    .append(escapeCsv(t.getDescription())).append(',')
                    .append(r.getLabel().name().toLowerCase(Locale.ROOT))
                    .append('\n');
        }
        return csv.toString();
    }

    static String escapeCsv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
