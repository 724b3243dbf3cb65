package com.fraud.analytics.training;

import com.fraud.analytics.classifier.FraudLabel;
import com.fraud.analytics.pipeline.RecordValidator;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SyntheticDataGenerator}.
 */
class SyntheticDataGeneratorTest {

    @Test
    void sameSeedGivesSameData() {
        assertThat(new SyntheticDataGenerator(7L).generate(50)).isEqualTo(new SyntheticDataGenerator(7L).generate(50));
        assertThat(new SyntheticDataGenerator(7L).generate(50)).isNotEqualTo(new SyntheticDataGenerator(8L).generate(50));
    }

    @Test
    void labelMixIsRoughlySixtyTwentyTwenty() {
        Map<FraudLabel, Long> counts = new SyntheticDataGenerator().generate(2000).stream()
                .collect(Collectors.groupingBy(LabeledRecord::getLabel, Collectors.counting()));

        assertThat(counts.get(FraudLabel.LEGITIMATE)).isBetween(1100L, 1300L);
        assertThat(counts.get(FraudLabel.SUSPICIOUS)).isBetween(320L, 480L);
        assertThat(counts.get(FraudLabel.FRAUDULENT)).isBetween(320L, 480L);
    }

    @Test
    void amountsMatchTheirLabel() {
        List<LabeledRecord> records = new SyntheticDataGenerator().generate(500);

        for (LabeledRecord r : records) {
            BigDecimal amount = new BigDecimal(r.getTransaction().getAmount());
            switch (r.getLabel()) {
                case FRAUDULENT:
                    assertThat(amount).isBetween(new BigDecimal("0.0001"), new BigDecimal("0.0099"));
                    assertThat(r.getTransaction().getAccount()).startsWith("acct-skim-");
                    break;
                case SUSPICIOUS:
                    assertThat(amount.remainder(new BigDecimal("1000")).doubleValue() >= 900
                            || amount.remainder(new BigDecimal("2500")).doubleValue() >= 2400).isTrue();
                    break;
                default:
                    assertThat(amount).isBetween(new BigDecimal("5"), new BigDecimal("994.99"));
            }
        }
    }

    @Test
    void everyRecordPassesValidation() {
        RecordValidator validator = new RecordValidator();
        List<LabeledRecord> records = new SyntheticDataGenerator().generate(200);

        for (int i = 0; i < records.size(); i++) {
            assertThat(validator.validate(records.get(i).getTransaction(), i).getId()).startsWith("syn-");
        }
        assertThat(records.stream().map(r -> r.getTransaction().getId()).collect(Collectors.toSet())).hasSize(200);
    }

    @Test
    void csvHasHeaderAndOneRowPerRecord() {
        List<LabeledRecord> records = new SyntheticDataGenerator().generate(25);

        String csv = SyntheticDataGenerator.toCsv(records);

        String[] lines = csv.split("\n");
        assertThat(lines).hasSize(26);
        assertThat(lines[0]).isEqualTo("id,amount,timestamp,account,vendor,description,label");
        Map<String, LabeledRecord> byId = records.stream()
                .collect(Collectors.toMap(r -> r.getTransaction().getId(), Function.identity()));
        String[] first = lines[1].split(",");
        assertThat(first).hasSize(7);
        assertThat(first[6]).isEqualTo(byId.get(first[0]).getLabel().name().toLowerCase());
    }

    @Test
    void csvEscapesDelimitersAndQuotes() {
        assertThat(SyntheticDataGenerator.escapeCsv("plain")).isEqualTo("plain");
        assertThat(SyntheticDataGenerator.escapeCsv("a,b")).isEqualTo("\"a,b\"");
        assertThat(SyntheticDataGenerator.escapeCsv("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(SyntheticDataGenerator.escapeCsv(null)).isEmpty();
    }

    @Test
    void nonPositiveCountIsRejected() {
        assertThatThrownBy(() -> new SyntheticDataGenerator().generate(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
