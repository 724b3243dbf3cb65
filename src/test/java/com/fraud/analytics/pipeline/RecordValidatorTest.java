package com.fraud.analytics.pipeline;

import com.fraud.analytics.domain.Transaction;
import com.fraud.analytics.domain.TransactionRecord;
import com.fraud.analytics.error.InvalidRecordException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RecordValidator}.
 */
class RecordValidatorTest {

    private final RecordValidator validator = new RecordValidator();

    @Test
    void validRecordBecomesTransaction() {
        TransactionRecord record = TransactionRecord.builder()
                .id(" tx-1 ")
                .amount("125.40")
                .timestamp("2024-06-12T10:15:00Z")
                .account("  acct-7 ")
                .vendor("   ")
                .description("Office supplies")
                .build();

        Transaction tx = validator.validate(record, 0);

        assertThat(tx.getId()).isEqualTo("tx-1");
        assertThat(tx.getAmount()).isEqualByComparingTo(new BigDecimal("125.40"));
        assertThat(tx.getTimestamp()).isEqualTo(Instant.parse("2024-06-12T10:15:00Z"));
        assertThat(tx.getAccount()).isEqualTo("acct-7");
        assertThat(tx.getVendor()).isNull();
        assertThat(tx.entityKey()).isEqualTo("account_acct-7");
    }

    @Test
    void missingIdFallsBackToPosition() {
        Transaction tx = validator.validate(record(null, "10", "2024-06-12"), 4);

        assertThat(tx.getId()).isEqualTo("record-4");
    }

    @Test
    void timestampVariantsAreNormalisedToUtc() {
        assertThat(RecordValidator.parseTimestamp("t", "2024-06-12T12:15:00+02:00"))
                .isEqualTo(Instant.parse("2024-06-12T10:15:00Z"));
        assertThat(RecordValidator.parseTimestamp("t", "2024-06-12T10:15:00"))
                .isEqualTo(Instant.parse("2024-06-12T10:15:00Z"));
        assertThat(RecordValidator.parseTimestamp("t", "2024-06-12"))
                .isEqualTo(Instant.parse("2024-06-12T00:00:00Z"));
        assertThat(RecordValidator.parseTimestamp("t", "2024-06-12T10:15:30.250Z"))
                .isEqualTo(Instant.parse("2024-06-12T10:15:30.250Z"));
    }

    @Test
    void missingAmountIsRejected() {
        assertThatThrownBy(() -> validator.validate(record("tx-2", null, "2024-06-12"), 1))
                .isInstanceOf(InvalidRecordException.class)
                .satisfies(e -> {
                    InvalidRecordException ire = (InvalidRecordException) e;
                    assertThat(ire.getRecordId()).isEqualTo("tx-2");
                    assertThat(ire.getReason()).isEqualTo("missing amount");
                });
    }

    @Test
    void nonNumericAmountIsRejected() {
        assertThatThrownBy(() -> validator.validate(record("tx-3", "12,50", "2024-06-12"), 2))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("non-numeric amount '12,50'");
    }

    @Test
    void amountsBeyondDoubleRangeAreRejected() {
        assertThatThrownBy(() -> validator.validate(record("tx-6", "1e400", "2024-06-12"), 5))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("amount out of range '1e400'");
        assertThatThrownBy(() -> validator.validate(record("tx-7", "1E+999999999", "2024-06-12"), 6))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("amount out of range");
        assertThatThrownBy(() -> validator.validate(record("tx-8", "-2E+15", "2024-06-12"), 7))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("amount out of range");
    }

    @Test
    void excessiveDecimalPlacesAreRejected() {
        assertThatThrownBy(() -> validator.validate(record("tx-9", "1E-999999999", "2024-06-12"), 8))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("more than 12 decimal places");
        assertThatThrownBy(() -> validator.validate(record("tx-10", "0.0000000000001", "2024-06-12"), 9))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("more than 12 decimal places");
    }

    @Test
    void amountsAtTheLimitsAreAccepted() {
        assertThat(validator.validate(record("a", "1E+15", "2024-06-12"), 0).amountValue()).isEqualTo(1e15);
        assertThat(validator.validate(record("b", "0.000000000001", "2024-06-12"), 0).amountValue()).isEqualTo(1e-12);
        assertThat(validator.validate(record("c", "0.0001000000000000", "2024-06-12"), 0).amountValue()).isEqualTo(1e-4);
    }

    @Test
    void missingOrBrokenTimestampIsRejected() {
        assertThatThrownBy(() -> validator.validate(record("tx-4", "10", " "), 3))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("missing timestamp");
        assertThatThrownBy(() -> validator.validate(record("tx-5", "10", "12/06/2024"), 4))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("unparseable timestamp");
    }

    private static TransactionRecord record(String id, String amount, String timestamp) {
        return TransactionRecord.builder().id(id).amount(amount).timestamp(timestamp).build();
    }
}
