package com.fraud.analytics.pipeline;

import com.fraud.analytics.domain.Transaction;
import com.fraud.analytics.domain.TransactionRecord;
import com.fraud.analytics.error.InvalidRecordException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Turns a raw record into a {@link Transaction}, or rejects it with the reason.
 * A record without an id is named after its position in the batch.
 */
public class RecordValidator {

    /** Largest accepted magnitude; keeps batch sums and squared deviations finite. */
    static final BigDecimal MAX_ABS_AMOUNT = new BigDecimal("1E+15");
    static final int MAX_DECIMAL_PLACES = 12;

    /** ISO-8601 date, optionally followed by a time and an offset; no offset means UTC. */
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    public Transaction validate(TransactionRecord record, int index) {
        String id = record.getId() != null && !record.getId().isBlank() ? record.getId().trim() : "record-" + index;
        return Transaction.builder()
                .id(id)
                .amount(parseAmount(id, record.getAmount()))
                .timestamp(parseTimestamp(id, record.getTimestamp()))
                .account(trimToNull(record.getAccount()))
                .vendor(trimToNull(record.getVendor()))
                .description(record.getDescription())
                .build();
    }

    static BigDecimal parseAmount(String id, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRecordException(id, "missing amount");
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRecordException(id, "non-numeric amount '" + raw + "'");
        }
        if (amount.abs().compareTo(MAX_ABS_AMOUNT) > 0) {
            throw new InvalidRecordException(id, "amount out of range '" + raw + "'");
        }
        if (amount.signum() != 0 && amount.stripTrailingZeros().scale() > MAX_DECIMAL_PLACES) {
            throw new InvalidRecordException(id, "amount has more than " + MAX_DECIMAL_PLACES
                    + " decimal places '" + raw + "'");
        }
        return amount;
    }

    static Instant parseTimestamp(String id, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRecordException(id, "missing timestamp");
        }
        try {
            TemporalAccessor parsed = TIMESTAMP_FORMAT.parseBest(raw.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            if (parsed instanceof LocalDateTime) {
                return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException(id, "unparseable timestamp '" + raw + "'");
        }
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
