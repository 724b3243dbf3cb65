package com.fraud.analytics.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.analytics.classifier.ModelParameters;
import com.fraud.analytics.classifier.ModelSnapshotCodec;
import com.fraud.analytics.config.FraudAnalyticsProperties;
import com.fraud.analytics.domain.TransactionRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Cache key for a report: SHA-256 over the batch JSON, the analytics configuration and the
 * model weights the report is computed with. Any change to one of them gives a new key.
 */
public class ReportCacheKeys {

    private static final String RULE_ONLY = "rule-only";

    private final ObjectMapper objectMapper;
    private final byte[] configurationFingerprint;
    private final ModelSnapshotCodec codec;

    public ReportCacheKeys(ObjectMapper objectMapper, FraudAnalyticsProperties properties, ModelSnapshotCodec codec) {
        this.objectMapper = objectMapper;
        this.codec = codec;
        this.configurationFingerprint = toJson(properties);
    }

    /**
     * @param model parameters the report is (or was) computed with; null for rule-only
     */
    public String keyFor(List<TransactionRecord> records, ModelParameters model) {
        MessageDigest digest = sha256();
        digest.update(toJson(records));
        digest.update((byte) 0);
        digest.update(configurationFingerprint);
        digest.update((byte) 0);
        digest.update(model != null
                ? codec.writeBytes(model)
                : RULE_ONLY.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest.digest());
    }

    private byte[] toJson(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize cache key input", e);
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
