package com.fraud.analytics.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fraud.analytics.domain.AnalysisReport;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * Stores {@link AnalysisReport} as plain JSON, without an {@code @class} hint, so entries
 * always read back as AnalysisReport.
 */
public class AnalysisReportRedisSerializer implements RedisSerializer<AnalysisReport> {

    private final ObjectMapper mapper;

    public AnalysisReportRedisSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(AnalysisReport value) throws SerializationException {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new SerializationException("Could not serialize AnalysisReport", e);
        }
    }

    @Override
    public AnalysisReport deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) return null;
        try {
            return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), AnalysisReport.class);
        } catch (Exception e) {
            throw new SerializationException("Could not deserialize AnalysisReport", e);
        }
    }
}
