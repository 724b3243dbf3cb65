package com.fraud.analytics.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.analytics.error.ConfigurationException;

import java.nio.charset.StandardCharsets;

/**
 * Reads and writes {@link ModelSnapshot}s as JSON.
 */
public class ModelSnapshotCodec {

    private final ObjectMapper mapper;

    public ModelSnapshotCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public String write(ModelParameters parameters) {
        try {
            return mapper.writeValueAsString(ModelSnapshot.of(parameters));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize model snapshot", e);
        }
    }

    public byte[] writeBytes(ModelParameters parameters) {
        return write(parameters).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws ConfigurationException when the document is not a snapshot, has an unknown format
     *                                version or its arrays do not match the declared layout
     */
    public ModelParameters read(String json) {
        ModelSnapshot snapshot;
        try {
            snapshot = mapper.readValue(json, ModelSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Could not parse model snapshot: " + e.getOriginalMessage());
        }
        if (snapshot.getFormatVersion() != ModelSnapshot.CURRENT_FORMAT_VERSION) {
            throw new ConfigurationException("Unsupported model snapshot format version " + snapshot.getFormatVersion());
        }
        if (snapshot.getLayers() == null || snapshot.getWeights() == null || snapshot.getBiases() == null) {
            throw new ConfigurationException("Model snapshot is missing layers, weights or biases");
        }
        return snapshot.toParameters();
    }

    public ModelParameters read(byte[] bytes) {
        return read(new String(bytes, StandardCharsets.UTF_8));
    }
}
