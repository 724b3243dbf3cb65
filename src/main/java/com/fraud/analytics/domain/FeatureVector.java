package com.fraud.analytics.domain;

import com.fraud.analytics.features.Feature;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed-length feature vector ({@link Feature#COUNT} values, ordered as {@link Feature}).
 */
@Getter
@EqualsAndHashCode
public final class FeatureVector {

    private final String transactionId;
    private final double[] values;

    public FeatureVector(String transactionId, double[] values) {
        if (values.length != Feature.COUNT) {
            throw new IllegalArgumentException("Feature vector must have " + Feature.COUNT + " values, got " + values.length);
        }
        this.transactionId = transactionId;
        this.values = values.clone();
    }

    public double get(Feature feature) {
        return values[feature.ordinal()];
    }

    public double[] toArray() {
        return values.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public Map<Feature, Double> asMap() {
        Map<Feature, Double> map = new EnumMap<>(Feature.class);
        for (Feature f : Feature.values()) {
            map.put(f, values[f.ordinal()]);
        }
        return map;
    }

    @Override
    public String toString() {
        return "FeatureVector(" + transactionId + ", " + Arrays.toString(values) + ")";
    }
}
