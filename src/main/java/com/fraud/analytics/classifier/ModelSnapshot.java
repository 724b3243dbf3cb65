package com.fraud.analytics.classifier;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Serialised form of a trained model: layer layout plus every weight and bias.
 * Doubles are written in Jackson's shortest round-trip form, so parsing a snapshot gives
 * back exactly the values that were written.
 */
@Value
@Builder
@Jacksonized
public class ModelSnapshot {

    public static final int CURRENT_FORMAT_VERSION = 1;

    int formatVersion;
    int inputSize;
    List<LayerSpec> layers;
    double[][][] weights;
    double[][] biases;

    public static ModelSnapshot of(ModelParameters parameters) {
        return ModelSnapshot.builder()
                .formatVersion(CURRENT_FORMAT_VERSION)
                .inputSize(parameters.getInputSize())
                .layers(parameters.getLayers())
                .weights(parameters.getWeights())
                .biases(parameters.getBiases())
                .build();
    }

    public ModelParameters toParameters() {
        return new ModelParameters(inputSize, layers, weights, biases);
    }
}
