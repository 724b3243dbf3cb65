package com.fraud.analytics.classifier;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class LayerSpec {

    int neurons;
    Activation activation;

    public static LayerSpec of(int neurons, Activation activation) {
        return LayerSpec.builder().neurons(neurons).activation(activation).build();
    }
}
