package com.fraud.analytics.classifier;

import com.fraud.analytics.error.ConfigurationException;
import com.fraud.analytics.features.Feature;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer layout of the feed-forward classifier: an input width followed by dense layers.
 */
@Value
public class ClassifierArchitecture {

    int inputSize;
    List<LayerSpec> layers;

    public ClassifierArchitecture(int inputSize, List<LayerSpec> layers) {
        if (inputSize <= 0) {
            throw new ConfigurationException("Classifier input size must be positive, got " + inputSize);
        }
        if (layers == null || layers.isEmpty()) {
            throw new ConfigurationException("Classifier needs at least one layer");
        }
        for (int i = 0; i < layers.size(); i++) {
            LayerSpec layer = layers.get(i);
            if (layer.getNeurons() <= 0) {
                throw new ConfigurationException("Layer " + i + " must have a positive neuron count");
            }
            if (layer.getActivation() == null) {
                throw new ConfigurationException("Layer " + i + " has no activation");
            }
        }
        this.inputSize = inputSize;
        this.layers = List.copyOf(layers);
    }

    /** 20 -> 32 relu -> 16 relu -> 8 relu -> 3 softmax (legitimate, suspicious, fraudulent). */
    public static ClassifierArchitecture multiClass() {
        return withHiddenLayers(List.of(32, 16, 8), FraudLabel.values().length, Activation.SOFTMAX);
    }

    /** Same hidden stack with a single sigmoid unit: plain fraud / not fraud. */
    public static ClassifierArchitecture binary() {
        return withHiddenLayers(List.of(32, 16, 8), 1, Activation.SIGMOID);
    }

    public static ClassifierArchitecture withHiddenLayers(List<Integer> hidden, int outputs, Activation outputActivation) {
        List<LayerSpec> layers = new ArrayList<>();
        for (Integer neurons : hidden) {
            layers.add(LayerSpec.of(neurons, Activation.RELU));
        }
        layers.add(LayerSpec.of(outputs, outputActivation));
        return new ClassifierArchitecture(Feature.COUNT, layers);
    }

    public int outputSize() {
        return layers.get(layers.size() - 1).getNeurons();
    }

    public int layerInputSize(int layerIndex) {
        return layerIndex == 0 ? inputSize : layers.get(layerIndex - 1).getNeurons();
    }
}
