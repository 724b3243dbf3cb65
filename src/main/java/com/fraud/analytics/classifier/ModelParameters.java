package com.fraud.analytics.classifier;

import com.fraud.analytics.error.ConfigurationException;
import lombok.Value;

import java.util.List;

/**
 * Immutable copy of a classifier's weights and biases, with the layout that produced them.
 * {@code weights[l]} has one row per neuron of the previous layer (or input) and one column
 * per neuron of layer {@code l}.
 */
@Value
public class ModelParameters {

    int inputSize;
    List<LayerSpec> layers;
    double[][][] weights;
    double[][] biases;

    public ModelParameters(int inputSize, List<LayerSpec> layers, double[][][] weights, double[][] biases) {
        this.inputSize = inputSize;
        this.layers = List.copyOf(layers);
        this.weights = deepCopy(weights);
        this.biases = deepCopy(biases);
        validate();
    }

    public ClassifierArchitecture architecture() {
        return new ClassifierArchitecture(inputSize, layers);
    }

    public double[][][] getWeights() {
        return deepCopy(weights);
    }

    public double[][] getBiases() {
        return deepCopy(biases);
    }

    private void validate() {
        if (weights.length != layers.size() || biases.length != layers.size()) {
            throw new ConfigurationException("Expected " + layers.size() + " weight matrices and bias vectors, got "
                    + weights.length + " and " + biases.length);
        }
        int previous = inputSize;
        for (int l = 0; l < layers.size(); l++) {
            int neurons = layers.get(l).getNeurons();
            if (weights[l].length != previous) {
                throw new ConfigurationException("Layer " + l + " weight matrix has " + weights[l].length
                        + " rows, expected " + previous);
            }
            for (double[] row : weights[l]) {
                if (row.length != neurons) {
                    throw new ConfigurationException("Layer " + l + " weight row has " + row.length
                            + " columns, expected " + neurons);
                }
            }
            if (biases[l].length != neurons) {
                throw new ConfigurationException("Layer " + l + " bias vector has " + biases[l].length
                        + " entries, expected " + neurons);
            }
            previous = neurons;
        }
    }

    static double[][][] deepCopy(double[][][] src) {
        double[][][] out = new double[src.length][][];
        for (int i = 0; i < src.length; i++) {
            out[i] = deepCopy(src[i]);
        }
        return out;
    }

    static double[][] deepCopy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i].clone();
        }
        return out;
    }
}
