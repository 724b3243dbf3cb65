package com.fraud.analytics.classifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Layer activation functions. Softmax normalises across the whole layer, every other
 * activation is applied element by element.
 */
public enum Activation {
    IDENTITY {
        @Override
        double apply(double z) {
            return z;
        }

        @Override
        double derivative(double z, double a) {
            return 1.0;
        }
    },
    RELU {
        @Override
        double apply(double z) {
            return Math.max(0.0, z);
        }

        @Override
        double derivative(double z, double a) {
            return z > 0 ? 1.0 : 0.0;
        }
    },
    SIGMOID {
        @Override
        double apply(double z) {
            return 1.0 / (1.0 + Math.exp(-z));
        }

        @Override
        double derivative(double z, double a) {
            return a * (1.0 - a);
        }
    },
    TANH {
        @Override
        double apply(double z) {
            return Math.tanh(z);
        }

        @Override
        double derivative(double z, double a) {
            return 1.0 - a * a;
        }
    },
    SOFTMAX {
        @Override
        double apply(double z) {
            throw new UnsupportedOperationException("softmax is defined on a whole layer");
        }

        @Override
        double derivative(double z, double a) {
            throw new UnsupportedOperationException("softmax is defined on a whole layer");
        }

        @Override
        public double[] forward(double[] z) {
            double max = Double.NEGATIVE_INFINITY;
            for (double v : z) max = Math.max(max, v);
            double[] out = new double[z.length];
            double sum = 0.0;
            for (int i = 0; i < z.length; i++) {
                out[i] = Math.exp(z[i] - max);
                sum += out[i];
            }
            for (int i = 0; i < z.length; i++) {
                out[i] /= sum;
            }
            return out;
        }

        @Override
        double[] backward(double[] z, double[] a, double[] gradOutput) {
            // Jacobian-vector product: dz_j = a_j * (g_j - sum_k g_k a_k)
            double dot = 0.0;
            for (int k = 0; k < a.length; k++) dot += gradOutput[k] * a[k];
            double[] dz = new double[a.length];
            for (int j = 0; j < a.length; j++) {
                dz[j] = a[j] * (gradOutput[j] - dot);
            }
            return dz;
        }
    };

    abstract double apply(double z);

    abstract double derivative(double z, double a);

    public double[] forward(double[] z) {
        double[] out = new double[z.length];
        for (int i = 0; i < z.length; i++) {
            out[i] = apply(z[i]);
        }
        return out;
    }

    /**
     * Gradient of the loss with respect to the pre-activation, given the gradient with respect
     * to the activation.
     */
    double[] backward(double[] z, double[] a, double[] gradOutput) {
        double[] dz = new double[z.length];
        for (int i = 0; i < z.length; i++) {
            dz[i] = gradOutput[i] * derivative(z[i], a[i]);
        }
        return dz;
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Activation fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("LINEAR".equals(normalized)) return IDENTITY;
        return Activation.valueOf(normalized);
    }
}
