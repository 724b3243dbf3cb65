package com.fraud.analytics.classifier;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Quality of a trained model on a held-out set. Precision, recall, F1 and the binary confusion
 * counts treat every non-legitimate class as positive; {@link #confusionMatrix} keeps the
 * per-class detail (rows actual, columns predicted).
 */
@Value
@Builder
@Jacksonized
public class EvaluationMetrics {

    int sampleCount;
    double accuracy;
    double precision;
    double recall;
    double f1Score;
    double specificity;
    int truePositives;
    int falsePositives;
    int trueNegatives;
    int falseNegatives;
    int[][] confusionMatrix;

    public static EvaluationMetrics from(List<Integer> predicted, List<Integer> actual, int classes) {
        if (predicted.size() != actual.size()) {
            throw new IllegalArgumentException("predicted and actual must have the same size");
        }
        int[][] matrix = new int[classes][classes];
        int correct = 0;
        int tp = 0;
        int fp = 0;
        int tn = 0;
        int fn = 0;
        for (int i = 0; i < predicted.size(); i++) {
            int p = predicted.get(i);
            int a = actual.get(i);
            matrix[a][p]++;
            if (p == a) correct++;
            boolean predictedPositive = p != 0;
            boolean actualPositive = a != 0;
            if (predictedPositive && actualPositive) tp++;
            else if (predictedPositive) fp++;
            else if (actualPositive) fn++;
            else tn++;
        }
        int n = predicted.size();
        double precision = tp + fp > 0 ? (double) tp / (tp + fp) : 0.0;
        double recall = tp + fn > 0 ? (double) tp / (tp + fn) : 0.0;
        double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;
        return EvaluationMetrics.builder()
                .sampleCount(n)
                .accuracy(n > 0 ? (double) correct / n : 0.0)
                .precision(precision)
                .recall(recall)
                .f1Score(f1)
                .specificity(tn + fp > 0 ? (double) tn / (tn + fp) : 0.0)
                .truePositives(tp)
                .falsePositives(fp)
                .trueNegatives(tn)
                .falseNegatives(fn)
                .confusionMatrix(matrix)
                .build();
    }
}
