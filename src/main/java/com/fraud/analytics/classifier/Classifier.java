package com.fraud.analytics.classifier;

import com.fraud.analytics.error.ConfigurationException;
import com.fraud.analytics.error.InsufficientTrainingDataException;
import com.fraud.analytics.error.ModelNotCompiledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import java.util.stream.IntStream;

/**
 * Small dense feed-forward network giving a learned fraud-probability signal.
 * <p>
 * Parameters belong to this instance alone. Training holds the write lock, so it never
 * interleaves with inference; any number of concurrent predictions share the read lock.
 * Training is full backpropagation of mean-squared error with mini-batch gradient descent.
 * Per-example gradients of a mini-batch are computed in parallel and summed in example
 * order, which keeps a seeded run reproducible.
 */
@Slf4j
public class Classifier {

    private final ClassifierArchitecture architecture;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private double[][][] weights;
    private double[][] biases;
    private boolean compiled;

    public Classifier(ClassifierArchitecture architecture) {
        this.architecture = architecture;
    }

    /**
     * A separate classifier holding a copy of the given parameters. Later changes to the
     * classifier the parameters came from do not reach it.
     */
    public static Classifier of(ModelParameters parameters) {
        Classifier classifier = new Classifier(parameters.architecture());
        classifier.load(parameters);
        return classifier;
    }

    public ClassifierArchitecture getArchitecture() {
        return architecture;
    }

    public boolean isCompiled() {
        lock.readLock().lock();
        try {
            return compiled;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Initialise weights with He scaling: uniform in {@code ±sqrt(2 / fanIn)}; biases start at 0.
     */
    public void compile(long seed) {
        ModelParameters initial = initialParameters(seed);
        lock.writeLock().lock();
        try {
            install(initial);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Classifier compiled: input={} layers={} seed={}", architecture.getInputSize(),
                architecture.getLayers().size(), seed);
    }

    /**
     * Compile unless weights are already present; check and initialisation happen under one lock.
     *
     * @return true when this call initialised the weights
     */
    public boolean compileIfAbsent(long seed) {
        lock.writeLock().lock();
        try {
            if (compiled) return false;
            install(initialParameters(seed));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Classifier compiled: input={} layers={} seed={}", architecture.getInputSize(),
                architecture.getLayers().size(), seed);
        return true;
    }

    private ModelParameters initialParameters(long seed) {
        Random random = new Random(seed);
        List<LayerSpec> layers = architecture.getLayers();
        double[][][] w = new double[layers.size()][][];
        double[][] b = new double[layers.size()][];
        for (int l = 0; l < layers.size(); l++) {
            int fanIn = architecture.layerInputSize(l);
            int neurons = layers.get(l).getNeurons();
            double scale = Math.sqrt(2.0 / fanIn);
            w[l] = new double[fanIn][neurons];
            for (int i = 0; i < fanIn; i++) {
                for (int j = 0; j < neurons; j++) {
                    w[l][i][j] = (random.nextDouble() * 2 - 1) * scale;
                }
            }
            b[l] = new double[neurons];
        }
        return new ModelParameters(architecture.getInputSize(), layers, w, b);
    }

    private void install(ModelParameters parameters) {
        this.weights = parameters.getWeights();
        this.biases = parameters.getBiases();
        this.compiled = true;
    }

    /**
     * Replace the current parameters. The layout must match this classifier's architecture.
     */
    public void load(ModelParameters parameters) {
        if (parameters.getInputSize() != architecture.getInputSize()
                || !parameters.getLayers().equals(architecture.getLayers())) {
            throw new ConfigurationException("Model parameters do not match the classifier architecture");
        }
        lock.writeLock().lock();
        try {
            install(parameters);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ModelParameters snapshot() {
        lock.readLock().lock();
        try {
            requireCompiled();
            return new ModelParameters(architecture.getInputSize(), architecture.getLayers(), weights, biases);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copy of the current parameters, or empty while the classifier is not compiled.
     */
    public Optional<ModelParameters> currentParameters() {
        lock.readLock().lock();
        try {
            if (!compiled) return Optional.empty();
            return Optional.of(new ModelParameters(architecture.getInputSize(), architecture.getLayers(), weights, biases));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Prediction predict(double[] input) {
        lock.readLock().lock();
        try {
            requireCompiled();
            return Prediction.of(forward(input).activations[architecture.getLayers().size()]);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Fraud probability in [0,1]: the single output of a binary model, otherwise
     * P(fraudulent) plus half of P(suspicious).
     */
    public double fraudProbability(double[] input) {
        return fraudProbability(predict(input));
    }

    public double fraudProbability(Prediction prediction) {
        double[] out = prediction.getOutput();
        double p;
        if (out.length == 1) {
            p = out[0];
        } else if (out.length == 2) {
            p = out[1];
        } else {
            p = out[FraudLabel.FRAUDULENT.ordinal()] + 0.5 * out[FraudLabel.SUSPICIOUS.ordinal()];
        }
        return Math.max(0.0, Math.min(1.0, p));
    }

    public TrainingResult train(List<TrainingExample> examples, TrainingOptions options) {
        return train(examples, List.of(), options, () -> false);
    }

    /**
     * Gradient-descent training. Validation accuracy (arg-max prediction against arg-max label)
     * is measured every {@code validationInterval} epochs and the best value kept.
     *
     * @param cancelled polled after every epoch; returning true stops training
     */
    public TrainingResult train(List<TrainingExample> examples, List<TrainingExample> validation,
                                TrainingOptions options, BooleanSupplier cancelled) {
        options.validate();
        if (examples == null || examples.isEmpty()) {
            throw new InsufficientTrainingDataException("Training needs at least one example");
        }
        for (TrainingExample example : examples) {
            checkShape(example);
        }
        List<TrainingExample> validationSet = validation != null ? validation : List.of();
        for (TrainingExample example : validationSet) {
            checkShape(example);
        }

        lock.writeLock().lock();
        try {
            requireCompiled();
            Instant deadline = options.getTimeBudget() != null ? Instant.now().plus(options.getTimeBudget()) : null;
            Random shuffle = new Random(options.getSeed());
            List<Integer> order = new ArrayList<>();
            for (int i = 0; i < examples.size(); i++) order.add(i);

            List<Double> lossHistory = new ArrayList<>();
            Map<Integer, Double> validationAccuracy = new LinkedHashMap<>();
            Double best = null;
            boolean stoppedEarly = false;
            int epoch = 0;
            while (epoch < options.getEpochs()) {
                Collections.shuffle(order, shuffle);
                double totalLoss = 0.0;
                for (int start = 0; start < order.size(); start += options.getBatchSize()) {
                    List<Integer> batch = order.subList(start, Math.min(order.size(), start + options.getBatchSize()));
                    totalLoss += trainBatch(examples, batch, options.getLearningRate());
                }
                epoch++;
                double meanLoss = totalLoss / examples.size();
                lossHistory.add(meanLoss);

                if (!validationSet.isEmpty()
                        && (epoch % options.getValidationInterval() == 0 || epoch == options.getEpochs())) {
                    double accuracy = accuracy(validationSet);
                    validationAccuracy.put(epoch, accuracy);
                    if (best == null || accuracy > best) best = accuracy;
                    log.debug("Epoch {}: loss={} validationAccuracy={}", epoch, meanLoss, accuracy);
                } else {
                    log.debug("Epoch {}: loss={}", epoch, meanLoss);
                }

                if (epoch < options.getEpochs()
                        && (cancelled.getAsBoolean() || (deadline != null && Instant.now().isAfter(deadline)))) {
                    stoppedEarly = true;
                    log.info("Training stopped early after {} of {} epochs", epoch, options.getEpochs());
                    break;
                }
            }
            if (stoppedEarly && !validationSet.isEmpty() && !validationAccuracy.containsKey(epoch)) {
                double accuracy = accuracy(validationSet);
                validationAccuracy.put(epoch, accuracy);
                if (best == null || accuracy > best) best = accuracy;
            }
            log.info("Training finished: epochs={} initialLoss={} finalLoss={} bestValidationAccuracy={}",
                    epoch, lossHistory.get(0), lossHistory.get(lossHistory.size() - 1), best);
            return TrainingResult.builder()
                    .epochsRequested(options.getEpochs())
                    .epochsCompleted(epoch)
                    .lossHistory(List.copyOf(lossHistory))
                    .validationAccuracy(validationAccuracy)
                    .bestValidationAccuracy(best)
                    .stoppedEarly(stoppedEarly)
                    .build();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public EvaluationMetrics evaluate(List<TrainingExample> heldOut) {
        lock.readLock().lock();
        try {
            requireCompiled();
            List<Integer> predicted = new ArrayList<>();
            List<Integer> actual = new ArrayList<>();
            for (TrainingExample example : heldOut) {
                checkShape(example);
                predicted.add(predictedClass(forward(example.getFeatures()).output()));
                actual.add(example.labelClass());
            }
            int classes = Math.max(2, architecture.outputSize());
            return EvaluationMetrics.from(predicted, actual, classes);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Mean loss over the examples with the current weights, without updating them.
     */
    public double loss(List<TrainingExample> examples) {
        lock.readLock().lock();
        try {
            requireCompiled();
            double total = 0.0;
            for (TrainingExample example : examples) {
                total += mse(forward(example.getFeatures()).output(), example.getLabel());
            }
            return examples.isEmpty() ? 0.0 : total / examples.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private double trainBatch(List<TrainingExample> examples, List<Integer> batch, double learningRate) {
        Gradient[] gradients = IntStream.range(0, batch.size())
                .parallel()
                .mapToObj(k -> backpropagate(examples.get(batch.get(k))))
                .toArray(Gradient[]::new);

        double loss = 0.0;
        int layers = weights.length;
        double scale = learningRate / batch.size();
        for (Gradient g : gradients) {
            loss += g.loss;
        }
        for (int l = 0; l < layers; l++) {
            for (int i = 0; i < weights[l].length; i++) {
                for (int j = 0; j < weights[l][i].length; j++) {
                    double sum = 0.0;
                    for (Gradient g : gradients) sum += g.weights[l][i][j];
                    weights[l][i][j] -= scale * sum;
                }
            }
            for (int j = 0; j < biases[l].length; j++) {
                double sum = 0.0;
                for (Gradient g : gradients) sum += g.biases[l][j];
                biases[l][j] -= scale * sum;
            }
        }
        return loss;
    }

    private Gradient backpropagate(TrainingExample example) {
        ForwardPass pass = forward(example.getFeatures());
        List<LayerSpec> layers = architecture.getLayers();
        int depth = layers.size();
        double[] output = pass.output();
        double[] target = example.getLabel();

        // dL/da for L = mean((a - t)^2)
        double[] grad = new double[output.length];
        for (int k = 0; k < output.length; k++) {
            grad[k] = 2.0 * (output[k] - target[k]) / output.length;
        }

        double[][][] dw = new double[depth][][];
        double[][] db = new double[depth][];
        for (int l = depth - 1; l >= 0; l--) {
            double[] delta = layers.get(l).getActivation().backward(pass.preActivations[l], pass.activations[l + 1], grad);
            double[] input = pass.activations[l];
            dw[l] = new double[input.length][delta.length];
            for (int i = 0; i < input.length; i++) {
                for (int j = 0; j < delta.length; j++) {
                    dw[l][i][j] = input[i] * delta[j];
                }
            }
            db[l] = delta;
            if (l > 0) {
                double[] previous = new double[input.length];
                for (int i = 0; i < input.length; i++) {
                    double sum = 0.0;
                    for (int j = 0; j < delta.length; j++) {
                        sum += weights[l][i][j] * delta[j];
                    }
                    previous[i] = sum;
                }
                grad = previous;
            }
        }
        return new Gradient(dw, db, mse(output, target));
    }

    private ForwardPass forward(double[] input) {
        if (input.length != architecture.getInputSize()) {
            throw new IllegalArgumentException("Expected " + architecture.getInputSize() + " inputs, got " + input.length);
        }
        List<LayerSpec> layers = architecture.getLayers();
        double[][] activations = new double[layers.size() + 1][];
        double[][] preActivations = new double[layers.size()][];
        activations[0] = input.clone();
        for (int l = 0; l < layers.size(); l++) {
            double[] in = activations[l];
            int neurons = layers.get(l).getNeurons();
            double[] z = new double[neurons];
            for (int j = 0; j < neurons; j++) {
                double sum = biases[l][j];
                for (int i = 0; i < in.length; i++) {
                    sum += in[i] * weights[l][i][j];
                }
                z[j] = sum;
            }
            preActivations[l] = z;
            activations[l + 1] = layers.get(l).getActivation().forward(z);
        }
        return new ForwardPass(activations, preActivations);
    }

    private double accuracy(List<TrainingExample> examples) {
        int correct = 0;
        for (TrainingExample example : examples) {
            if (predictedClass(forward(example.getFeatures()).output()) == example.labelClass()) correct++;
        }
        return (double) correct / examples.size();
    }

    private static int predictedClass(double[] output) {
        if (output.length == 1) return output[0] > 0.5 ? 1 : 0;
        return Prediction.of(output).getPrediction();
    }

    private static double mse(double[] output, double[] target) {
        double loss = 0.0;
        for (int i = 0; i < output.length; i++) {
            double d = output[i] - target[i];
            loss += d * d;
        }
        return loss / output.length;
    }

    private void checkShape(TrainingExample example) {
        if (example.getFeatures().length != architecture.getInputSize()) {
            throw new IllegalArgumentException("Training example has " + example.getFeatures().length
                    + " features, expected " + architecture.getInputSize());
        }
        if (example.getLabel().length != architecture.outputSize()) {
            throw new IllegalArgumentException("Training label has " + example.getLabel().length
                    + " entries, expected " + architecture.outputSize());
        }
    }

    private void requireCompiled() {
        if (!compiled) {
            throw new ModelNotCompiledException("Classifier weights are not initialised; compile or load a model first");
        }
    }

    private static final class ForwardPass {
        final double[][] activations;
        final double[][] preActivations;

        ForwardPass(double[][] activations, double[][] preActivations) {
            this.activations = activations;
            this.preActivations = preActivations;
        }

        double[] output() {
            return activations[activations.length - 1];
        }
    }

    private record Gradient(double[][][] weights, double[][] biases, double loss) {}
}
