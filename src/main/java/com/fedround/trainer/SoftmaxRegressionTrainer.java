package com.fedround.trainer;

import com.fedround.data.Dataset;
import com.fedround.data.Row;
import com.fedround.exception.LocalTrainingException;
import com.fedround.model.Hyperparameters;
import com.fedround.model.ParameterVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Multinomial logistic regression trained by deterministic full-batch gradient descent.
 * 
 * Parameter layout, K classes and F features: class {@code k} owns the slice
 * {@code [k * (F + 1), (k + 1) * (F + 1))}, F weights followed by one bias.
 * The shape {@code K * (F + 1)} depends only on the dataset schema, so it is
 * identical on every worker and in every round.
 */
public class SoftmaxRegressionTrainer implements ModelTrainer {

    private static final Logger log = LoggerFactory.getLogger(SoftmaxRegressionTrainer.class);

    private final List<String> classes;
    private final Map<String, Integer> classIndex;
    private final FeatureScaler scaler;
    private final int featureCount;
    private final int stride;

    /**
     * @param classes sorted label vocabulary
     * @param scaler feature standardization shared by all workers
     */
    public SoftmaxRegressionTrainer(List<String> classes, FeatureScaler scaler) {
        Objects.requireNonNull(classes, "classes cannot be null");
        if (classes.isEmpty()) {
            throw new IllegalArgumentException("at least one class is required");
        }
        this.classes = List.copyOf(classes);
        this.scaler = Objects.requireNonNull(scaler, "scaler cannot be null");
        this.featureCount = scaler.featureCount();
        this.stride = featureCount + 1;

        this.classIndex = new HashMap<>();
        for (int k = 0; k < this.classes.size(); k++) {
            classIndex.put(this.classes.get(k), k);
        }
    }

    /**
     * Builds a trainer for the schema and feature statistics of a dataset.
     */
    public static SoftmaxRegressionTrainer forDataset(Dataset dataset) {
        return new SoftmaxRegressionTrainer(dataset.labels(), FeatureScaler.fit(dataset));
    }

    /**
     * @return number of parameters, {@code K * (F + 1)}
     */
    public int parameterCount() {
        return classes.size() * stride;
    }

    @Override
    public ParameterVector initialParameters() {
        return ParameterVector.zeros(parameterCount());
    }

    @Override
    public TrainingOutcome train(ParameterVector start, List<Row> rows, Hyperparameters hyperparameters)
            throws LocalTrainingException {
        checkShape(start);
        if (rows == null || rows.isEmpty()) {
            throw new LocalTrainingException("No training rows in this shard");
        }

        double[][] x = new double[rows.size()][];
        int[] y = new int[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            x[i] = scaler.transform(rows.get(i));
            y[i] = indexOf(rows.get(i));
        }

        int k = classes.size();
        double[] w = start.toArray();
        double[] gradient = new double[w.length];
        double[] probabilities = new double[k];
        double lr = hyperparameters.getLearningRate();
        double l2 = hyperparameters.getL2();
        int n = rows.size();

        for (int epoch = 0; epoch < hyperparameters.getLocalEpochs(); epoch++) {
            Arrays.fill(gradient, 0.0);

            for (int i = 0; i < n; i++) {
                softmax(w, x[i], probabilities);
                for (int c = 0; c < k; c++) {
                    double error = probabilities[c] - (c == y[i] ? 1.0 : 0.0);
                    int base = c * stride;
                    for (int j = 0; j < featureCount; j++) {
                        gradient[base + j] += error * x[i][j];
                    }
                    gradient[base + featureCount] += error;
                }
            }

            for (int c = 0; c < k; c++) {
                int base = c * stride;
                for (int j = 0; j < featureCount; j++) {
                    w[base + j] -= lr * (gradient[base + j] / n + l2 * w[base + j]);
                }
                // bias is not regularized
                w[base + featureCount] -= lr * gradient[base + featureCount] / n;
            }
        }

        ParameterVector updated = ParameterVector.of(w);
        if (!updated.isFinite()) {
            throw new LocalTrainingException("Training diverged (non-finite parameters), lower the learning rate");
        }

        double accuracy = accuracy(w, x, y);
        log.debug("Trained {} rows for {} epochs, train accuracy {}", n, hyperparameters.getLocalEpochs(), accuracy);
        return new TrainingOutcome(updated, accuracy);
    }

    @Override
    public Evaluation evaluate(ParameterVector parameters, List<Row> rows) throws LocalTrainingException {
        checkShape(parameters);
        if (rows == null || rows.isEmpty()) {
            throw new LocalTrainingException("No held-out rows in this shard");
        }

        double[][] x = new double[rows.size()][];
        int[] y = new int[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            x[i] = scaler.transform(rows.get(i));
            y[i] = indexOf(rows.get(i));
        }
        return Evaluation.fromAccuracy(accuracy(parameters.toArray(), x, y));
    }

    /**
     * Predicts the label of a single row.
     */
    public String predict(ParameterVector parameters, Row row) throws LocalTrainingException {
        checkShape(parameters);
        return classes.get(argmax(parameters.toArray(), scaler.transform(row)));
    }

    public List<String> getClasses() {
        return classes;
    }

    // ==================== Internals ====================

    private void checkShape(ParameterVector parameters) throws LocalTrainingException {
        if (parameters == null || parameters.size() != parameterCount()) {
            throw new LocalTrainingException(String.format(
                "Parameter vector has %s element(s), this model needs %d",
                parameters == null ? "no" : String.valueOf(parameters.size()), parameterCount()));
        }
    }

    private int indexOf(Row row) throws LocalTrainingException {
        Integer index = classIndex.get(row.getLabel());
        if (index == null) {
            throw new LocalTrainingException("Label '" + row.getLabel() + "' is not in the class vocabulary");
        }
        return index;
    }

    private double logit(double[] w, double[] features, int c) {
        int base = c * stride;
        double z = w[base + featureCount];
        for (int j = 0; j < featureCount; j++) {
            z += w[base + j] * features[j];
        }
        return z;
    }

    private void softmax(double[] w, double[] features, double[] out) {
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < out.length; c++) {
            out[c] = logit(w, features, c);
            max = Math.max(max, out[c]);
        }
        double sum = 0.0;
        for (int c = 0; c < out.length; c++) {
            out[c] = Math.exp(out[c] - max);
            sum += out[c];
        }
        for (int c = 0; c < out.length; c++) {
            out[c] /= sum;
        }
    }

    private int argmax(double[] w, double[] features) {
        int best = 0;
        double bestLogit = logit(w, features, 0);
        for (int c = 1; c < classes.size(); c++) {
            double z = logit(w, features, c);
            if (z > bestLogit) {
                bestLogit = z;
                best = c;
            }
        }
        return best;
    }

    private double accuracy(double[] w, double[][] x, int[] y) {
        int correct = 0;
        for (int i = 0; i < x.length; i++) {
            if (argmax(w, x[i]) == y[i]) {
                correct++;
            }
        }
        return (double) correct / x.length;
    }
}
