package com.fedround.aggregation;

import com.fedround.exception.ShapeMismatchException;
import com.fedround.model.ParameterVector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Weighted federated averaging: {@code result = sum(value_i * weight_i) / sum(weight_i)},
 * element-wise for vectors.
 * 
 * Stateless. Inputs are sorted into a canonical order before summing, so the
 * result is bit-for-bit identical for every permutation of the same inputs
 * (floating-point addition alone is not associative).
 */
public final class Aggregator {

    private static final Comparator<WeightedValue<Double>> SCALAR_ORDER =
        Comparator.<WeightedValue<Double>>comparingInt(WeightedValue::getWeight)
            .thenComparing(WeightedValue::getValue, Double::compare);

    private static final Comparator<WeightedValue<ParameterVector>> VECTOR_ORDER =
        Comparator.<WeightedValue<ParameterVector>>comparingInt(WeightedValue::getWeight)
            .thenComparing(WeightedValue::getValue, Aggregator::compareElements);

    private Aggregator() {
    }

    /**
     * Averages parameter vectors weighted by sample count.
     * 
     * @param results non-empty list of (vector, weight) pairs
     * @return the weighted mean vector
     * @throws IllegalArgumentException if results is null or empty
     * @throws ShapeMismatchException if the vectors do not all have the same size
     */
    public static ParameterVector aggregateParameters(List<WeightedValue<ParameterVector>> results) {
        requireNonEmpty(results);

        int shape = results.get(0).getValue().size();
        for (WeightedValue<ParameterVector> result : results) {
            if (result.getValue().size() != shape) {
                throw new ShapeMismatchException(shape, result.getValue().size());
            }
        }

        List<WeightedValue<ParameterVector>> ordered = new ArrayList<>(results);
        ordered.sort(VECTOR_ORDER);

        double[] sum = new double[shape];
        long totalWeight = 0;
        for (WeightedValue<ParameterVector> result : ordered) {
            ParameterVector vector = result.getValue();
            int weight = result.getWeight();
            for (int i = 0; i < shape; i++) {
                sum[i] += vector.get(i) * weight;
            }
            totalWeight += weight;
        }

        for (int i = 0; i < shape; i++) {
            sum[i] /= totalWeight;
        }
        return ParameterVector.of(sum);
    }

    /**
     * Averages scalar metrics (loss, accuracy) weighted by sample count.
     * 
     * @param results non-empty list of (metric, weight) pairs
     * @return the weighted mean
     * @throws IllegalArgumentException if results is null or empty
     */
    public static double aggregateScalar(List<WeightedValue<Double>> results) {
        requireNonEmpty(results);

        List<WeightedValue<Double>> ordered = new ArrayList<>(results);
        ordered.sort(SCALAR_ORDER);

        double sum = 0.0;
        long totalWeight = 0;
        for (WeightedValue<Double> result : ordered) {
            sum += result.getValue() * result.getWeight();
            totalWeight += result.getWeight();
        }
        return sum / totalWeight;
    }

    private static void requireNonEmpty(List<?> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("results cannot be null or empty");
        }
    }

    private static int compareElements(ParameterVector a, ParameterVector b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int cmp = Double.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
