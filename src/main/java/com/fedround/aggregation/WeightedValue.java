package com.fedround.aggregation;

import java.util.Objects;

/**
 * A value reported by one worker together with its aggregation weight (sample count).
 *
 * @param <T> either a {@link com.fedround.model.ParameterVector} or a {@link Double} metric
 */
public final class WeightedValue<T> {

    private final T value;
    private final int weight;

    public WeightedValue(T value, int weight) {
        this.value = Objects.requireNonNull(value, "value cannot be null");
        if (weight < 1) {
            throw new IllegalArgumentException("weight must be a positive integer, got " + weight);
        }
        this.weight = weight;
    }

    public static <T> WeightedValue<T> of(T value, int weight) {
        return new WeightedValue<>(value, weight);
    }

    public T getValue() {
        return value;
    }

    public int getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return "(" + value + ", w=" + weight + ")";
    }
}
