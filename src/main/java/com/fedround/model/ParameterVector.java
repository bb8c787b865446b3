package com.fedround.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-shape sequence of real numbers holding the global model state.
 * 
 * Immutable: the backing array is copied on the way in and on the way out, so a
 * vector handed to a worker can never write back into the coordinator's copy.
 */
public final class ParameterVector implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] values;

    private ParameterVector(double[] values) {
        this.values = values;
    }

    /**
     * @param values elements, copied
     */
    public static ParameterVector of(double... values) {
        return new ParameterVector(Objects.requireNonNull(values, "values cannot be null").clone());
    }

    /**
     * @param size number of elements
     * @return vector of {@code size} zeros
     */
    public static ParameterVector zeros(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        return new ParameterVector(new double[size]);
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    /**
     * @return copy of the elements
     */
    public double[] toArray() {
        return values.clone();
    }

    /**
     * @return true if every element is finite (no NaN, no infinity)
     */
    public boolean isFinite() {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterVector)) return false;
        return Arrays.equals(values, ((ParameterVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        if (values.length <= 8) {
            return "ParameterVector" + Arrays.toString(values);
        }
        return String.format("ParameterVector[size=%d, first=%s...]",
            values.length, Arrays.toString(Arrays.copyOf(values, 4)));
    }
}
