package com.fedround.data;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * One labeled sample: a fixed-size numeric feature vector plus a categorical label.
 * Keeps the index it had in the source dataset so partition coverage can be traced back.
 */
public final class Row implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final double[] features;
    private final String label;

    public Row(int index, double[] features, String label) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        this.index = index;
        this.features = Objects.requireNonNull(features, "features cannot be null").clone();
        this.label = Objects.requireNonNull(label, "label cannot be null");
    }

    /**
     * @return position of this row in the original dataset
     */
    public int getIndex() {
        return index;
    }

    public int getFeatureCount() {
        return features.length;
    }

    public double getFeature(int i) {
        return features[i];
    }

    /**
     * @return copy of the feature vector
     */
    public double[] getFeatures() {
        return features.clone();
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        Row other = (Row) o;
        return index == other.index
                && Arrays.equals(features, other.features)
                && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * index + Arrays.hashCode(features)) + label.hashCode();
    }

    @Override
    public String toString() {
        return "Row#" + index + Arrays.toString(features) + "->" + label;
    }
}
