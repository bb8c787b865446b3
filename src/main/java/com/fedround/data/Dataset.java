package com.fedround.data;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Ordered, immutable table of labeled rows.
 * 
 * Created once at run start and never mutated, so a single instance can be shared
 * read-only by co-located workers.
 * 
 * The label vocabulary is the sorted set of all labels in the table. Every worker
 * loads the same source, therefore every worker derives the same vocabulary and
 * the same model shape from it.
 */
public final class Dataset {

    private final List<String> featureNames;
    private final List<Row> rows;
    private final List<String> labels;

    public Dataset(List<String> featureNames, List<Row> rows) {
        this.featureNames = List.copyOf(Objects.requireNonNull(featureNames, "featureNames cannot be null"));
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows cannot be null"));

        SortedSet<String> vocabulary = new TreeSet<>();
        for (int i = 0; i < this.rows.size(); i++) {
            Row row = this.rows.get(i);
            if (row.getFeatureCount() != this.featureNames.size()) {
                throw new IllegalArgumentException(String.format(
                    "Row %d has %d features, expected %d", i, row.getFeatureCount(), this.featureNames.size()));
            }
            vocabulary.add(row.getLabel());
        }
        this.labels = List.copyOf(vocabulary);
    }

    /**
     * Builds a dataset from raw feature vectors and labels, indexing rows in order.
     * Feature names default to {@code f0..fN}.
     */
    public static Dataset of(List<double[]> features, List<String> labels) {
        if (features.size() != labels.size()) {
            throw new IllegalArgumentException("features and labels must have the same size");
        }
        int featureCount = features.isEmpty() ? 0 : features.get(0).length;
        List<String> names = new ArrayList<>(featureCount);
        for (int i = 0; i < featureCount; i++) {
            names.add("f" + i);
        }
        List<Row> rows = new ArrayList<>(features.size());
        for (int i = 0; i < features.size(); i++) {
            rows.add(new Row(i, features.get(i), labels.get(i)));
        }
        return new Dataset(names, rows);
    }

    public int size() {
        return rows.size();
    }

    public Row row(int index) {
        return rows.get(index);
    }

    /**
     * @return unmodifiable view of rows in [fromIndex, toIndex)
     */
    public List<Row> slice(int fromIndex, int toIndex) {
        return rows.subList(fromIndex, toIndex);
    }

    public List<Row> rows() {
        return rows;
    }

    public int featureCount() {
        return featureNames.size();
    }

    public List<String> featureNames() {
        return featureNames;
    }

    /**
     * @return sorted label vocabulary
     */
    public List<String> labels() {
        return labels;
    }

    @Override
    public String toString() {
        return String.format("Dataset[rows=%d, features=%d, labels=%d]",
            rows.size(), featureNames.size(), labels.size());
    }
}
