package com.fedround.trainer;

import com.fedround.data.Dataset;
import com.fedround.data.Row;

import java.util.Arrays;

/**
 * Per-feature standardization (zero mean, unit variance).
 * 
 * Statistics come from the whole dataset, which every worker loads identically,
 * so all workers scale features the same way and their parameters stay comparable.
 */
public final class FeatureScaler {

    private final double[] means;
    private final double[] scales;

    FeatureScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static FeatureScaler fit(Dataset dataset) {
        int f = dataset.featureCount();
        double[] means = new double[f];
        double[] scales = new double[f];
        int n = dataset.size();
        if (n == 0) {
            Arrays.fill(scales, 1.0);
            return new FeatureScaler(means, scales);
        }

        for (Row row : dataset.rows()) {
            for (int j = 0; j < f; j++) {
                means[j] += row.getFeature(j);
            }
        }
        for (int j = 0; j < f; j++) {
            means[j] /= n;
        }
        for (Row row : dataset.rows()) {
            for (int j = 0; j < f; j++) {
                double d = row.getFeature(j) - means[j];
                scales[j] += d * d;
            }
        }
        for (int j = 0; j < f; j++) {
            double std = Math.sqrt(scales[j] / n);
            // Constant column: keep values centered, do not divide by zero
            scales[j] = std > 1e-12 ? std : 1.0;
        }
        return new FeatureScaler(means, scales);
    }

    /**
     * No-op scaler for a given feature count.
     */
    public static FeatureScaler identity(int featureCount) {
        double[] scales = new double[featureCount];
        Arrays.fill(scales, 1.0);
        return new FeatureScaler(new double[featureCount], scales);
    }

    public int featureCount() {
        return means.length;
    }

    double[] transform(Row row) {
        double[] out = new double[means.length];
        for (int j = 0; j < means.length; j++) {
            out[j] = (row.getFeature(j) - means[j]) / scales[j];
        }
        return out;
    }
}
