package com.fedround.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Reply of a worker's training step. Consumed exactly once by the aggregation of its round.
 */
public final class FitResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int workerId;
    private final ParameterVector parameters;
    private final int sampleCount;
    private final double trainMetric;

    /**
     * @param workerId ordinal of the reporting worker
     * @param parameters locally updated parameter vector
     * @param sampleCount number of train rows, used as aggregation weight
     * @param trainMetric training accuracy on the local train rows
     */
    public FitResult(int workerId, ParameterVector parameters, int sampleCount, double trainMetric) {
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be >= 1");
        }
        this.workerId = workerId;
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
        this.sampleCount = sampleCount;
        this.trainMetric = trainMetric;
    }

    public int getWorkerId() {
        return workerId;
    }

    public ParameterVector getParameters() {
        return parameters;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public double getTrainMetric() {
        return trainMetric;
    }

    @Override
    public String toString() {
        return String.format("FitResult{worker=%d, samples=%d, trainMetric=%.4f}", workerId, sampleCount, trainMetric);
    }
}
