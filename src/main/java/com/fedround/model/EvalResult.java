package com.fedround.model;

import java.io.Serializable;

/**
 * Reply of a worker's evaluation step against the aggregated parameters.
 */
public final class EvalResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int workerId;
    private final int sampleCount;
    private final double loss;
    private final double evalMetric;

    /**
     * @param workerId ordinal of the reporting worker
     * @param sampleCount number of held-out rows, used as aggregation weight
     * @param loss {@code 1 - accuracy}, in [0, 1]
     * @param evalMetric accuracy on the held-out rows
     */
    public EvalResult(int workerId, int sampleCount, double loss, double evalMetric) {
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be >= 1");
        }
        this.workerId = workerId;
        this.sampleCount = sampleCount;
        this.loss = loss;
        this.evalMetric = evalMetric;
    }

    public int getWorkerId() {
        return workerId;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public double getLoss() {
        return loss;
    }

    public double getEvalMetric() {
        return evalMetric;
    }

    @Override
    public String toString() {
        return String.format("EvalResult{worker=%d, samples=%d, loss=%.4f, metric=%.4f}",
            workerId, sampleCount, loss, evalMetric);
    }
}
