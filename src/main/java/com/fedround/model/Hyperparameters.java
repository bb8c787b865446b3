package com.fedround.model;

import java.io.Serializable;

/**
 * Local training knobs broadcast with every round configuration.
 * Defaults mirror a typical boosted-tree setup: learning rate 0.1, 100 iterations.
 */
public final class Hyperparameters implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_LEARNING_RATE = 0.1;
    public static final int DEFAULT_LOCAL_EPOCHS = 100;
    public static final double DEFAULT_L2 = 0.0;

    private final double learningRate;
    private final int localEpochs;
    private final double l2;

    /**
     * @param learningRate gradient step size, must be positive
     * @param localEpochs full passes over the local train rows per round, must be positive
     * @param l2 weight decay, must be >= 0
     */
    public Hyperparameters(double learningRate, int localEpochs, double l2) {
        if (!(learningRate > 0.0) || !Double.isFinite(learningRate)) {
            throw new IllegalArgumentException("learningRate must be a positive finite number");
        }
        if (localEpochs < 1) {
            throw new IllegalArgumentException("localEpochs must be >= 1");
        }
        if (!(l2 >= 0.0) || !Double.isFinite(l2)) {
            throw new IllegalArgumentException("l2 must be a finite number >= 0");
        }
        this.learningRate = learningRate;
        this.localEpochs = localEpochs;
        this.l2 = l2;
    }

    public static Hyperparameters defaults() {
        return new Hyperparameters(DEFAULT_LEARNING_RATE, DEFAULT_LOCAL_EPOCHS, DEFAULT_L2);
    }

    public double getLearningRate() {
        return learningRate;
    }

    public int getLocalEpochs() {
        return localEpochs;
    }

    public double getL2() {
        return l2;
    }

    @Override
    public String toString() {
        return String.format("Hyperparameters{lr=%s, epochs=%d, l2=%s}", learningRate, localEpochs, l2);
    }
}
