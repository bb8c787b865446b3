package com.fedround.trainer;

/**
 * Output of {@link ModelTrainer#evaluate}: loss = 1 - accuracy.
 */
public final class Evaluation {

    private final double loss;
    private final double accuracy;

    public Evaluation(double loss, double accuracy) {
        this.loss = loss;
        this.accuracy = accuracy;
    }

    public static Evaluation fromAccuracy(double accuracy) {
        return new Evaluation(1.0 - accuracy, accuracy);
    }

    public double getLoss() {
        return loss;
    }

    public double getAccuracy() {
        return accuracy;
    }
}
