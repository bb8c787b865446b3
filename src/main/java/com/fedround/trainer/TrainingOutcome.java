package com.fedround.trainer;

import com.fedround.model.ParameterVector;

import java.util.Objects;

/**
 * Output of {@link ModelTrainer#train}.
 */
public final class TrainingOutcome {

    private final ParameterVector parameters;
    private final double trainMetric;

    public TrainingOutcome(ParameterVector parameters, double trainMetric) {
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
        this.trainMetric = trainMetric;
    }

    public ParameterVector getParameters() {
        return parameters;
    }

    /**
     * @return accuracy on the rows trained on
     */
    public double getTrainMetric() {
        return trainMetric;
    }
}
