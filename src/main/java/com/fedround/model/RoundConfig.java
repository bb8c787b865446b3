package com.fedround.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Fit request broadcast to every selected worker at the start of a round.
 * Every worker of a round receives an identical instance.
 */
public final class RoundConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int roundNumber;
    private final ParameterVector parameters;
    private final Hyperparameters hyperparameters;

    public RoundConfig(int roundNumber, ParameterVector parameters, Hyperparameters hyperparameters) {
        if (roundNumber < 1) {
            throw new IllegalArgumentException("roundNumber must be >= 1");
        }
        this.roundNumber = roundNumber;
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
        this.hyperparameters = Objects.requireNonNull(hyperparameters, "hyperparameters cannot be null");
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public ParameterVector getParameters() {
        return parameters;
    }

    public Hyperparameters getHyperparameters() {
        return hyperparameters;
    }

    @Override
    public String toString() {
        return "RoundConfig{round=" + roundNumber + ", params=" + parameters.size() + ", " + hyperparameters + "}";
    }
}
