package com.fedround.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Asks a worker to score the freshly aggregated parameters on its held-out rows.
 */
public final class EvalRequest implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int roundNumber;
    private final ParameterVector parameters;

    public EvalRequest(int roundNumber, ParameterVector parameters) {
        this.roundNumber = roundNumber;
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public ParameterVector getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "EvalRequest{round=" + roundNumber + ", params=" + parameters.size() + "}";
    }
}
