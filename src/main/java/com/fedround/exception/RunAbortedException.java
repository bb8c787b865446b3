package com.fedround.exception;

import com.fedround.model.ParameterVector;
import com.fedround.model.RoundMetrics;

import java.util.List;

/**
 * Retries of a round were exhausted and the run terminated early.
 * The last committed parameters and the partial history stay readable from here.
 */
public class RunAbortedException extends FedRoundException {
    private static final long serialVersionUID = 1L;

    private final int roundNumber;
    private final int attempts;
    private final ParameterVector lastGoodParameters;
    private final List<RoundMetrics> history;

    public RunAbortedException(int roundNumber, int attempts, ParameterVector lastGoodParameters,
                               List<RoundMetrics> history, Throwable cause) {
        super(String.format("Run aborted at round %d after %d attempt(s)", roundNumber, attempts), cause);
        this.roundNumber = roundNumber;
        this.attempts = attempts;
        this.lastGoodParameters = lastGoodParameters;
        this.history = List.copyOf(history);
    }

    /**
     * @return the round that could not be completed
     */
    public int getRoundNumber() {
        return roundNumber;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * @return global parameters as of the last completed round (may be null if the
     *         run never obtained initial parameters)
     */
    public ParameterVector getLastGoodParameters() {
        return lastGoodParameters;
    }

    public List<RoundMetrics> getHistory() {
        return history;
    }
}
