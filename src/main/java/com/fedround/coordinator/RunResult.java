package com.fedround.coordinator;

import com.fedround.model.ParameterVector;
import com.fedround.model.RoundMetrics;
import com.fedround.model.RunStatus;

import java.util.List;

/**
 * Observable output of a completed run.
 */
public final class RunResult {

    private final RunStatus status;
    private final ParameterVector globalParameters;
    private final List<RoundMetrics> history;

    RunResult(RunStatus status, ParameterVector globalParameters, List<RoundMetrics> history) {
        this.status = status;
        this.globalParameters = globalParameters;
        this.history = List.copyOf(history);
    }

    public RunStatus getStatus() {
        return status;
    }

    public ParameterVector getGlobalParameters() {
        return globalParameters;
    }

    public List<RoundMetrics> getHistory() {
        return history;
    }

    /**
     * @return metrics of the last round, or null if the history is empty
     */
    public RoundMetrics lastRound() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    @Override
    public String toString() {
        return "RunResult{status=" + status + ", rounds=" + history.size() + "}";
    }
}
