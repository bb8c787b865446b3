package com.fedround.coordinator;

import com.fedround.model.ParameterVector;
import com.fedround.model.RoundMetrics;
import com.fedround.model.RunStatus;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * State of one run, owned by exactly one {@link Coordinator}.
 * 
 * Only the coordinator's round-advance logic mutates it (package-private setters).
 * Everybody else (CLI, tests, RMI threads) only reads; fields are volatile and the
 * history is copy-on-write so reads never block a round.
 */
public class RunState {

    private final WorkerRegistry connectedWorkers = new WorkerRegistry();
    private final List<RoundMetrics> history = new CopyOnWriteArrayList<>();

    private volatile int currentRound = 0;
    private volatile ParameterVector globalParameters;
    private volatile CoordinatorPhase phase = CoordinatorPhase.AWAITING_QUORUM;
    private volatile RunStatus status = RunStatus.RUNNING;

    RunState(ParameterVector initialParameters) {
        this.globalParameters = initialParameters;
    }

    // ==================== Reads ====================

    public WorkerRegistry getConnectedWorkers() {
        return connectedWorkers;
    }

    /**
     * @return number of completed rounds
     */
    public int getCurrentRound() {
        return currentRound;
    }

    /**
     * @return parameters of the last completed round (initial ones before that, may be null
     *         until they were obtained from a worker)
     */
    public ParameterVector getGlobalParameters() {
        return globalParameters;
    }

    /**
     * @return snapshot of the per-round aggregated metrics, in round order
     */
    public List<RoundMetrics> getHistory() {
        return List.copyOf(history);
    }

    public CoordinatorPhase getPhase() {
        return phase;
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isTerminated() {
        return phase == CoordinatorPhase.TERMINATED;
    }

    // ==================== Round-advance mutations ====================

    void setPhase(CoordinatorPhase phase) {
        this.phase = phase;
    }

    void setGlobalParameters(ParameterVector parameters) {
        this.globalParameters = parameters;
    }

    /**
     * Commits a completed round: new global parameters, one more history entry,
     * round counter + 1.
     */
    void commitRound(ParameterVector parameters, RoundMetrics metrics) {
        this.globalParameters = parameters;
        this.history.add(metrics);
        this.currentRound++;
        this.phase = CoordinatorPhase.ROUND_COMPLETE;
    }

    void terminate(RunStatus finalStatus) {
        this.status = finalStatus;
        this.phase = CoordinatorPhase.TERMINATED;
    }
}
