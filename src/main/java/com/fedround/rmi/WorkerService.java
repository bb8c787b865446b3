package com.fedround.rmi;

import com.fedround.exception.LocalTrainingException;
import com.fedround.model.EvalRequest;
import com.fedround.model.EvalResult;
import com.fedround.model.FitResult;
import com.fedround.model.ParameterVector;
import com.fedround.model.RoundConfig;
import com.fedround.model.RunStatus;

import java.rmi.Remote;
import java.rmi.RemoteException;

/**
 * Remote interface exposed by each worker.
 * A worker is a pure responder: the coordinator calls it, it never calls back
 * into aggregation logic.
 * Every method MUST declare RemoteException.
 */
public interface WorkerService extends Remote {

    /** Name under which a worker binds itself in its own registry. */
    String BINDING = "worker";

    /**
     * @return ordinal of this worker, {@code 0 <= id < workerCount}
     * @throws RemoteException if RMI communication fails
     */
    int getWorkerId() throws RemoteException;

    /**
     * Liveness probe.
     * @return true if the worker responds
     * @throws RemoteException if RMI communication fails
     */
    boolean ping() throws RemoteException;

    /**
     * Starting parameters of this worker's model. The coordinator asks one worker
     * for them when the run was not given explicit initial parameters.
     * @throws RemoteException if RMI communication fails
     */
    ParameterVector getInitialParameters() throws RemoteException;

    /**
     * Trains locally from the round's global parameters using only this worker's train rows.
     * Runs to completion within the call.
     * 
     * @param config round number, global parameters and hyperparameters
     * @return updated parameters, train row count and train metric
     * @throws LocalTrainingException if the local trainer fails on this shard
     * @throws RemoteException if RMI communication fails
     */
    FitResult fit(RoundConfig config) throws LocalTrainingException, RemoteException;

    /**
     * Scores the given parameters against this worker's held-out rows. No local state changes.
     * 
     * @param request round number and parameters to score
     * @return loss, metric and held-out row count
     * @throws LocalTrainingException if the held-out rows cannot be scored
     * @throws RemoteException if RMI communication fails
     */
    EvalResult evaluate(EvalRequest request) throws LocalTrainingException, RemoteException;

    /**
     * Best-effort notification that the run is over.
     * 
     * @param status terminal status of the run
     * @param roundsCompleted number of rounds in the run's history
     * @throws RemoteException if RMI communication fails
     */
    void onRunFinished(RunStatus status, int roundsCompleted) throws RemoteException;
}
