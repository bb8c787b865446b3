package com.fedround.rmi;

import com.fedround.model.Ack;

import java.rmi.Remote;
import java.rmi.RemoteException;

/**
 * Interface exposed ONLY by the coordinator.
 * Manages worker membership for the run.
 */
public interface CoordinatorService extends Remote {

    /** Name under which the coordinator binds itself in its registry. */
    String BINDING = "coordinator";

    /**
     * Called by a worker to join the run, before or between rounds.
     * 
     * @param workerId ordinal of the worker
     * @param worker remote reference to the worker
     * @return acknowledgement with the first round the worker takes part in
     * @throws RemoteException if RMI communication fails
     */
    Ack registerWorker(int workerId, WorkerService worker) throws RemoteException;

    /**
     * Heartbeat from a worker, so the coordinator can evict silent ones.
     * 
     * @param workerId ordinal of the pinging worker
     * @return true if the coordinator still knows this worker
     * @throws RemoteException if RMI communication fails
     */
    boolean heartbeat(int workerId) throws RemoteException;
}
