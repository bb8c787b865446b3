package com.fedround.coordinator;

import com.fedround.model.Ack;
import com.fedround.monitor.FailureDetector;
import com.fedround.rmi.CoordinatorService;
import com.fedround.rmi.WorkerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.rmi.RemoteException;
import java.rmi.registry.LocateRegistry;
import java.rmi.registry.Registry;
import java.rmi.server.UnicastRemoteObject;

/**
 * RMI host of a {@link Coordinator}.
 * Creates its own registry on the given port and binds itself as "coordinator".
 * Workers register and heartbeat through it; silent workers are evicted by a
 * {@link FailureDetector} and not selected for later rounds.
 */
public class CoordinatorNode implements CoordinatorService {
    private static final Logger log = LoggerFactory.getLogger(CoordinatorNode.class);

    private final Coordinator coordinator;
    private final int port;
    private final Registry myRegistry;
    private final FailureDetector failureDetector;

    /**
     * Exports the coordinator and starts the failure detector.
     * 
     * @param host host address workers reach the coordinator on
     * @param port RMI registry port
     * @param coordinator round logic to serve
     * @throws RemoteException if RMI export fails
     */
    public CoordinatorNode(String host, int port, Coordinator coordinator) throws RemoteException {
        if (System.getProperty("java.rmi.server.hostname") == null) {
            System.setProperty("java.rmi.server.hostname", host);
        }

        this.coordinator = coordinator;
        this.port = port;

        UnicastRemoteObject.exportObject(this, 0);
        this.myRegistry = LocateRegistry.createRegistry(port);
        this.myRegistry.rebind(BINDING, this);

        this.failureDetector = new FailureDetector(this::onWorkerDied);
        this.failureDetector.start();

        log.info("[OK] Coordinator node listening on {}:{}", host, port);
    }

    // ==================== CoordinatorService Implementation ====================

    @Override
    public Ack registerWorker(int workerId, WorkerService worker) throws RemoteException {
        Ack ack = coordinator.registerWorker(workerId, worker);
        if (ack.isAccepted()) {
            failureDetector.ping(workerId);
        }
        return ack;
    }

    @Override
    public boolean heartbeat(int workerId) throws RemoteException {
        if (!coordinator.getRunState().getConnectedWorkers().contains(workerId)) {
            log.debug("Heartbeat from unknown worker {}", workerId);
            return false;
        }
        failureDetector.ping(workerId);
        return true;
    }

    private void onWorkerDied(int workerId) {
        log.warn("[ALERT] Worker {} stopped sending heartbeats, evicting it", workerId);
        coordinator.removeWorker(workerId);
    }

    // ==================== Lifecycle ====================

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public int getPort() {
        return port;
    }

    /**
     * Graceful shutdown: stops the failure detector, unbinds and unexports.
     * The coordinator's run state stays readable.
     */
    public void shutdown() {
        log.info("Shutting down coordinator node on port {}...", port);
        failureDetector.stop();
        coordinator.shutdown();

        try {
            myRegistry.unbind(BINDING);
        } catch (Exception e) {
            log.warn("Error unbinding from registry: {}", e.getMessage());
        }

        try {
            UnicastRemoteObject.unexportObject(this, true);
            UnicastRemoteObject.unexportObject(myRegistry, true);
        } catch (Exception e) {
            log.warn("Error unexporting RMI objects: {}", e.getMessage());
        }

        log.info("[OK] Coordinator node shut down cleanly");
    }
}
