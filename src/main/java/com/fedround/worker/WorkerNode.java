package com.fedround.worker;

import com.fedround.model.Ack;
import com.fedround.monitor.HeartbeatMonitor;
import com.fedround.rmi.CoordinatorService;
import com.fedround.rmi.WorkerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.rmi.NotBoundException;
import java.rmi.RemoteException;
import java.rmi.registry.LocateRegistry;
import java.rmi.registry.Registry;
import java.rmi.server.UnicastRemoteObject;
import java.util.concurrent.TimeUnit;

/**
 * RMI host of a {@link FederatedWorker}.
 * Creates its own registry on the given port, binds the worker as "worker",
 * joins the coordinator and keeps a heartbeat towards it.
 */
public class WorkerNode {
    private static final Logger log = LoggerFactory.getLogger(WorkerNode.class);

    private final FederatedWorker worker;
    private final int port;
    private final Registry myRegistry;

    private CoordinatorService coordinator;
    private HeartbeatMonitor coordinatorMonitor;

    /**
     * Exports the worker and creates its RMI registry.
     * 
     * @param host host address other processes reach this worker on
     * @param port RMI registry port
     * @param worker the worker logic to serve
     * @throws RemoteException if RMI export fails
     */
    public WorkerNode(String host, int port, FederatedWorker worker) throws RemoteException {
        // Prevents "Connection refused" when RMI auto-detects the wrong address on multi-NIC systems
        if (System.getProperty("java.rmi.server.hostname") == null) {
            System.setProperty("java.rmi.server.hostname", host);
        }

        this.worker = worker;
        this.port = port;

        UnicastRemoteObject.exportObject(worker, 0);
        this.myRegistry = LocateRegistry.createRegistry(port);
        this.myRegistry.rebind(WorkerService.BINDING, worker);

        log.info("Worker node {} initialized on port {}", worker.getWorkerId(), port);
    }

    /**
     * Joins the run managed by the coordinator at the given address.
     * 
     * @param coordinatorHost coordinator's hostname
     * @param coordinatorPort coordinator's RMI registry port
     * @return the coordinator's acknowledgement
     * @throws RemoteException if the coordinator cannot be reached
     * @throws NotBoundException if no coordinator is bound at that address
     * @throws IllegalStateException if the coordinator refused the registration
     */
    public Ack joinCoordinator(String coordinatorHost, int coordinatorPort)
            throws RemoteException, NotBoundException {
        Registry coordinatorRegistry = LocateRegistry.getRegistry(coordinatorHost, coordinatorPort);
        this.coordinator = (CoordinatorService) coordinatorRegistry.lookup(CoordinatorService.BINDING);

        Ack ack = coordinator.registerWorker(worker.getWorkerId(), worker);
        if (!ack.isAccepted()) {
            throw new IllegalStateException("Coordinator refused worker " + worker.getWorkerId()
                + " (run already terminated)");
        }

        log.info("[OK] Worker {} joined coordinator {}:{}, first round {}",
            worker.getWorkerId(), coordinatorHost, coordinatorPort, ack.getAcceptedRoundStart());

        coordinatorMonitor = new HeartbeatMonitor(coordinator, worker.getWorkerId(),
            this::onCoordinatorDied, this::onEvicted);
        coordinatorMonitor.start();
        return ack;
    }

    /**
     * Blocks until the run is over (reported by the coordinator, or coordinator dead).
     */
    public void awaitRunFinished() throws InterruptedException {
        while (!worker.awaitRunFinished(1, TimeUnit.MINUTES)) {
            log.debug("Worker {} still serving", worker.getWorkerId());
        }
    }

    public FederatedWorker getWorker() {
        return worker;
    }

    public int getPort() {
        return port;
    }

    private void onCoordinatorDied() {
        log.error("[ALERT] Coordinator is gone, worker {} stops serving", worker.getWorkerId());
        worker.abandon();
    }

    private void onEvicted() {
        try {
            Ack ack = coordinator.registerWorker(worker.getWorkerId(), worker);
            log.info("Worker {} re-registered after eviction: {}", worker.getWorkerId(), ack);
            if (!ack.isAccepted()) {
                worker.abandon();
            }
        } catch (RemoteException e) {
            log.warn("Re-registration of worker {} failed: {}", worker.getWorkerId(), e.getMessage());
        }
    }

    /**
     * Graceful shutdown: stops the heartbeat, unbinds and unexports the worker.
     */
    public void shutdown() {
        log.info("Shutting down worker node {}...", worker.getWorkerId());

        if (coordinatorMonitor != null) {
            coordinatorMonitor.stop();
        }

        try {
            myRegistry.unbind(WorkerService.BINDING);
        } catch (Exception e) {
            log.warn("Error unbinding from registry: {}", e.getMessage());
        }

        try {
            UnicastRemoteObject.unexportObject(worker, true);
            UnicastRemoteObject.unexportObject(myRegistry, true);
        } catch (Exception e) {
            log.warn("Error unexporting RMI objects: {}", e.getMessage());
        }

        log.info("[OK] Worker node {} shut down cleanly", worker.getWorkerId());
    }
}
