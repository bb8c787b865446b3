package com.fedround.coordinator;

import com.fedround.rmi.WorkerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * Set of workers connected to the run, keyed by worker ordinal.
 * 
 * All access goes through the registry's monitor, so registrations coming in on
 * RMI threads, evictions from the failure detector and the coordinator's reads
 * never interleave. Waiters for quorum are woken on every registration.
 */
public class WorkerRegistry {
    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    // TreeMap keeps iteration in worker order, which makes round logs deterministic
    private final Map<Integer, WorkerService> workers = new TreeMap<>();

    /**
     * Adds a worker, or replaces the reference of a worker registering again
     * (e.g. a restarted process with the same ordinal).
     * 
     * @param workerId ordinal of the worker
     * @param worker its remote reference
     * @return true if the worker was new, false if an existing reference was replaced
     */
    public synchronized boolean register(int workerId, WorkerService worker) {
        WorkerService previous = workers.put(workerId, worker);
        notifyAll();

        if (previous != null) {
            log.warn("Worker {} registered again, replacing stale reference", workerId);
            return false;
        }
        log.info("Worker {} joined the run. Connected workers: {}", workerId, workers.size());
        return true;
    }

    /**
     * Removes a worker (dead or gone).
     * 
     * @param workerId ordinal of the worker
     * @return true if a worker was removed
     */
    public synchronized boolean remove(int workerId) {
        boolean removed = workers.remove(workerId) != null;
        if (removed) {
            log.info("Worker {} removed from the run. Remaining: {}", workerId, workers.size());
        } else {
            log.debug("Worker {} was not connected, nothing to remove", workerId);
        }
        return removed;
    }

    public synchronized boolean contains(int workerId) {
        return workers.containsKey(workerId);
    }

    public synchronized int size() {
        return workers.size();
    }

    /**
     * @return copy of the connected workers, in worker order
     */
    public synchronized Map<Integer, WorkerService> snapshot() {
        return new TreeMap<>(workers);
    }

    /**
     * Blocks until at least {@code count} workers are connected or the timeout elapses.
     * 
     * @param count workers needed
     * @param timeoutMs maximum wait, 0 = just check
     * @return true if the count was reached
     * @throws InterruptedException if interrupted while waiting
     */
    public synchronized boolean awaitSize(int count, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (workers.size() < count) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }
}
