package com.fedround.monitor;

import com.fedround.rmi.CoordinatorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.rmi.RemoteException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Worker-side monitor of the coordinator's health through periodic heartbeats.
 * Executes a callback when the coordinator is declared dead after consecutive failures.
 * 
 * Thread-safe implementation using ScheduledExecutorService for periodic execution.
 */
public class HeartbeatMonitor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    public static final long DEFAULT_INTERVAL_MS = 5000;   // 5 seconds between heartbeats
    public static final int MAX_MISSED_HEARTBEATS = 3;     // 15 seconds total before declaring dead

    private final ScheduledExecutorService scheduler; // thread pool for scheduling heartbeats
    private final CoordinatorService coordinator; // the node to monitor
    private final int workerId; // sent with each heartbeat
    private final CoordinatorFailureCallback failureCallback;
    private final EvictionCallback evictionCallback; // may be null
    private final long intervalMs;

    private int missedHeartbeats = 0; // consecutive misses, only touched by the scheduler thread
    private ScheduledFuture<?> heartbeatTask;

    /**
     * Callback invoked when the coordinator is declared dead.
     */
    public interface CoordinatorFailureCallback {
        /**
         * Called after MAX_MISSED_HEARTBEATS consecutive failed heartbeats.
         */
        void onCoordinatorDied();
    }

    /**
     * Callback invoked when the coordinator answers but no longer knows this worker
     * (it was evicted by the coordinator's failure detector).
     */
    public interface EvictionCallback {
        void onEvicted();
    }

    public HeartbeatMonitor(CoordinatorService coordinator, int workerId,
                            CoordinatorFailureCallback failureCallback, EvictionCallback evictionCallback) {
        this(coordinator, workerId, failureCallback, evictionCallback, DEFAULT_INTERVAL_MS);
    }

    /**
     * @param coordinator remote coordinator to monitor
     * @param workerId ordinal of this worker
     * @param failureCallback callback to execute when the coordinator dies
     * @param evictionCallback optional callback when the coordinator forgot this worker (null = ignore)
     * @param intervalMs period between heartbeats
     */
    public HeartbeatMonitor(CoordinatorService coordinator, int workerId,
                            CoordinatorFailureCallback failureCallback, EvictionCallback evictionCallback,
                            long intervalMs) {
        this.coordinator = coordinator;
        this.workerId = workerId;
        this.failureCallback = failureCallback;
        this.evictionCallback = evictionCallback;
        this.intervalMs = intervalMs;
        this.scheduler = Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("HeartbeatMonitor-worker-" + workerId);
            thread.setDaemon(true);  // Don't prevent JVM shutdown
            return thread;
        });
    }

    /**
     * Starts the heartbeats. The first one is sent immediately.
     */
    public void start() {
        if (heartbeatTask != null && !heartbeatTask.isDone()) {
            log.warn("Heartbeat monitor already running");
            return;
        }
        heartbeatTask = scheduler.scheduleAtFixedRate(this::sendHeartbeat, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Heartbeat monitor started for worker {} (every {} ms)", workerId, intervalMs);
    }

    /**
     * Stops the heartbeats and shuts down the scheduler.
     * Safe to call multiple times.
     */
    public void stop() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);  // Don't interrupt if running
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Heartbeat monitor stopped for worker {}", workerId);
    }

    /**
     * Sends a single heartbeat. Called periodically by the scheduler.
     */
    void sendHeartbeat() {
        try {
            boolean known = coordinator.heartbeat(workerId);

            if (missedHeartbeats > 0) {
                log.info("Coordinator recovered after {} missed heartbeat(s)", missedHeartbeats);
            }
            missedHeartbeats = 0;

            if (!known) {
                log.warn("Coordinator does not know worker {} anymore", workerId);
                if (evictionCallback != null) {
                    evictionCallback.onEvicted();
                }
            } else {
                log.debug("Heartbeat OK for worker {}", workerId);
            }
        } catch (RemoteException e) {
            log.warn("Heartbeat to coordinator failed: {}", e.getClass().getSimpleName());
            handleMissedHeartbeat();
        } catch (RuntimeException e) {
            log.error("Unexpected error during heartbeat: {}", e.getMessage(), e);
            handleMissedHeartbeat();
        }
    }

    private void handleMissedHeartbeat() {
        missedHeartbeats++;
        log.warn("Missed heartbeat {} of {}", missedHeartbeats, MAX_MISSED_HEARTBEATS);

        if (missedHeartbeats >= MAX_MISSED_HEARTBEATS) {
            log.error("Coordinator declared DEAD after {} missed heartbeats", MAX_MISSED_HEARTBEATS);
            if (heartbeatTask != null) {
                heartbeatTask.cancel(false);
            }
            try {
                failureCallback.onCoordinatorDied();
            } catch (RuntimeException e) {
                log.error("Callback onCoordinatorDied() failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * @return current count of consecutive missed heartbeats
     */
    public int getMissedHeartbeats() {
        return missedHeartbeats;
    }
}
