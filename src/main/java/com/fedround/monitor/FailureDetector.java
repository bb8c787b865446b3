package com.fedround.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Coordinator-side component that tracks worker health via heartbeat timestamps.
 * Workers periodically call heartbeat(workerId); a background thread declares
 * silent workers dead and hands them to the callback (eviction from the run).
 * 
 * Thread-safe for concurrent heartbeats from multiple workers.
 */
public class FailureDetector {
    private static final Logger log = LoggerFactory.getLogger(FailureDetector.class);

    public static final long DEFAULT_TIMEOUT_MS = 15000;         // 3 missed heartbeats
    public static final long DEFAULT_CHECK_INTERVAL_MS = 5000;

    private final Map<Integer, Long> lastHeartbeatTable = new ConcurrentHashMap<>();
    private final WorkerFailureCallback failureCallback;
    private final long timeoutMs;
    private final long checkIntervalMs;
    private final LongSupplier clock;
    private final ScheduledExecutorService monitor;

    private volatile boolean running = false;

    /**
     * Callback invoked when a worker is declared dead.
     */
    public interface WorkerFailureCallback {
        /**
         * @param workerId ordinal of the dead worker
         */
        void onWorkerFailed(int workerId);
    }

    public FailureDetector(WorkerFailureCallback failureCallback) {
        this(failureCallback, DEFAULT_TIMEOUT_MS, DEFAULT_CHECK_INTERVAL_MS, System::currentTimeMillis);
    }

    /**
     * @param failureCallback callback to execute when a worker dies
     * @param timeoutMs silence after which a worker is dead
     * @param checkIntervalMs period of the background check
     * @param clock time source in milliseconds
     */
    public FailureDetector(WorkerFailureCallback failureCallback, long timeoutMs, long checkIntervalMs,
                           LongSupplier clock) {
        this.failureCallback = failureCallback;
        this.timeoutMs = timeoutMs;
        this.checkIntervalMs = checkIntervalMs;
        this.clock = clock;
        this.monitor = Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("FailureDetector-Monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Records a heartbeat. Auto-registers workers on first ping.
     * 
     * @param workerId ordinal of the worker
     */
    public void ping(int workerId) {
        long now = clock.getAsLong();
        Long previous = lastHeartbeatTable.put(workerId, now);

        if (previous == null) {
            log.info("Worker {} registered in failure detector", workerId);
        } else {
            log.debug("Heartbeat received from worker {} (last: {}ms ago)", workerId, now - previous);
        }
    }

    /**
     * Stops tracking a worker (it left or was already evicted).
     */
    public void forget(int workerId) {
        lastHeartbeatTable.remove(workerId);
    }

    /**
     * Starts the background check thread.
     */
    public void start() {
        if (running) {
            log.warn("FailureDetector already running");
            return;
        }
        running = true;
        monitor.scheduleAtFixedRate(this::checkWorkers, checkIntervalMs, checkIntervalMs, TimeUnit.MILLISECONDS);
        log.info("[OK] FailureDetector started (timeout: {}ms, check interval: {}ms)", timeoutMs, checkIntervalMs);
    }

    /**
     * Declares dead every worker silent for longer than the timeout.
     * 
     * @return ordinals of the workers declared dead by this check
     */
    public List<Integer> checkWorkers() {
        long now = clock.getAsLong();
        List<Integer> dead = new ArrayList<>();

        for (Map.Entry<Integer, Long> entry : lastHeartbeatTable.entrySet()) {
            long silence = now - entry.getValue();
            if (silence > timeoutMs) {
                dead.add(entry.getKey());
            }
        }

        for (Integer workerId : dead) {
            lastHeartbeatTable.remove(workerId);
            log.warn("Worker {} declared DEAD (no heartbeat for more than {}ms)", workerId, timeoutMs);
            try {
                failureCallback.onWorkerFailed(workerId);
            } catch (RuntimeException e) {
                log.error("Failure callback for worker {} failed: {}", workerId, e.getMessage(), e);
            }
        }
        return dead;
    }

    /**
     * Stops the background check thread.
     */
    public void stop() {
        running = false;
        monitor.shutdown();
        try {
            if (!monitor.awaitTermination(2, TimeUnit.SECONDS)) {
                monitor.shutdownNow();
            }
        } catch (InterruptedException e) {
            monitor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("FailureDetector stopped");
    }

    /**
     * @return number of workers currently tracked
     */
    public int getTrackedWorkerCount() {
        return lastHeartbeatTable.size();
    }
}
