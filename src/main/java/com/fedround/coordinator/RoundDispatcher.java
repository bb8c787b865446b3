package com.fedround.coordinator;

import com.fedround.exception.LocalTrainingException;
import com.fedround.model.WorkerFailure;
import com.fedround.rmi.WorkerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.rmi.RemoteException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out / fan-in barrier over the workers of a round.
 * 
 * Every participant is called concurrently on a pooled thread; the barrier
 * returns once all replies are in or the timeout has elapsed. Calls still
 * running at the deadline are cancelled and recorded as TIMEOUT, their late
 * results are discarded.
 * 
 * Per-worker errors are absorbed here and turned into {@link WorkerFailure}s.
 */
public class RoundDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RoundDispatcher.class);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ExecutorService threadPool;

    /**
     * A single remote call against one worker.
     *
     * @param <R> reply type
     */
    @FunctionalInterface
    public interface WorkerCall<R> {
        R call(WorkerService worker) throws Exception;
    }

    /**
     * Outcome of one barrier: replies by worker ordinal plus the recorded failures.
     *
     * @param <R> reply type
     */
    public static final class Barrier<R> {
        private final Map<Integer, R> results;
        private final List<WorkerFailure> failures;

        Barrier(Map<Integer, R> results, List<WorkerFailure> failures) {
            this.results = results;
            this.failures = failures;
        }

        /**
         * @return successful replies in worker order
         */
        public Map<Integer, R> getResults() {
            return results;
        }

        public List<WorkerFailure> getFailures() {
            return failures;
        }

        public int successCount() {
            return results.size();
        }
    }

    public RoundDispatcher() {
        AtomicInteger counter = new AtomicInteger();
        // Cached pool: workers block on remote calls, one thread per in-flight call
        this.threadPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("RoundDispatcher-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Calls every participant concurrently and waits at the barrier.
     * 
     * @param roundNumber round being played (for failure records)
     * @param stage FIT or EVAL
     * @param participants workers to call, by ordinal
     * @param call the remote call to make on each
     * @param timeoutMs barrier timeout
     * @return replies and failures
     * @throws InterruptedException if the coordinator is interrupted while waiting
     */
    public <R> Barrier<R> dispatch(int roundNumber, WorkerFailure.Stage stage,
                                   Map<Integer, WorkerService> participants,
                                   WorkerCall<R> call, long timeoutMs) throws InterruptedException {
        CompletionService<R> completionService = new ExecutorCompletionService<>(threadPool);
        Map<Future<R>, Integer> pending = new HashMap<>();

        for (Map.Entry<Integer, WorkerService> entry : participants.entrySet()) {
            WorkerService worker = entry.getValue();
            pending.put(completionService.submit(() -> call.call(worker)), entry.getKey());
        }
        log.debug("Round {} {}: dispatched to {} worker(s)", roundNumber, stage, pending.size());

        Map<Integer, R> results = new TreeMap<>();
        List<WorkerFailure> failures = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeoutMs;

        try {
            while (!pending.isEmpty()) {
                long remaining = deadline - System.currentTimeMillis();
                Future<R> done = remaining > 0 ? completionService.poll(remaining, TimeUnit.MILLISECONDS) : null;
                if (done == null) {
                    break; // deadline reached
                }

                int workerId = pending.remove(done);
                try {
                    results.put(workerId, done.get());
                    log.debug("Round {} {}: reply from worker {}", roundNumber, stage, workerId);
                } catch (ExecutionException e) {
                    WorkerFailure failure = toFailure(workerId, roundNumber, stage, e.getCause());
                    failures.add(failure);
                    log.warn("Round {} {}: worker {} failed ({}): {}",
                        roundNumber, stage, workerId, failure.getKind(), failure.getMessage());
                }
            }
        } finally {
            // Whatever is still pending missed the barrier (or we were interrupted)
            for (Map.Entry<Future<R>, Integer> entry : pending.entrySet()) {
                entry.getKey().cancel(true);
                failures.add(new WorkerFailure(entry.getValue(), roundNumber, stage,
                    WorkerFailure.Kind.TIMEOUT, "No reply within " + timeoutMs + " ms"));
                log.warn("Round {} {}: worker {} timed out after {} ms, call cancelled",
                    roundNumber, stage, entry.getValue(), timeoutMs);
            }
        }

        return new Barrier<>(results, failures);
    }

    private static WorkerFailure toFailure(int workerId, int roundNumber, WorkerFailure.Stage stage, Throwable cause) {
        if (cause instanceof LocalTrainingException) {
            return new WorkerFailure(workerId, roundNumber, stage, WorkerFailure.Kind.LOCAL_TRAINING, cause.getMessage());
        }
        if (cause instanceof RemoteException) {
            return new WorkerFailure(workerId, roundNumber, stage, WorkerFailure.Kind.DELIVERY,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
        // Anything else (malformed reply, unexpected runtime error) is treated as a delivery problem
        return new WorkerFailure(workerId, roundNumber, stage, WorkerFailure.Kind.DELIVERY,
            cause == null ? "unknown error" : cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    /**
     * Stops the thread pool. In-flight calls are interrupted.
     */
    public void shutdown() {
        threadPool.shutdown();
        try {
            if (!threadPool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                threadPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            threadPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
