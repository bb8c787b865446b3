package com.fedround.model;

import java.io.Serializable;

/**
 * Records one worker that did not contribute to a round barrier.
 * Kept in the round's metrics; never propagated to other workers.
 */
public final class WorkerFailure implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Barrier at which the worker failed. */
    public enum Stage { FIT, EVAL }

    /** Why the worker did not contribute. */
    public enum Kind {
        /** No reply before the per-round timeout. */
        TIMEOUT,
        /** The worker's trainer failed on its own shard. */
        LOCAL_TRAINING,
        /** Transport failure, e.g. the worker process is gone. */
        DELIVERY
    }

    private final int workerId;
    private final int roundNumber;
    private final Stage stage;
    private final Kind kind;
    private final String message;

    public WorkerFailure(int workerId, int roundNumber, Stage stage, Kind kind, String message) {
        this.workerId = workerId;
        this.roundNumber = roundNumber;
        this.stage = stage;
        this.kind = kind;
        this.message = message;
    }

    public int getWorkerId() {
        return workerId;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public Stage getStage() {
        return stage;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return String.format("WorkerFailure{worker=%d, round=%d, %s/%s: %s}",
            workerId, roundNumber, stage, kind, message);
    }
}
