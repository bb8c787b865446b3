package com.fedround.exception;

/**
 * A worker's local trainer failed on its own shard.
 * 
 * Recoverable at round level: the coordinator excludes the worker from the
 * current round only, the worker stays connected for the next ones.
 */
public class LocalTrainingException extends FedRoundException {
    private static final long serialVersionUID = 1L;

    public LocalTrainingException(String message) {
        super(message);
    }

    public LocalTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
