package com.fedround.exception;

/**
 * Base class for the checked failures of a federated run.
 * Serializable through RMI, so workers can throw subclasses back to the coordinator.
 */
public class FedRoundException extends Exception {
    private static final long serialVersionUID = 1L;

    public FedRoundException(String message) {
        super(message);
    }

    public FedRoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
