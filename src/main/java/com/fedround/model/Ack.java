package com.fedround.model;

import java.io.Serializable;

/**
 * Coordinator's answer to a worker registration.
 */
public final class Ack implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean accepted;
    private final int acceptedRoundStart;

    private Ack(boolean accepted, int acceptedRoundStart) {
        this.accepted = accepted;
        this.acceptedRoundStart = acceptedRoundStart;
    }

    /**
     * @param roundStart first round number the worker will be selected for
     */
    public static Ack accepted(int roundStart) {
        return new Ack(true, roundStart);
    }

    /**
     * Registration refused (the run is already over).
     */
    public static Ack rejected() {
        return new Ack(false, -1);
    }

    public boolean isAccepted() {
        return accepted;
    }

    /**
     * @return first round the worker takes part in, -1 if rejected
     */
    public int getAcceptedRoundStart() {
        return acceptedRoundStart;
    }

    @Override
    public String toString() {
        return accepted ? "Ack{accepted, roundStart=" + acceptedRoundStart + "}" : "Ack{rejected}";
    }
}
