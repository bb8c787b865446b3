package com.fedround.exception;

/**
 * A round could not gather {@code minParticipants} results before its timeout.
 * Triggers a bounded retry of the same round number.
 */
public class QuorumTimeoutException extends FedRoundException {
    private static final long serialVersionUID = 1L;

    private final int roundNumber;
    private final String phase;
    private final int received;
    private final int required;

    public QuorumTimeoutException(int roundNumber, String phase, int received, int required) {
        super(String.format("Round %d %s barrier gathered %d result(s), quorum is %d",
                roundNumber, phase, received, required));
        this.roundNumber = roundNumber;
        this.phase = phase;
        this.received = received;
        this.required = required;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    /**
     * @return the step that missed quorum: configuration, initialization, fit or eval
     */
    public String getPhase() {
        return phase;
    }

    public int getReceived() {
        return received;
    }

    public int getRequired() {
        return required;
    }
}
