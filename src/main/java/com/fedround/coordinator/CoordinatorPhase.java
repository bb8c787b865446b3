package com.fedround.coordinator;

/**
 * States of the coordinator's round lifecycle.
 * 
 * AWAITING_QUORUM -> CONFIGURING_ROUND -> COLLECTING_FIT -> AGGREGATING
 * -> COLLECTING_EVAL -> ROUND_COMPLETE -> (CONFIGURING_ROUND | TERMINATED)
 * 
 * A failed round attempt goes back to AWAITING_QUORUM before its retry.
 */
public enum CoordinatorPhase {
    AWAITING_QUORUM,
    CONFIGURING_ROUND,
    COLLECTING_FIT,
    AGGREGATING,
    COLLECTING_EVAL,
    ROUND_COMPLETE,
    TERMINATED;

    /**
     * @return true while a round is in flight (workers are being configured or called)
     */
    public boolean isRoundInFlight() {
        return this == CONFIGURING_ROUND || this == COLLECTING_FIT
            || this == AGGREGATING || this == COLLECTING_EVAL;
    }
}
