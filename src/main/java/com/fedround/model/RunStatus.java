package com.fedround.model;

/**
 * Terminal outcome of a run, as seen by the caller and by workers.
 */
public enum RunStatus {
    /** Rounds are still being played. */
    RUNNING,
    /** All configured rounds completed. */
    COMPLETED,
    /** Retries were exhausted or a configuration error stopped the run. */
    ABORTED
}
