package com.fedround.coordinator;

import com.fedround.model.Hyperparameters;

import java.io.Serializable;
import java.util.Objects;

/**
 * Centralized configuration of a federated run, consumed at startup.
 * 
 * Uses Builder pattern for clean, validated construction.
 * Immutable after creation - thread-safe and serializable.
 * 
 * Example usage:
 * RunConfig config = new RunConfig.Builder()
 *     .totalRounds(3)
 *     .minParticipants(2)
 *     .perRoundTimeoutMs(60_000)
 *     .build();
 */
public class RunConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_TOTAL_ROUNDS = 3;
    public static final int DEFAULT_MIN_PARTICIPANTS = 2;
    public static final long DEFAULT_PER_ROUND_TIMEOUT_MS = 60_000;
    public static final int DEFAULT_MAX_ROUND_RETRIES = 2;
    public static final int DEFAULT_WORKER_COUNT = 3;
    public static final double DEFAULT_SPLIT_RATIO = 0.8;
    public static final long DEFAULT_QUORUM_LOG_INTERVAL_MS = 5_000;

    private final int totalRounds;
    private final int minParticipants;
    private final long perRoundTimeoutMs;
    private final int maxRoundRetries;
    private final int workerCount;
    private final double splitRatio;
    private final Hyperparameters hyperparameters;
    private final long quorumLogIntervalMs;

    /**
     * Private constructor - use Builder to create instances.
     */
    private RunConfig(Builder builder) {
        this.totalRounds = builder.totalRounds;
        this.minParticipants = builder.minParticipants;
        this.perRoundTimeoutMs = builder.perRoundTimeoutMs;
        this.maxRoundRetries = builder.maxRoundRetries;
        this.workerCount = builder.workerCount;
        this.splitRatio = builder.splitRatio;
        this.hyperparameters = builder.hyperparameters;
        this.quorumLogIntervalMs = builder.quorumLogIntervalMs;
    }

    /**
     * @return number of rounds after which the run terminates
     */
    public int getTotalRounds() {
        return totalRounds;
    }

    /**
     * @return quorum: workers needed to start a round and results needed to keep it
     */
    public int getMinParticipants() {
        return minParticipants;
    }

    /**
     * @return maximum wait of each fan-in barrier (fit, then eval), in milliseconds
     */
    public long getPerRoundTimeoutMs() {
        return perRoundTimeoutMs;
    }

    /**
     * @return retries of a failed round before the run aborts
     */
    public int getMaxRoundRetries() {
        return maxRoundRetries;
    }

    /**
     * @return number of partitions the dataset is split into
     */
    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * @return fraction of each partition used for training
     */
    public double getSplitRatio() {
        return splitRatio;
    }

    public Hyperparameters getHyperparameters() {
        return hyperparameters;
    }

    /**
     * @return how often waiting for quorum is reported in the log
     */
    public long getQuorumLogIntervalMs() {
        return quorumLogIntervalMs;
    }

    @Override
    public String toString() {
        return "RunConfig{" +
                "totalRounds=" + totalRounds +
                ", minParticipants=" + minParticipants +
                ", perRoundTimeoutMs=" + perRoundTimeoutMs +
                ", maxRoundRetries=" + maxRoundRetries +
                ", workerCount=" + workerCount +
                ", splitRatio=" + splitRatio +
                ", " + hyperparameters +
                '}';
    }

    /**
     * Builder for RunConfig instances.
     * All fields have defaults; validation happens in {@link #build()}.
     */
    public static class Builder {
        private int totalRounds = DEFAULT_TOTAL_ROUNDS;
        private int minParticipants = DEFAULT_MIN_PARTICIPANTS;
        private long perRoundTimeoutMs = DEFAULT_PER_ROUND_TIMEOUT_MS;
        private int maxRoundRetries = DEFAULT_MAX_ROUND_RETRIES;
        private int workerCount = DEFAULT_WORKER_COUNT;
        private double splitRatio = DEFAULT_SPLIT_RATIO;
        private Hyperparameters hyperparameters = Hyperparameters.defaults();
        private long quorumLogIntervalMs = DEFAULT_QUORUM_LOG_INTERVAL_MS;

        public Builder totalRounds(int totalRounds) {
            this.totalRounds = totalRounds;
            return this;
        }

        public Builder minParticipants(int minParticipants) {
            this.minParticipants = minParticipants;
            return this;
        }

        public Builder perRoundTimeoutMs(long perRoundTimeoutMs) {
            this.perRoundTimeoutMs = perRoundTimeoutMs;
            return this;
        }

        public Builder maxRoundRetries(int maxRoundRetries) {
            this.maxRoundRetries = maxRoundRetries;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder splitRatio(double splitRatio) {
            this.splitRatio = splitRatio;
            return this;
        }

        public Builder hyperparameters(Hyperparameters hyperparameters) {
            this.hyperparameters = Objects.requireNonNull(hyperparameters, "hyperparameters cannot be null");
            return this;
        }

        public Builder quorumLogIntervalMs(long quorumLogIntervalMs) {
            this.quorumLogIntervalMs = quorumLogIntervalMs;
            return this;
        }

        /**
         * Validates and builds the configuration.
         * 
         * @return immutable RunConfig
         * @throws IllegalArgumentException if a value is out of range
         */
        public RunConfig build() {
            if (totalRounds < 1) {
                throw new IllegalArgumentException("totalRounds must be >= 1, got " + totalRounds);
            }
            if (minParticipants < 1) {
                throw new IllegalArgumentException("minParticipants must be >= 1, got " + minParticipants);
            }
            if (perRoundTimeoutMs <= 0) {
                throw new IllegalArgumentException("perRoundTimeoutMs must be positive, got " + perRoundTimeoutMs);
            }
            if (maxRoundRetries < 0) {
                throw new IllegalArgumentException("maxRoundRetries must be >= 0, got " + maxRoundRetries);
            }
            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
            }
            if (minParticipants > workerCount) {
                throw new IllegalArgumentException(String.format(
                    "minParticipants (%d) cannot exceed workerCount (%d), quorum would never be reached",
                    minParticipants, workerCount));
            }
            if (!(splitRatio > 0.0 && splitRatio < 1.0)) {
                throw new IllegalArgumentException("splitRatio must be in (0, 1), got " + splitRatio);
            }
            if (quorumLogIntervalMs <= 0) {
                throw new IllegalArgumentException("quorumLogIntervalMs must be positive");
            }
            return new RunConfig(this);
        }
    }
}
