package com.fedround.model;

import java.io.Serializable;
import java.util.List;

/**
 * One history entry: the aggregated outcome of a completed round.
 */
public final class RoundMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int roundNumber;
    private final double aggregatedTrainMetric;
    private final double aggregatedLoss;
    private final double aggregatedEvalMetric;
    private final int participantCount;
    private final int evalParticipantCount;
    private final int attempts;
    private final List<WorkerFailure> failures;

    public RoundMetrics(int roundNumber, double aggregatedTrainMetric, double aggregatedLoss,
                        double aggregatedEvalMetric, int participantCount, int evalParticipantCount,
                        int attempts, List<WorkerFailure> failures) {
        this.roundNumber = roundNumber;
        this.aggregatedTrainMetric = aggregatedTrainMetric;
        this.aggregatedLoss = aggregatedLoss;
        this.aggregatedEvalMetric = aggregatedEvalMetric;
        this.participantCount = participantCount;
        this.evalParticipantCount = evalParticipantCount;
        this.attempts = attempts;
        this.failures = List.copyOf(failures);
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    /**
     * @return train accuracy averaged over fit participants, weighted by train rows
     */
    public double getAggregatedTrainMetric() {
        return aggregatedTrainMetric;
    }

    /**
     * @return held-out loss averaged over eval participants, weighted by held-out rows
     */
    public double getAggregatedLoss() {
        return aggregatedLoss;
    }

    public double getAggregatedEvalMetric() {
        return aggregatedEvalMetric;
    }

    /**
     * @return number of fit results that went into the aggregated parameters
     */
    public int getParticipantCount() {
        return participantCount;
    }

    public int getEvalParticipantCount() {
        return evalParticipantCount;
    }

    /**
     * @return attempts needed to complete the round (1 when no retry happened)
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * @return worker failures recorded during the successful attempt
     */
    public List<WorkerFailure> getFailures() {
        return failures;
    }

    @Override
    public String toString() {
        return String.format("Round %d: trainMetric=%.4f loss=%.4f evalMetric=%.4f participants=%d attempts=%d",
            roundNumber, aggregatedTrainMetric, aggregatedLoss, aggregatedEvalMetric, participantCount, attempts);
    }
}
