package com.fedround.cli.commands;

import com.fedround.model.RoundMetrics;
import com.fedround.model.WorkerFailure;

import java.io.PrintStream;
import java.util.List;

/**
 * Console rendering of a run history.
 */
final class RunReport {

    private RunReport() {
    }

    static void printHistory(PrintStream out, List<RoundMetrics> history) {
        out.println();
        out.println("Round | Train acc | Loss   | Eval acc | Fit | Eval | Attempts");
        out.println("------+-----------+--------+----------+-----+------+---------");
        for (RoundMetrics round : history) {
            out.printf("%5d | %8.2f%% | %6.4f | %7.2f%% | %3d | %4d | %8d%n",
                round.getRoundNumber(),
                round.getAggregatedTrainMetric() * 100,
                round.getAggregatedLoss(),
                round.getAggregatedEvalMetric() * 100,
                round.getParticipantCount(),
                round.getEvalParticipantCount(),
                round.getAttempts());
            for (WorkerFailure failure : round.getFailures()) {
                out.println("        ! " + failure);
            }
        }
        out.println();
    }
}
