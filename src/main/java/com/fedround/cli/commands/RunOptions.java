package com.fedround.cli.commands;

import com.fedround.coordinator.RunConfig;
import com.fedround.model.Hyperparameters;
import picocli.CommandLine.Option;

/**
 * Run configuration options shared by the coordinator and simulate commands.
 */
public class RunOptions {

    @Option(names = {"-r", "--rounds"}, description = "Number of rounds (default: ${DEFAULT-VALUE})",
        defaultValue = "3")
    int rounds;

    @Option(names = {"--min-participants"},
        description = "Minimum results a round needs (default: ${DEFAULT-VALUE})", defaultValue = "2")
    int minParticipants;

    @Option(names = {"-w", "--workers"}, description = "Number of workers in the run (default: ${DEFAULT-VALUE})",
        defaultValue = "3")
    int workers;

    @Option(names = {"--split-ratio"}, description = "Train fraction of each shard (default: ${DEFAULT-VALUE})",
        defaultValue = "0.8")
    double splitRatio;

    @Option(names = {"--timeout-ms"}, description = "Per-barrier timeout in ms (default: ${DEFAULT-VALUE})",
        defaultValue = "60000")
    long timeoutMs;

    @Option(names = {"--max-retries"}, description = "Retries of a failed round (default: ${DEFAULT-VALUE})",
        defaultValue = "2")
    int maxRetries;

    @Option(names = {"--learning-rate"}, description = "Local learning rate (default: ${DEFAULT-VALUE})",
        defaultValue = "0.1")
    double learningRate;

    @Option(names = {"--epochs"}, description = "Local epochs per round (default: ${DEFAULT-VALUE})",
        defaultValue = "100")
    int epochs;

    @Option(names = {"--l2"}, description = "L2 penalty on weights (default: ${DEFAULT-VALUE})",
        defaultValue = "0.0")
    double l2;

    /**
     * @throws IllegalArgumentException if the options do not form a valid configuration
     */
    RunConfig toConfig() {
        return new RunConfig.Builder()
            .totalRounds(rounds)
            .minParticipants(minParticipants)
            .workerCount(workers)
            .splitRatio(splitRatio)
            .perRoundTimeoutMs(timeoutMs)
            .maxRoundRetries(maxRetries)
            .hyperparameters(new Hyperparameters(learningRate, epochs, l2))
            .build();
    }
}
