package com.fedround.cli.commands;

import com.fedround.coordinator.Coordinator;
import com.fedround.coordinator.CoordinatorNode;
import com.fedround.coordinator.RunConfig;
import com.fedround.coordinator.RunResult;
import com.fedround.exception.RunAbortedException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * Starts a coordinator, plays the run to completion and prints its history.
 * Exit code 0 on completion, 2 on abort.
 */
@Command(name = "coordinator", description = "Start the coordinator and run all rounds")
public class CoordinatorCommand implements Callable<Integer> {

    static final int EXIT_ABORTED = 2;

    @Option(
        names = {"-p", "--port"},
        description = "RMI registry port (default: ${DEFAULT-VALUE})",
        defaultValue = "5001"
    )
    int port;

    @Option(
        names = {"-h", "--host"},
        description = "Hostname/IP workers reach the coordinator on (default: ${DEFAULT-VALUE})",
        defaultValue = "localhost"
    )
    String host;

    @Mixin
    RunOptions runOptions;

    @Override
    public Integer call() throws Exception {
        RunConfig config = runOptions.toConfig();

        System.out.println("========================================");
        System.out.println("  FedRound Coordinator - Starting");
        System.out.println("========================================");
        System.out.println();

        Coordinator coordinator = new Coordinator(config);
        CoordinatorNode node = new CoordinatorNode(host, port, coordinator);

        System.out.println("[OK] Coordinator listening on " + host + ":" + port);
        System.out.println("  Rounds: " + config.getTotalRounds());
        System.out.println("  Quorum: " + config.getMinParticipants() + " of " + config.getWorkerCount());
        System.out.println();
        System.out.println("Waiting for workers to join...");

        try {
            RunResult result = coordinator.run();
            RunReport.printHistory(System.out, result.getHistory());
            System.out.println("[OK] Run " + result.getStatus());
            return 0;
        } catch (RunAbortedException e) {
            RunReport.printHistory(System.out, e.getHistory());
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_ABORTED;
        } finally {
            node.shutdown();
        }
    }
}
