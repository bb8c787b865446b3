package com.fedround.cli.commands;

import com.fedround.data.Dataset;
import com.fedround.data.DatasetLoader;
import com.fedround.data.Partition;
import com.fedround.data.Partitioner;
import com.fedround.model.Ack;
import com.fedround.model.RunStatus;
import com.fedround.trainer.SoftmaxRegressionTrainer;
import com.fedround.worker.FederatedWorker;
import com.fedround.worker.WorkerNode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Starts one worker: loads the dataset, builds its partition, joins the
 * coordinator and serves until the run is over.
 */
@Command(name = "worker", description = "Start a worker and join the coordinator")
public class WorkerCommand implements Callable<Integer> {

    @Option(
        names = {"-p", "--port"},
        description = "RMI registry port (default: ${DEFAULT-VALUE})",
        defaultValue = "5002"
    )
    int port;

    @Option(
        names = {"-h", "--host"},
        description = "Hostname/IP for RMI binding (default: ${DEFAULT-VALUE})",
        defaultValue = "localhost"
    )
    String host;

    @Option(names = {"-i", "--id"}, description = "Worker ordinal, 0 <= id < count", required = true)
    int workerId;

    @Option(names = {"-c", "--count"}, description = "Number of workers in the run (default: ${DEFAULT-VALUE})",
        defaultValue = "3")
    int workerCount;

    @Option(names = {"--split-ratio"}, description = "Train fraction of the shard (default: ${DEFAULT-VALUE})",
        defaultValue = "0.8")
    double splitRatio;

    @Option(names = {"-d", "--dataset"}, description = "CSV dataset, same file on every worker", required = true)
    Path dataset;

    @Option(names = {"--label-column"}, description = "Label column name (default: ${DEFAULT-VALUE})",
        defaultValue = DatasetLoader.DEFAULT_LABEL_COLUMN)
    String labelColumn;

    @Option(
        names = {"-j", "--join"},
        description = "Coordinator address (format: HOST:PORT, default: ${DEFAULT-VALUE})",
        defaultValue = "localhost:5001"
    )
    String joinAddress;

    @Override
    public Integer call() throws Exception {
        String[] parts = joinAddress.split(":");
        if (parts.length != 2) {
            System.err.println("ERROR: --join must be HOST:PORT, got " + joinAddress);
            return 1;
        }

        System.out.println("========================================");
        System.out.println("  FedRound Worker " + workerId + " - Starting");
        System.out.println("========================================");
        System.out.println();

        Dataset data = DatasetLoader.fromCsv(dataset, labelColumn);
        Partition partition = Partitioner.partition(data, workerId, workerCount, splitRatio);
        FederatedWorker worker = new FederatedWorker(partition, SoftmaxRegressionTrainer.forDataset(data));
        WorkerNode node = new WorkerNode(host, port, worker);

        try {
            Ack ack = node.joinCoordinator(parts[0], Integer.parseInt(parts[1]));
            System.out.println("[OK] Worker started successfully");
            System.out.println("  Host: " + host);
            System.out.println("  Port: " + port);
            System.out.println("  Shard: " + partition);
            System.out.println("  Coordinator: " + joinAddress);
            System.out.println("  First round: " + ack.getAcceptedRoundStart());
            System.out.println();

            node.awaitRunFinished();
            System.out.println("[OK] Run finished: " + worker.getFinalStatus());
            return worker.getFinalStatus() == RunStatus.COMPLETED ? 0 : CoordinatorCommand.EXIT_ABORTED;
        } finally {
            node.shutdown();
        }
    }
}
