package com.fedround.cli.commands;

import com.fedround.data.Dataset;
import com.fedround.data.DatasetLoader;
import com.fedround.data.Partition;
import com.fedround.data.Partitioner;
import com.fedround.exception.InsufficientDataException;
import com.fedround.trainer.SoftmaxRegressionTrainer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Checks a dataset before a run: shape, labels, model size and the shard each worker would get.
 */
@Command(name = "verify", description = "Verify a dataset and show the partition plan")
public class VerifyCommand implements Callable<Integer> {

    @Option(names = {"-d", "--dataset"}, description = "CSV dataset", required = true)
    Path dataset;

    @Option(names = {"--label-column"}, description = "Label column name (default: ${DEFAULT-VALUE})",
        defaultValue = DatasetLoader.DEFAULT_LABEL_COLUMN)
    String labelColumn;

    @Option(names = {"-w", "--workers"}, description = "Number of workers (default: ${DEFAULT-VALUE})",
        defaultValue = "3")
    int workers;

    @Option(names = {"--split-ratio"}, description = "Train fraction of each shard (default: ${DEFAULT-VALUE})",
        defaultValue = "0.8")
    double splitRatio;

    @Override
    public Integer call() throws Exception {
        System.out.println("========================================");
        System.out.println("  FedRound Setup Verification");
        System.out.println("========================================");
        System.out.println();

        Dataset data = DatasetLoader.fromCsv(dataset, labelColumn);
        SoftmaxRegressionTrainer trainer = SoftmaxRegressionTrainer.forDataset(data);

        System.out.println("[OK] Dataset loaded: " + dataset);
        System.out.println("  Rows: " + data.size());
        System.out.println("  Features: " + data.featureCount() + " " + data.featureNames());
        System.out.println("  Labels: " + data.labels());
        System.out.println("  Parameters: " + trainer.parameterCount());
        System.out.println();

        try {
            System.out.println("Partition plan (" + workers + " workers, split " + splitRatio + "):");
            for (Partition partition : Partitioner.partitionAll(data, workers, splitRatio)) {
                System.out.printf("  Worker %d: rows [%d, %d) -> %d train / %d eval%n",
                    partition.getWorkerId(), partition.getStartIndex(), partition.getEndIndex(),
                    partition.getTrainRows().size(), partition.getEvalRows().size());
                if (partition.getTrainRows().isEmpty() || partition.getEvalRows().isEmpty()) {
                    System.out.println("    WARNING: empty train or eval set, this worker will fail every round");
                }
            }
        } catch (InsufficientDataException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 1;
        }

        System.out.println();
        System.out.println("[OK] Setup verified");
        return 0;
    }
}
