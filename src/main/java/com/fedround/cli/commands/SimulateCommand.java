package com.fedround.cli.commands;

import com.fedround.coordinator.LocalFederation;
import com.fedround.coordinator.RunConfig;
import com.fedround.coordinator.RunResult;
import com.fedround.data.Dataset;
import com.fedround.data.DatasetLoader;
import com.fedround.exception.RunAbortedException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Runs coordinator and all workers in this process, without RMI.
 */
@Command(name = "simulate", description = "Run a whole federation in-process")
public class SimulateCommand implements Callable<Integer> {

    @Option(names = {"-d", "--dataset"}, description = "CSV dataset", required = true)
    Path dataset;

    @Option(names = {"--label-column"}, description = "Label column name (default: ${DEFAULT-VALUE})",
        defaultValue = DatasetLoader.DEFAULT_LABEL_COLUMN)
    String labelColumn;

    @Mixin
    RunOptions runOptions;

    @Override
    public Integer call() throws Exception {
        RunConfig config = runOptions.toConfig();
        Dataset data = DatasetLoader.fromCsv(dataset, labelColumn);

        System.out.println("Simulating " + config.getWorkerCount() + " worker(s) over " + data);
        LocalFederation federation = LocalFederation.create(data, config);
        try {
            RunResult result = federation.run();
            RunReport.printHistory(System.out, result.getHistory());
            System.out.println("[OK] Run " + result.getStatus());
            return 0;
        } catch (RunAbortedException e) {
            RunReport.printHistory(System.out, e.getHistory());
            System.err.println("ERROR: " + e.getMessage());
            return CoordinatorCommand.EXIT_ABORTED;
        }
    }
}
