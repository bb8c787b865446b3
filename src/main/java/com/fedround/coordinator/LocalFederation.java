package com.fedround.coordinator;

import com.fedround.data.Dataset;
import com.fedround.data.Partition;
import com.fedround.data.Partitioner;
import com.fedround.exception.InsufficientDataException;
import com.fedround.exception.RunAbortedException;
import com.fedround.trainer.SoftmaxRegressionTrainer;
import com.fedround.worker.FederatedWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Whole federation in one process: one coordinator and {@code workerCount}
 * workers called directly, without RMI.
 * Used for local experimentation and end-to-end tests.
 */
public class LocalFederation {
    private static final Logger log = LoggerFactory.getLogger(LocalFederation.class);

    private final Coordinator coordinator;
    private final List<FederatedWorker> workers;

    private LocalFederation(Coordinator coordinator, List<FederatedWorker> workers) {
        this.coordinator = coordinator;
        this.workers = workers;
    }

    /**
     * Partitions the dataset, creates one worker per partition and registers them all.
     * 
     * @param dataset dataset shared by all workers
     * @param config run configuration, its workerCount and splitRatio drive the partitioning
     * @throws InsufficientDataException if the dataset has fewer rows than workers
     */
    public static LocalFederation create(Dataset dataset, RunConfig config) throws InsufficientDataException {
        List<Partition> partitions = Partitioner.partitionAll(dataset, config.getWorkerCount(),
            config.getSplitRatio());
        SoftmaxRegressionTrainer trainer = SoftmaxRegressionTrainer.forDataset(dataset);

        Coordinator coordinator = new Coordinator(config);
        List<FederatedWorker> workers = new ArrayList<>();
        for (Partition partition : partitions) {
            FederatedWorker worker = new FederatedWorker(partition, trainer);
            workers.add(worker);
            coordinator.registerWorker(partition.getWorkerId(), worker);
        }

        log.info("[OK] Local federation ready: {} worker(s) over {} rows", workers.size(), dataset.size());
        return new LocalFederation(coordinator, workers);
    }

    /**
     * Runs the whole protocol and releases the coordinator's threads.
     */
    public RunResult run() throws RunAbortedException, InterruptedException {
        try {
            return coordinator.run();
        } finally {
            coordinator.shutdown();
        }
    }

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public List<FederatedWorker> getWorkers() {
        return List.copyOf(workers);
    }
}
