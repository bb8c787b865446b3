package com.fedround.manual.node;

import com.fedround.data.Dataset;
import com.fedround.data.DatasetLoader;
import com.fedround.data.Partitioner;
import com.fedround.trainer.SoftmaxRegressionTrainer;
import com.fedround.worker.FederatedWorker;
import com.fedround.worker.WorkerNode;

import java.nio.file.Paths;

/**
 * Manual test: one worker joining the coordinator of {@link TestCoordinatorNode}.
 * 
 * Args: workerId port (default: 0 5002). Uses the bundled crops sample, 2 workers.
 * 
 * Prerequisites:
 *   - Coordinator running on port 5001
 * 
 * Expected behavior:
 *   - Worker binds "worker" on its own registry
 *   - Registration acknowledged with first round 1 (if joined before the run started)
 *   - One fit and one evaluate per round in the log
 */
public class TestWorkerNode {

    public static void main(String[] args) throws Exception {
        int workerId = args.length > 0 ? Integer.parseInt(args[0]) : 0;
        int port = args.length > 1 ? Integer.parseInt(args[1]) : 5002;

        System.out.println("========================================");
        System.out.println("  TEST: Worker " + workerId + " Joining Coordinator");
        System.out.println("========================================");
        System.out.println();

        Dataset data = DatasetLoader.fromCsv(
            Paths.get(TestWorkerNode.class.getResource("/crops-sample.csv").toURI()));
        FederatedWorker worker = new FederatedWorker(Partitioner.partition(data, workerId, 2, 0.8),
            SoftmaxRegressionTrainer.forDataset(data));

        WorkerNode node = new WorkerNode("localhost", port, worker);
        System.out.println("[OK] " + node.joinCoordinator("localhost", 5001));

        node.awaitRunFinished();
        System.out.println("[OK] Run finished: " + worker.getFinalStatus());
        node.shutdown();
    }
}
